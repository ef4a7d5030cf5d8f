// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.http.exception;

/// Superclass for all exceptions representing problems occurring on an HTTP server, which can be
/// translated into HTTP response codes and messages. Throwing these avoids calling Jetty helper
/// functions with relatively complicated signatures every place a handler wants to bail out.
/// They are all caught and turned into responses by the wrapping ExceptionHandler.
public abstract class HttpServerException extends RuntimeException {
    public HttpServerException (String message) {
        super(message);
    }
    public abstract ErrorType errorType ();
    public enum ErrorType {
        REQUEST(400),
        NOT_FOUND(404);
        // Internal server errors should always be unexpected, so are never created intentionally.
        public final int httpCode;
        ErrorType (int httpCode) {
            this.httpCode = httpCode;
        }
    }
}
