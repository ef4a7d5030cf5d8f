// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.http.exception;

/// Responds "404 Not Found" when a request names a source ID the registry has never heard of.
public class SourceNotFoundException extends HttpServerException {
    public SourceNotFoundException (String sourceId) {
        super("No such source: " + sourceId);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.NOT_FOUND;
    }
}
