// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.http.handler;

import io.pfive.logtail.http.exception.HttpServerException;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

import static io.pfive.logtail.util.JettyUtil.respond;
import static io.pfive.logtail.util.JettyUtil.respondServerError;

/// This handler wraps other handlers to catch any exceptions they produce. These exceptions are
/// converted into messages in the response body with appropriate HTTP response codes, rather than
/// a general-purpose 500 error page. It also avoids chains of conditional return statements
/// passing error objects back up the stack.
public class ExceptionHandler extends Handler.Wrapper {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public ExceptionHandler (Handler handler) {
        super(handler);
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        try {
            return super.handle(request, response, callback);
        } catch (HttpServerException e) {
            // Covers the whole hierarchy with its different response codes. These are expected in
            // normal operation, so no stack trace.
            LOG.debug("{} {} rejected: {}", request.getMethod(), request.getHttpURI().getPath(), e.getMessage());
            return respond(e.errorType().httpCode, e.getMessage(), response, callback);
        } catch (Throwable t) {
            // Unexpected, and not associated with any HTTP code. Log the whole stack trace and
            // return the exception type to facilitate debugging.
            LOG.error("Unexpected error handling {} {}.", request.getMethod(), request.getHttpURI().getPath(), t);
            return respondServerError(briefThrowableMessage(t), response, callback);
        }
    }

    /// Create a one-line message consisting of only the exception class name and its message (if
    /// any). Some exceptions may be constructed with no message so getMessage returns null.
    public static String briefThrowableMessage (Throwable throwable) {
        String message = throwable.getMessage();
        String className = throwable.getClass().getSimpleName();
        if (message == null) {
            return className;
        } else {
            return className + ": " + message;
        }
    }

}
