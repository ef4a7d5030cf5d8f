// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.http.handler;

import io.pfive.logtail.http.exception.InvalidRequestException;
import io.pfive.logtail.http.model.SourceList;
import io.pfive.logtail.registry.SourceRegistry;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;

import static io.pfive.logtail.util.JettyUtil.respondJson;

/// GET /sources lists every registered source with its tailing state, and every configured source
/// that was refused along with the reason.
public class SourceListHandler extends Handler.Abstract {

    private final SourceRegistry registry;

    public SourceListHandler (SourceRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        if (!request.getMethod().equals("GET")) {
            throw new InvalidRequestException("Method must be GET.");
        }
        return respondJson(SourceList.from(registry.sources(), registry.rejected()), response, callback);
    }
}
