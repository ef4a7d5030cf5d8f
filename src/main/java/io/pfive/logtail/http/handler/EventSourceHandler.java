// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.http.handler;

import io.pfive.logtail.guard.SecurityViolationException;
import io.pfive.logtail.http.exception.InvalidRequestException;
import io.pfive.logtail.http.exception.SourceNotFoundException;
import io.pfive.logtail.hub.StreamHub;
import io.pfive.logtail.hub.Subscriber;
import io.pfive.logtail.model.ErrorEvent;
import io.pfive.logtail.model.ErrorKind;
import io.pfive.logtail.registry.SourceRegistry;
import io.pfive.logtail.registry.UnknownSourceException;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;
import org.eclipse.jetty.util.Fields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/// This Jetty HTTP handler provides Server-Sent Events (SSE), a standard approach to server-push
/// messaging that is simple, text-based, and unidirectional. See:
/// https://html.spec.whatwg.org/multipage/server-sent-events.html
///
/// GET /events?source=ID[&source=ID...] subscribes the new connection to each named source and
/// hands the held-open response to an EventSource delivery loop. Whenever the client navigates
/// away, closes, or reloads, the connection is closed by the client and the next write fails,
/// which unsubscribes it.
public class EventSourceHandler extends Handler.Abstract {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final String EVENT_STREAM_CONTENT_TYPE = "text/event-stream";

    private final SourceRegistry registry;
    private final StreamHub hub;
    private final ExecutorService deliveryExecutor;
    private final Duration heartbeatInterval;

    public EventSourceHandler (SourceRegistry registry, StreamHub hub, ExecutorService deliveryExecutor,
                               Duration heartbeatInterval) {
        this.registry = registry;
        this.hub = hub;
        this.deliveryExecutor = deliveryExecutor;
        this.heartbeatInterval = heartbeatInterval;
    }

    @Override
    public boolean handle (Request request, Response response, Callback callback) throws Exception {
        if (!request.getMethod().equals("GET")) {
            throw new InvalidRequestException("Method must be GET.");
        }
        Set<String> sourceIds = requestedSources(request);
        for (String sourceId : sourceIds) {
            if (!registry.contains(sourceId)) throw new SourceNotFoundException(sourceId);
        }
        response.getHeaders().add(HttpHeader.CONTENT_TYPE, EVENT_STREAM_CONTENT_TYPE);
        response.getHeaders().add(HttpHeader.CACHE_CONTROL, "no-cache");
        response.setStatus(HttpStatus.OK_200);

        Subscriber subscriber = hub.createSubscriber();
        for (String sourceId : sourceIds) {
            try {
                registry.subscribe(sourceId, subscriber.id);
            } catch (SecurityViolationException e) {
                // Refused sources are reported once on this stream and otherwise ignored.
                subscriber.offer(new ErrorEvent(sourceId, ErrorKind.SECURITY_VIOLATION, e.getMessage()));
            } catch (UnknownSourceException e) {
                // Retired by a directory scan since the check above.
                subscriber.offer(new ErrorEvent(sourceId, ErrorKind.SOURCE_UNAVAILABLE, e.getMessage()));
            }
        }
        LOG.debug("Subscriber {} connected for sources {}.", subscriber.id, sourceIds);
        try {
            deliveryExecutor.execute(new EventSource(subscriber, response, callback, registry, heartbeatInterval));
        } catch (RejectedExecutionException e) {
            registry.removeSubscriber(subscriber.id);
            throw e;
        }
        // Inform Jetty we are handling this request and will eventually invoke
        // callback.succeeded() or callback.failed().
        return true;
    }

    private static Set<String> requestedSources (Request request) {
        Fields fields = Request.extractQueryParameters(request);
        Fields.Field field = fields.get("source");
        if (field == null) {
            throw new InvalidRequestException("At least one 'source' parameter is required.");
        }
        Set<String> sourceIds = new LinkedHashSet<>();
        for (String value : field.getValues()) {
            if (value != null && !value.isBlank()) sourceIds.add(value.trim());
        }
        if (sourceIds.isEmpty()) {
            throw new InvalidRequestException("At least one 'source' parameter is required.");
        }
        return sourceIds;
    }
}
