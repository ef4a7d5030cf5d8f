// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.http.handler;

import io.pfive.logtail.hub.Subscriber;
import io.pfive.logtail.model.StreamEvent;
import io.pfive.logtail.registry.SourceRegistry;
import io.pfive.logtail.util.JettyUtil;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Blocker;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/// Holds the Jetty Response and Callback for a single held-open connection to which the server is
/// sending events, and runs the delivery loop for the Subscriber behind it.
///
/// The loop takes events from the subscriber's queue and writes each one, waiting for the write
/// to complete before taking the next. A slow client therefore only slows its own loop: events
/// pile up in its bounded queue where the oldest are dropped, and nothing upstream waits. When
/// nothing has been sent for the heartbeat interval a comment line is written, which keeps proxies
/// from closing an idle stream and is also how we notice a client that went away silently.
/// Any write failure ends the loop and removes the subscriber from every source.
public class EventSource implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Subscriber subscriber;
    private final Response response;
    private final Callback originalCallback;
    private final SourceRegistry registry;
    private final Duration heartbeatInterval;

    public EventSource (Subscriber subscriber, Response response, Callback callback, SourceRegistry registry,
                        Duration heartbeatInterval) {
        this.subscriber = subscriber;
        this.response = response;
        this.originalCallback = callback;
        this.registry = registry;
        this.heartbeatInterval = heartbeatInterval;
    }

    @Override
    public void run () {
        Throwable failure = null;
        try {
            sendConnectEvent();
            while (!subscriber.isClosed()) {
                StreamEvent event = subscriber.poll(heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (event == null) {
                    if (subscriber.isClosed()) break;
                    write(": ping\n\n");
                } else {
                    sendEvent(event.eventType(), JettyUtil.toJson(event));
                }
            }
        } catch (IOException e) {
            LOG.debug("Event write failed for subscriber {}, probably due to client disconnect: {}", subscriber.id, e.toString());
            failure = e;
        } catch (InterruptedException e) {
            LOG.debug("Delivery to subscriber {} interrupted.", subscriber.id);
            failure = e;
        } catch (RuntimeException e) {
            LOG.error("Delivery to subscriber {} failed unexpectedly.", subscriber.id, e);
            failure = e;
        } finally {
            registry.removeSubscriber(subscriber.id);
            LOG.debug("Subscriber {} disconnected.", subscriber.id);
        }
        if (failure == null) {
            // The subscriber was closed on our side, for example at shutdown. End the response normally.
            originalCallback.succeeded();
        } else {
            originalCallback.failed(failure);
        }
    }

    /// Send a server-sent event: an "event" line naming the type and a single "data" line,
    /// terminated with a blank line. Data is always compact JSON, so never contains a line break.
    void sendEvent (String eventType, String data) throws IOException {
        write("event: " + eventType + "\ndata: " + data + "\n\n");
    }

    /// Sent first on every stream to share the server-generated subscriber ID with the client.
    void sendConnectEvent () throws IOException {
        sendEvent("connect", JettyUtil.toJson(Map.of("subscriberId", subscriber.id)));
        LOG.debug("New event stream assigned subscriber ID {}.", subscriber.id);
    }

    private void write (String text) throws IOException {
        try (Blocker.Callback blocker = Blocker.callback()) {
            response.write(false, JettyUtil.wrapString(text), blocker);
            blocker.block();
        }
    }

}
