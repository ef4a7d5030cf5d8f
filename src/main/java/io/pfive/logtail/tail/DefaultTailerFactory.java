// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.tail;

import io.pfive.logtail.hub.EventSink;
import io.pfive.logtail.model.Source;
import io.pfive.logtail.remote.RemoteSessionPool;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

public class DefaultTailerFactory implements TailerFactory {

    private final TailSettings settings;
    private final RemoteSessionPool pool;
    private final Clock clock;

    public DefaultTailerFactory (TailSettings settings, RemoteSessionPool pool, Clock clock) {
        this.settings = settings;
        this.pool = pool;
        this.clock = clock;
    }

    @Override
    public SourceTailer create (Source source, EventSink sink, AtomicLong seq) {
        return switch (source.kind) {
            case LOCAL_FILE -> new LocalFileTailer(source, sink, settings, seq, clock);
            case REMOTE_FILE -> new RemoteFileTailer(source, sink, settings, seq, clock, pool);
        };
    }
}
