// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.tail;

import io.pfive.logtail.hub.EventSink;
import io.pfive.logtail.model.Source;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/// Makes tailers that do no I/O: each emits one line saying it started, then idles until stopped.
public class StubTailerFactory implements TailerFactory {

    private static final TailSettings SETTINGS = new TailSettings(1024, 0, false, Duration.ofMillis(10),
        Duration.ofMillis(1), Duration.ofMillis(1), 0, 0);

    private final List<SourceTailer> created = new ArrayList<>();

    @Override
    public synchronized SourceTailer create (Source source, EventSink sink, AtomicLong seq) {
        SourceTailer tailer = new IdleTailer(source, sink, seq);
        created.add(tailer);
        return tailer;
    }

    public synchronized List<SourceTailer> created () {
        return List.copyOf(created);
    }

    public synchronized long createdFor (String sourceId) {
        return created.stream().filter(t -> t.source().id.equals(sourceId)).count();
    }

    static class IdleTailer extends SourceTailer {
        IdleTailer (Source source, EventSink sink, AtomicLong seq) {
            super(source, sink, SETTINGS, seq, Clock.systemUTC());
        }

        @Override
        protected void follow () throws InterruptedException {
            setState(TailerState.STREAMING);
            emit(new LineSplitter.Line("started", false));
            while (!stopRequested()) {
                Thread.sleep(10);
            }
        }
    }
}
