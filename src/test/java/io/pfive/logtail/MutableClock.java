// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/// A clock that only moves when told to.
public class MutableClock extends Clock {

    private final AtomicReference<Instant> now;

    public MutableClock (Instant start) {
        this.now = new AtomicReference<>(start);
    }

    public MutableClock () {
        this(Instant.parse("2025-01-01T00:00:00Z"));
    }

    public void advance (Duration duration) {
        now.updateAndGet(instant -> instant.plus(duration));
    }

    @Override
    public Instant instant () {
        return now.get();
    }

    @Override
    public ZoneId getZone () {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone (ZoneId zone) {
        return this;
    }
}
