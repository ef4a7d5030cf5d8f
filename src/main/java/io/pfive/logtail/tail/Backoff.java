// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.tail;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

import static com.google.common.base.Preconditions.checkArgument;

/// Capped exponential backoff with proportional jitter: attempt n waits about base * 2^(n-1),
/// never more than cap, randomly stretched or shrunk by up to the jitter fraction. Jitter keeps
/// tailers that lost the same host at the same moment from reconnecting in lockstep.
public class Backoff {

    private final long baseMs;
    private final long capMs;
    private final double jitter;
    private final Random random;

    public Backoff (long baseMs, long capMs, double jitter) {
        this(baseMs, capMs, jitter, null);
    }

    Backoff (long baseMs, long capMs, double jitter, Random random) {
        checkArgument(baseMs >= 0 && capMs >= baseMs, "Backoff needs 0 <= base <= cap.");
        this.baseMs = baseMs;
        this.capMs = capMs;
        this.jitter = jitter;
        this.random = random;
    }

    /// @param attempt the number of consecutive failures so far, starting at 1.
    public long delayMillis (int attempt) {
        checkArgument(attempt >= 1, "Attempts are numbered from 1.");
        double exponential = baseMs * Math.pow(2, Math.min(attempt - 1, 30));
        double capped = Math.min(capMs, exponential);
        double unit = (random == null) ? ThreadLocalRandom.current().nextDouble() : random.nextDouble();
        double jittered = capped * (1 + jitter * (2 * unit - 1));
        return Math.max(0, Math.min(capMs, Math.round(jittered)));
    }
}
