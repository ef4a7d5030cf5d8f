// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.tail;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/// Tunables shared by every tailer.
/// @param maxLineLength bytes, beyond which a line is cut and flagged as truncated.
/// @param backlogBytes how much existing content to emit when a tailer starts.
/// @param pollInterval upper bound on how long a local tailer waits for a change notification.
public record TailSettings (
    int maxLineLength,
    long backlogBytes,
    boolean stripAnsi,
    Duration pollInterval,
    Duration reconnectBase,
    Duration reconnectCap,
    double reconnectJitter,
    int maxReconnectAttempts
) {
    public TailSettings {
        checkArgument(maxLineLength > 0, "maxLineLength must be positive.");
        checkArgument(backlogBytes >= 0, "backlogBytes must not be negative.");
        checkArgument(maxReconnectAttempts >= 0, "maxReconnectAttempts must not be negative.");
        checkArgument(reconnectJitter >= 0 && reconnectJitter < 1, "reconnectJitter must be in [0, 1).");
    }

    public Backoff backoff () {
        return new Backoff(reconnectBase.toMillis(), reconnectCap.toMillis(), reconnectJitter);
    }
}
