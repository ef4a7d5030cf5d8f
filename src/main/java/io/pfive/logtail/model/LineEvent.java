// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/// One line of a source, or a synthetic marker. Marker events carry an empty content string.
/// Rotation markers take the next seq of their source like any line. Gap markers are created by a
/// Subscriber when it drops lines and carry the seq of the last line it dropped, so the seq of
/// real lines a subscriber sees remains strictly increasing.
/// The three flags are only written to JSON when true.
public record LineEvent (
    String sourceId,
    long seq,
    Instant timestamp,
    String content,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean truncated,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean gap,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean rotated
) implements StreamEvent {

    public static LineEvent line (String sourceId, long seq, Instant timestamp, String content, boolean truncated) {
        return new LineEvent(sourceId, seq, timestamp, content, truncated, false, false);
    }

    public static LineEvent rotationMarker (String sourceId, long seq, Instant timestamp) {
        return new LineEvent(sourceId, seq, timestamp, "", false, false, true);
    }

    public static LineEvent gapMarker (String sourceId, long lastDroppedSeq, Instant timestamp) {
        return new LineEvent(sourceId, lastDroppedSeq, timestamp, "", false, true, false);
    }

    @JsonIgnore
    public boolean isMarker () {
        return gap || rotated;
    }

    @Override
    public String eventType () {
        return "line";
    }
}
