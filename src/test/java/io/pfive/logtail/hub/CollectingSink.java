// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.hub;

import io.pfive.logtail.model.ErrorEvent;
import io.pfive.logtail.model.LineEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/// Records everything a tailer sends, for assertions from the test thread.
public class CollectingSink implements EventSink {

    private final List<LineEvent> lines = new ArrayList<>();
    private final List<ErrorEvent> errors = new ArrayList<>();

    @Override
    public synchronized void publish (LineEvent event) {
        lines.add(event);
    }

    @Override
    public synchronized void reportError (ErrorEvent event) {
        errors.add(event);
    }

    public synchronized List<LineEvent> lines () {
        return List.copyOf(lines);
    }

    /// Content of real lines only, markers left out.
    public synchronized List<String> contents () {
        return lines.stream().filter(e -> !e.isMarker()).map(LineEvent::content).collect(Collectors.toList());
    }

    public synchronized long rotationCount () {
        return lines.stream().filter(LineEvent::rotated).count();
    }

    public synchronized List<ErrorEvent> errors () {
        return List.copyOf(errors);
    }
}
