// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.model;

public record ErrorEvent (String sourceId, ErrorKind errorKind, String message) implements StreamEvent {

    @Override
    public String eventType () {
        return "error";
    }
}
