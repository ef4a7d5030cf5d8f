// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.model;

/// Anything that can travel from a Tailer through the Hub to a Subscriber. The event type name is
/// used as the server-sent event type on the wire.
public interface StreamEvent {

    String sourceId ();

    String eventType ();

}
