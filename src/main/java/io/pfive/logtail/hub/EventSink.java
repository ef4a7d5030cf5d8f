// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.hub;

import io.pfive.logtail.model.ErrorEvent;
import io.pfive.logtail.model.LineEvent;

/// Where tailers send what they read. Implementations must never block the caller on a slow consumer.
public interface EventSink {

    void publish (LineEvent event);

    void reportError (ErrorEvent event);

}
