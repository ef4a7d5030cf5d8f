// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.tail;

import io.pfive.logtail.hub.EventSink;
import io.pfive.logtail.model.Source;

import java.util.concurrent.atomic.AtomicLong;

/// Creates the right kind of tailer for a source. The registry holds one of these rather than
/// constructing tailers itself, so its lifecycle rules can be tested with tailers that do no I/O.
public interface TailerFactory {

    SourceTailer create (Source source, EventSink sink, AtomicLong seq);

}
