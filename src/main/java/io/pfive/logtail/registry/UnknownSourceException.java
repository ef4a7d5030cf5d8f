// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.registry;

public class UnknownSourceException extends RuntimeException {

    public final String sourceId;

    public UnknownSourceException (String sourceId) {
        super("No source with ID " + sourceId);
        this.sourceId = sourceId;
    }
}
