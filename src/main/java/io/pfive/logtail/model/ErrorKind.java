// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.model;

import com.fasterxml.jackson.annotation.JsonValue;

/// Per-source failures that are surfaced to subscribers. Everything else is recovered inside the
/// Tailer that saw it.
public enum ErrorKind {
    SOURCE_UNAVAILABLE("SourceUnavailable"),
    SECURITY_VIOLATION("SecurityViolation"),
    POOL_EXHAUSTED("PoolExhausted");

    private final String wireName;

    ErrorKind (String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName () {
        return wireName;
    }
}
