// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.model;

import java.util.Locale;

/// How the identity of a remote host is established before credentials are sent to it.
public enum HostKeyPolicy {

    /// The host key must already be in the known hosts file. This is the default.
    VERIFY,

    /// Unknown host keys are accepted. Must be requested explicitly, and is logged every time a
    /// session is opened under it.
    AUTO_ACCEPT;

    public static HostKeyPolicy fromString (String value) {
        if (value == null || value.isBlank()) return VERIFY;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "verify", "strict" -> VERIFY;
            case "auto-accept", "auto_accept" -> AUTO_ACCEPT;
            default -> throw new IllegalArgumentException("Unknown host key policy: " + value);
        };
    }
}
