// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.registry;

import io.pfive.logtail.guard.Violation;

/// A configured source the AccessGuard refused. Kept so it can be listed with its reason, and so
/// that a viewer asking for it is told why rather than that it doesn't exist.
/// @param host null for a local path.
public record RejectedSource (String id, String name, String host, String path, Violation violation, String reason) { }
