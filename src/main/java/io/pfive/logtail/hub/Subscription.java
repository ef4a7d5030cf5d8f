// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.hub;

/// Handle for one subscriber's interest in one source, returned by subscribe and given back to unsubscribe.
public record Subscription (String sourceId, String subscriberId) { }
