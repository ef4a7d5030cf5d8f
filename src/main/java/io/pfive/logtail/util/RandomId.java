// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.util;

import java.util.UUID;

public abstract class RandomId {

    /// Subscriber IDs travel to the browser in the connect event and come back in logs, so they are
    /// plain lowercase hex without separators.
    public static String createRandomStringId () {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
