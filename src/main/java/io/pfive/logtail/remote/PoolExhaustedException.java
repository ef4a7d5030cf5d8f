// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import io.pfive.logtail.model.RemoteHost;

public class PoolExhaustedException extends RemoteAccessException {

    public PoolExhaustedException (RemoteHost host, String message) {
        super(host, message, null);
    }

    @Override
    public Failure failure () {
        return Failure.POOL_EXHAUSTED;
    }
}
