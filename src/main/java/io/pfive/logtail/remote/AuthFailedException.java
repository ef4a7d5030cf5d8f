// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import io.pfive.logtail.model.RemoteHost;

public class AuthFailedException extends RemoteAccessException {

    public AuthFailedException (RemoteHost host, String message, Throwable cause) {
        super(host, message, cause);
    }

    @Override
    public Failure failure () {
        return Failure.AUTH_FAILED;
    }
}
