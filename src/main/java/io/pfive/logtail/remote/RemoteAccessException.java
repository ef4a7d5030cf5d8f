// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import io.pfive.logtail.model.RemoteHost;

/// Superclass for failures reaching or using a remote host. The Failure kind lets callers decide
/// on retry policy without a chain of instanceof checks.
public abstract class RemoteAccessException extends RuntimeException {

    public enum Failure {
        /// Every session for the host is leased and none came back within the wait timeout. Transient.
        POOL_EXHAUSTED,
        /// The host was reached but refused our credentials or presented an unverified host key.
        AUTH_FAILED,
        /// The host could not be reached, or an established connection or command stream broke.
        UNREACHABLE
    }

    public final RemoteHost host;

    protected RemoteAccessException (RemoteHost host, String message, Throwable cause) {
        super(host.key() + ": " + message, cause);
        this.host = host;
    }

    public abstract Failure failure ();

}
