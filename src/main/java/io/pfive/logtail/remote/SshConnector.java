// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import io.pfive.logtail.model.RemoteHost;

/// Opens authenticated connections to remote hosts. This is the seam between the session pool and
/// the SSH library, allowing the pool and the remote tailer to be exercised against an in-memory
/// transport.
public interface SshConnector {

    /// @throws AuthFailedException if the host rejects the credential or its host key can't be verified.
    /// @throws UnreachableException for any other failure to establish the connection.
    RemoteConnection connect (RemoteHost host);

}
