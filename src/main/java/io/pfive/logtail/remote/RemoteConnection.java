// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import java.util.List;

/// One authenticated transport-level connection. Not thread safe: the pool guarantees that only the
/// holder of the lease uses it.
public interface RemoteConnection extends AutoCloseable {

    /// Cheap local check that does no I/O.
    boolean isOpen ();

    /// Round trip to the server to confirm the connection is still usable.
    boolean probe ();

    /// Start a command on the remote host. Arguments are passed individually and quoted by the
    /// transport. Callers must already have run the command through the AccessGuard.
    /// @throws UnreachableException if the command can't be started on this connection.
    RemoteProcess exec (List<String> argv);

    @Override
    void close ();

}
