// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import java.io.InputStream;

/// A command running on a remote host. Closing it stops the command without affecting the
/// connection it runs on, which can then carry further commands.
public interface RemoteProcess extends AutoCloseable {

    InputStream stdout ();

    /// Whatever the command has written to its error stream so far, possibly cut short.
    String stderr ();

    /// Take the next point at which a follow command reported that its file was truncated or
    /// replaced and it started reading the new file from the beginning. The point is the number of
    /// stdout bytes the command had sent before it started over. Points are taken in order.
    /// @return the next point, or -1 if none is pending.
    default long pollRestart () {
        return -1;
    }

    @Override
    void close ();

}
