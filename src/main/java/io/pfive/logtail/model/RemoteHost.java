// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.model;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// A remote machine reached over SSH. Shared read-only by every Source on that host and used by the
/// session pool as its key. Identity (equals/hashCode) is user, host and port only, which is why
/// the sources file may name each account just once.
public final class RemoteHost {

    public static final int DEFAULT_PORT = 22;
    public static final long DEFAULT_MAX_FILE_SIZE = 100L * 1024 * 1024;

    public final String name;
    public final String host;
    public final int port;
    public final String user;
    public final Credential credential;
    public final HostKeyPolicy hostKeyPolicy;
    /// May be null, in which case the transport uses the user's default known hosts file.
    public final String knownHosts;
    public final List<String> allowedPaths;
    public final long maxFileSize;

    public RemoteHost (String name, String host, int port, String user, Credential credential,
                       HostKeyPolicy hostKeyPolicy, String knownHosts, List<String> allowedPaths,
                       long maxFileSize) {
        checkArgument(host != null && !host.isBlank(), "Remote host name is required.");
        checkArgument(user != null && !user.isBlank(), "Remote user is required for host %s.", host);
        checkArgument(port > 0 && port < 65536, "Invalid port %s for host %s.", port, host);
        checkArgument(allowedPaths != null && !allowedPaths.isEmpty(),
            "Remote host %s must declare at least one allowed path.", host);
        checkArgument(maxFileSize > 0, "maxFileSize must be positive for host %s.", host);
        this.name = (name == null || name.isBlank()) ? host : name;
        this.host = host;
        this.port = port;
        this.user = user;
        this.credential = checkNotNull(credential, "credential");
        this.hostKeyPolicy = checkNotNull(hostKeyPolicy, "hostKeyPolicy");
        this.knownHosts = knownHosts;
        this.allowedPaths = List.copyOf(allowedPaths);
        this.maxFileSize = maxFileSize;
    }

    /// Identity string used to key the session pool and in log messages.
    public String key () {
        return user + "@" + host + ":" + port;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof RemoteHost other)) return false;
        return port == other.port && host.equals(other.host) && user.equals(other.user);
    }

    @Override
    public int hashCode () {
        return Objects.hash(host, port, user);
    }

    @Override
    public String toString () {
        return key();
    }
}
