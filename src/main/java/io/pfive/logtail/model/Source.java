// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.model;

import com.google.common.base.MoreObjects;
import com.google.common.hash.Hashing;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/// One concrete log file that can be tailed. Instances are only created from paths that have
/// already passed the Access Guard. Everything is immutable except the size and file identity
/// bookkeeping, which is written only by the Tailer currently following this source and read by
/// anyone (hence volatile rather than locked).
public final class Source {

    public final String id;
    public final String name;
    public final SourceKind kind;
    /// Absolute, normalized path on the machine where the file lives.
    public final String path;
    /// Null for local sources.
    public final RemoteHost host;
    public final Charset encoding;
    /// Tail continuously even with no subscribers.
    public final boolean alwaysOn;
    /// ID of the directory source this file was discovered in, or null if it was configured directly.
    public final String origin;

    private volatile long lastKnownSize = -1;
    private volatile Object lastKnownFileKey;

    private Source (String name, SourceKind kind, String path, RemoteHost host, Charset encoding,
                    boolean alwaysOn, String origin) {
        checkArgument(name != null && !name.isBlank(), "Source name is required.");
        checkArgument(path != null && path.startsWith("/"), "Source path must be absolute: %s", path);
        checkArgument((kind == SourceKind.REMOTE_FILE) == (host != null), "Remote sources need a host, local ones must not have one.");
        this.name = name;
        this.kind = kind;
        this.path = path;
        this.host = host;
        this.encoding = (encoding == null) ? StandardCharsets.UTF_8 : encoding;
        this.alwaysOn = alwaysOn;
        this.origin = origin;
        this.id = deriveId(name, kind, host, path);
    }

    public static Source local (String name, Path path, Charset encoding, boolean alwaysOn, String origin) {
        checkNotNull(path, "path");
        return new Source(name, SourceKind.LOCAL_FILE, path.toAbsolutePath().toString().replace('\\', '/'),
            null, encoding, alwaysOn, origin);
    }

    public static Source remote (String name, RemoteHost host, String path, Charset encoding, boolean alwaysOn, String origin) {
        checkNotNull(host, "host");
        return new Source(name, SourceKind.REMOTE_FILE, path, host, encoding, alwaysOn, origin);
    }

    /// Source IDs are stable across restarts: a readable slug of the configured name, plus a short
    /// hash of where the file actually lives so that two sources with similar names never collide.
    public static String deriveId (String name, SourceKind kind, RemoteHost host, String path) {
        String location = kind + "|" + (host == null ? "" : host.key()) + "|" + path;
        String hash = Hashing.sha256().hashString(location, StandardCharsets.UTF_8).toString().substring(0, 10);
        return slug(name) + "-" + hash;
    }

    private static String slug (String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._]+", "-").replaceAll("(^-+|-+$)", "");
        return slug.isEmpty() ? "source" : slug;
    }

    public boolean isRemote () {
        return kind == SourceKind.REMOTE_FILE;
    }

    public Path localPath () {
        checkState(kind == SourceKind.LOCAL_FILE, "Source %s is not local.", id);
        return Path.of(path);
    }

    public void recordPosition (long size, Object fileKey) {
        this.lastKnownSize = size;
        this.lastKnownFileKey = fileKey;
    }

    public long lastKnownSize () {
        return lastKnownSize;
    }

    public Object lastKnownFileKey () {
        return lastKnownFileKey;
    }

    @Override
    public String toString () {
        return MoreObjects.toStringHelper(this)
            .add("id", id)
            .add("kind", kind)
            .add("host", host)
            .add("path", path)
            .toString();
    }
}
