// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.scan;

import io.pfive.logtail.model.RemoteHost;
import io.pfive.logtail.model.Source;
import io.pfive.logtail.model.SourceKind;

import java.nio.charset.Charset;
import java.util.List;

/// A directory source: a scan root whose root path has already passed the AccessGuard, and a glob
/// that picks out the files in it to tail. Each matching file is validated again on its own before
/// it becomes a Source, against the same allowed paths.
/// @param host null for a local directory.
public record DirectorySpec (
    String id,
    String name,
    String root,
    String pattern,
    boolean recursive,
    Charset encoding,
    RemoteHost host,
    List<String> allowedPaths,
    boolean alwaysOn
) {
    public static DirectorySpec of (String name, String root, String pattern, boolean recursive, Charset encoding,
                                    RemoteHost host, List<String> allowedPaths, boolean alwaysOn) {
        String id = Source.deriveId(name, kind(host), host, root + "/" + pattern + (recursive ? "/**" : ""));
        return new DirectorySpec(id, name, root, pattern, recursive, encoding, host, List.copyOf(allowedPaths), alwaysOn);
    }

    private static SourceKind kind (RemoteHost host) {
        return host == null ? SourceKind.LOCAL_FILE : SourceKind.REMOTE_FILE;
    }

    public boolean isRemote () {
        return host != null;
    }
}
