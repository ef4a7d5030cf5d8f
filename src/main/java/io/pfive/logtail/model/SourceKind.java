// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.model;

public enum SourceKind {
    LOCAL_FILE,  // A file on the machine running the engine, followed with filesystem notifications.
    REMOTE_FILE  // A file on a RemoteHost, followed by a long-running tail command over a pooled session.
}
