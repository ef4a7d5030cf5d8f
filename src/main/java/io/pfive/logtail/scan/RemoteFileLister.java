// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.scan;

import io.pfive.logtail.remote.RemoteCommands;
import io.pfive.logtail.remote.RemoteSessionPool;

import java.util.ArrayList;
import java.util.List;

/// Lists a remote directory with find over a pooled session.
public class RemoteFileLister implements FileLister {

    private final RemoteSessionPool pool;

    public RemoteFileLister (RemoteSessionPool pool) {
        this.pool = pool;
    }

    @Override
    public List<String> list (DirectorySpec directory) {
        List<String> argv = new ArrayList<>(List.of("find", directory.root()));
        if (!directory.recursive()) {
            argv.addAll(List.of("-maxdepth", "1"));
        }
        argv.addAll(List.of("-type", "f", "-name", directory.pattern()));
        String output = RemoteCommands.run(pool, directory.host(), argv);
        List<String> files = new ArrayList<>();
        for (String line : output.split("\n")) {
            String path = line.trim();
            if (path.startsWith("/")) files.add(path);
        }
        files.sort(null);
        return files.size() > MAX_FILES ? files.subList(0, MAX_FILES) : files;
    }

}
