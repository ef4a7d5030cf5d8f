// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.scan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// The glob is matched against the file name only, as find -name does for remote directories, so
/// the same pattern selects the same files wherever the directory lives.
public class LocalFileLister implements FileLister {

    @Override
    public List<String> list (DirectorySpec directory) throws IOException {
        Path root = Path.of(directory.root());
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + directory.pattern());
        int depth = directory.recursive() ? Integer.MAX_VALUE : 1;
        try (Stream<Path> paths = Files.walk(root, depth)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(path.getFileName()))
                .map(path -> path.toAbsolutePath().toString())
                .sorted()
                .limit(MAX_FILES)
                .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            // Files.walk reports trouble in subdirectories this way, part way through the stream.
            throw e.getCause();
        }
    }

}
