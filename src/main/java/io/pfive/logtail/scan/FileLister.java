// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.scan;

import java.io.IOException;
import java.util.List;

public interface FileLister {

    /// No listing ever returns more than this many files.
    int MAX_FILES = 1000;

    /// Absolute paths of the regular files under the directory's root matching its pattern, in a
    /// stable order.
    List<String> list (DirectorySpec directory) throws IOException;

}
