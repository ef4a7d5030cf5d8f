// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.guard;

/// Machine-readable reasons for an Access Guard rejection. The wire name is what appears in logs
/// and in the source listing, so it should stay stable.
public enum Violation {

    PATH_OUTSIDE_WHITELIST("path-outside-whitelist"),
    PATH_DENYLISTED("path-denylisted"),
    COMMAND_VERB_NOT_ALLOWED("command-verb-not-allowed"),
    COMMAND_HAS_METACHARACTER("command-has-metacharacter"),
    SIZE_EXCEEDED("size-exceeded");

    public final String wireName;

    Violation (String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String toString () {
        return wireName;
    }
}
