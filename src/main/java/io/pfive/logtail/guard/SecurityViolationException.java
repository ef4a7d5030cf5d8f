// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.guard;

/// Thrown when a rejected path or command would otherwise have to be acted upon. A source that
/// fails this way is never started.
public class SecurityViolationException extends RuntimeException {

    public final Violation violation;

    public SecurityViolationException (Violation violation, String message) {
        super(violation.wireName + ": " + message);
        this.violation = violation;
    }
}
