// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.util;

/// Thrown when get() is called on an Err rather than an Ok variant of Ret. Callers that expect a
/// value and have no sensible fallback use this to turn the error message into an exception.
public class MissingReturnValueException extends RuntimeException {
    public MissingReturnValueException (String message) {
        super(message);
    }
}
