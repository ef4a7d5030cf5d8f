// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.util;

import java.util.function.Function;

/// The return value of an operation, containing either a result or an error.
///
/// Optional does not tell you why a value is absent, and exceptions are awkward for checks that
/// are expected to fail routinely (a path outside the whitelist is not exceptional, it's the
/// common case for a hostile request). Ret lets pure validation functions report what went wrong
/// without throwing, and lets the caller decide whether the failure should abort anything.
///
/// Ok and Err are subclasses of abstract Ret, so neither carries an empty field for the other.
/// Err is deliberately not final: components can subclass it to attach a machine-readable reason
/// alongside the human-readable message (see AccessGuard.Rejection).
public abstract class Ret<T> {

    public boolean isErr () {
        return false;
    }

    public boolean isOk () {
        return false;
    }

    /// If the return value is Ok, returns the value. If it is an error, throw an exception.
    public final T get () {
        return getOrThrow(MissingReturnValueException::new);
    }

    public abstract T getOrThrow (Function<String, RuntimeException> exceptionFactory);

    /// Returns the error message. Will throw an exception if a return value is present instead of error.
    public abstract String errorMessage ();

    // Static factories so callers can write: return ok(x); or return err("Description");

    public static <T> Ok<T> ok (T result) {
        return new Ok<>(result);
    }

    public static <T> Err<T> err (String message) {
        return new Err<>(message);
    }

    /// Re-type an error so it can be returned from a function with a different result type, as in
    /// the Rust ? operator. Calling this on an Ok is a programming error.
    public abstract <X> Ret<X> propagate ();

    private static void checkNotNull (Object o) {
        if (o == null) {
            throw new IllegalArgumentException("Supplied result or error must not be null.");
        }
    }

    /// Java already defines an Error type ("very bad exception you should not catch"), so the
    /// failure variant is called Err and scoped inside Ret.
    public static class Err<T> extends Ret<T> {
        public final String message; // Cannot be null.

        public Err (String message) {
            checkNotNull(message);
            this.message = message;
        }

        @Override
        public boolean isErr () {
            return true;
        }

        @Override
        public <X> Ret<X> propagate () {
            return new Err<>(this.message);
        }

        @Override
        public T getOrThrow (Function<String, RuntimeException> exceptionFactory) {
            throw exceptionFactory.apply(message);
        }

        @Override
        public String errorMessage () {
            return message;
        }

        @Override
        public String toString () {
            return "Err<%s>".formatted(message);
        }
    }

    public static class Ok<T> extends Ret<T> {
        public final T result; // Cannot be null.

        public Ok (T result) {
            checkNotNull(result);
            this.result = result;
        }

        @Override
        public boolean isOk () {
            return true;
        }

        @Override
        public <X> Ret<X> propagate () {
            throw new IllegalStateException("Only errors can be propagated to a different result type.");
        }

        @Override
        public T getOrThrow (Function<String, RuntimeException> exceptionFactory) {
            return result;
        }

        @Override
        public String errorMessage () {
            throw new IllegalStateException("This is not an error, so has no error message.");
        }

        @Override
        public String toString () {
            return "Ok<%s>".formatted(result.toString());
        }
    }

}
