// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.model;

import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;

/// Authentication material for a remote host. The secret is either the path to a private key file
/// or a password. It is opaque to everything except the SSH transport, and toString never reveals it.
public final class Credential {

    public enum Method {
        KEY,
        PASSWORD;

        public static Method fromString (String value) {
            if (value == null || value.isBlank()) return KEY;
            return Method.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public final Method method;
    private final String secret;

    private Credential (Method method, String secret) {
        checkArgument(secret != null && !secret.isBlank(), "Credential for %s authentication is missing.", method);
        this.method = method;
        this.secret = secret;
    }

    public static Credential key (String keyPath) {
        return new Credential(Method.KEY, keyPath);
    }

    public static Credential password (String password) {
        return new Credential(Method.PASSWORD, password);
    }

    /// Only the SSH transport should call this.
    public String secret () {
        return secret;
    }

    @Override
    public String toString () {
        return "Credential[" + method + ", ****]";
    }
}
