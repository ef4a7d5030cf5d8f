// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.guard;

import io.pfive.logtail.util.Ret;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static io.pfive.logtail.util.JettyUtil.memString;
import static io.pfive.logtail.util.Ret.ok;

/// Every path and every remote command passes through here before any I/O is done on its behalf.
/// All checks are static and side-effect free, and return a Ret whose error variant is a Rejection
/// naming the Violation. The only method that touches the filesystem is validateLocalPath, which
/// reads (never writes) to resolve symbolic links before applying the same lexical rules.
///
/// Remote paths are compared purely lexically: we can't resolve symlinks on the far side without
/// running a command, and that command would itself need a validated path. This is why any ".."
/// segment is rejected outright rather than normalized away.
public abstract class AccessGuard {

    public static final Set<String> DEFAULT_ALLOWED_VERBS = Set.of("tail", "cat", "head", "ls", "find");

    /// Commands are never run through a local shell, but the remote sshd hands them to the login
    /// shell, so anything that shell would interpret is refused.
    private static final String METACHARACTERS = ";|&`$><\n\r";

    /// Denied even when nominally inside an allowed prefix. Compared case-insensitively.
    private static final List<String> DENIED_PREFIXES = List.of(
        "/etc/shadow", "/etc/gshadow", "/etc/passwd", "/etc/sudoers", "/root/.ssh", "/proc", "/sys", "/dev"
    );
    private static final List<String> DENIED_SUFFIXES = List.of(".pem", ".key");
    private static final String DENIED_SEGMENT = ".ssh";

    /// Lexical validation of an absolute POSIX path against a set of allowed prefixes.
    /// @return the normalized path, or a Rejection.
    public static Ret<String> validatePath (String candidatePath, Collection<String> allowedPrefixes) {
        if (candidatePath == null || candidatePath.isBlank()) {
            return reject(Violation.PATH_OUTSIDE_WHITELIST, "Empty path.");
        }
        if (candidatePath.indexOf('\0') >= 0) {
            return reject(Violation.PATH_DENYLISTED, "Path contains a NUL character.");
        }
        if (!candidatePath.startsWith("/")) {
            return reject(Violation.PATH_OUTSIDE_WHITELIST, "Path is not absolute: " + candidatePath);
        }
        String normalized = normalize(candidatePath);
        if (normalized == null) {
            return reject(Violation.PATH_DENYLISTED, "Parent directory segments are not allowed: " + candidatePath);
        }
        String denied = deniedBy(normalized);
        if (denied != null) {
            return reject(Violation.PATH_DENYLISTED, "Path %s matches denied entry %s".formatted(normalized, denied));
        }
        if (allowedPrefixes != null) {
            for (String prefix : allowedPrefixes) {
                if (prefix == null || !prefix.startsWith("/")) continue;
                String normalizedPrefix = normalize(prefix);
                if (normalizedPrefix != null && isSameOrDescendant(normalized, normalizedPrefix)) {
                    return ok(normalized);
                }
            }
        }
        return reject(Violation.PATH_OUTSIDE_WHITELIST, "Path is not inside any allowed prefix: " + normalized);
    }

    /// Validates a path on the local filesystem. Symbolic links in both the candidate and the
    /// allowed prefixes are resolved when the files exist, so a link inside an allowed directory
    /// pointing at /etc is caught. Non-existent paths are normalized lexically.
    public static Ret<Path> validateLocalPath (Path candidatePath, Collection<String> allowedPrefixes) {
        if (candidatePath == null) {
            return reject(Violation.PATH_OUTSIDE_WHITELIST, "Empty path.");
        }
        for (Path segment : candidatePath) {
            if (segment.toString().equals("..")) {
                return reject(Violation.PATH_DENYLISTED, "Parent directory segments are not allowed: " + candidatePath);
            }
        }
        List<String> resolvedPrefixes = new ArrayList<>();
        if (allowedPrefixes != null) {
            for (String prefix : allowedPrefixes) {
                if (prefix != null && !prefix.isBlank()) resolvedPrefixes.add(posixString(resolve(Path.of(prefix))));
            }
        }
        Path resolved = resolve(candidatePath);
        Ret<String> lexical = validatePath(posixString(resolved), resolvedPrefixes);
        if (lexical instanceof Rejection<String> rejection) {
            return rejection.propagate();
        }
        return ok(resolved);
    }

    /// Checks a command line against a whitelist of leading verbs. The metacharacter check runs
    /// first and regardless of the verb.
    /// @return the command split into whitespace-separated arguments, or a Rejection.
    public static Ret<List<String>> validateCommand (String candidateCommand, Set<String> allowedVerbs) {
        if (candidateCommand == null || candidateCommand.isBlank()) {
            return reject(Violation.COMMAND_VERB_NOT_ALLOWED, "Empty command.");
        }
        for (int i = 0; i < candidateCommand.length(); i++) {
            char c = candidateCommand.charAt(i);
            if (METACHARACTERS.indexOf(c) >= 0) {
                return reject(Violation.COMMAND_HAS_METACHARACTER,
                    "Command contains shell metacharacter '%s'.".formatted(printable(c)));
            }
        }
        List<String> argv = List.of(candidateCommand.trim().split("\\s+"));
        String verb = argv.get(0);
        if (allowedVerbs == null || !allowedVerbs.contains(verb)) {
            return reject(Violation.COMMAND_VERB_NOT_ALLOWED, "Command verb is not allowed: " + verb);
        }
        return ok(argv);
    }

    public static Ret<Long> checkFileSize (long observedSize, long maxSize) {
        if (observedSize > maxSize) {
            return reject(Violation.SIZE_EXCEEDED,
                "File size %s exceeds maximum %s.".formatted(memString(observedSize), memString(maxSize)));
        }
        return ok(observedSize);
    }

    /// Unwrap a guard result, throwing SecurityViolationException if it was rejected.
    public static <T> T require (Ret<T> ret) {
        if (ret instanceof Rejection<T> rejection) {
            throw new SecurityViolationException(rejection.violation, rejection.message);
        }
        return ret.get();
    }

    /// Collapse "." and empty segments. Returns null if any ".." segment is present.
    static String normalize (String absolutePath) {
        StringBuilder sb = new StringBuilder();
        for (String segment : absolutePath.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) continue;
            if (segment.equals("..")) return null;
            sb.append('/').append(segment);
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }

    private static boolean isSameOrDescendant (String path, String prefix) {
        if (prefix.equals("/")) return true;
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    private static String deniedBy (String normalizedPath) {
        String lower = normalizedPath.toLowerCase(Locale.ROOT);
        for (String denied : DENIED_PREFIXES) {
            if (isSameOrDescendant(lower, denied)) return denied;
        }
        for (String suffix : DENIED_SUFFIXES) {
            if (lower.endsWith(suffix)) return "*" + suffix;
        }
        for (String segment : lower.split("/")) {
            if (segment.equals(DENIED_SEGMENT)) return DENIED_SEGMENT;
        }
        return null;
    }

    private static Path resolve (Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            if (Files.exists(absolute)) {
                return absolute.toRealPath();
            }
            return absolute;
        } catch (IOException e) {
            // Unreadable link target: use the lexical form, which is still checked against the deny-list.
            return absolute;
        }
    }

    private static String posixString (Path path) {
        String s = path.toString().replace('\\', '/');
        return s.startsWith("/") ? s : "/" + s;
    }

    private static String printable (char c) {
        if (c == '\n') return "\\n";
        if (c == '\r') return "\\r";
        return String.valueOf(c);
    }

    private static <T> Rejection<T> reject (Violation violation, String message) {
        return new Rejection<>(violation, message);
    }

    /// An Err that also names the rule which was broken.
    public static class Rejection<T> extends Ret.Err<T> {
        public final Violation violation;

        public Rejection (Violation violation, String message) {
            super(message);
            this.violation = violation;
        }

        @Override
        public <X> Rejection<X> propagate () {
            return new Rejection<>(violation, message);
        }

        @Override
        public String toString () {
            return "Rejection<%s: %s>".formatted(violation, message);
        }
    }

}
