// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import io.pfive.logtail.guard.SecurityViolationException;
import io.pfive.logtail.guard.Violation;
import io.pfive.logtail.model.RemoteHost;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RemoteCommandsTest {

    @Test
    void plainArgumentsAreLeftAloneAndOthersQuoted () {
        assertEquals("tail -c +42 -F /var/log/app.log",
            RemoteCommands.toCommandLine(List.of("tail", "-c", "+42", "-F", "/var/log/app.log")));
        assertEquals("find /var/log -name '*.log'",
            RemoteCommands.toCommandLine(List.of("find", "/var/log", "-name", "*.log")));
        assertEquals("ls -ln '/var/log/my app.log'",
            RemoteCommands.toCommandLine(List.of("ls", "-ln", "/var/log/my app.log")));
        assertEquals("ls -ln '/var/log/it'\\''s.log'",
            RemoteCommands.toCommandLine(List.of("ls", "-ln", "/var/log/it's.log")));
    }

    @Test
    void commandsOutsideTheWhitelistAreNotApproved () {
        SecurityViolationException verb = assertThrows(SecurityViolationException.class,
            () -> RemoteCommands.approve(List.of("rm", "-rf", "/var/log")));
        assertEquals(Violation.COMMAND_VERB_NOT_ALLOWED, verb.violation);
        SecurityViolationException meta = assertThrows(SecurityViolationException.class,
            () -> RemoteCommands.approve(List.of("tail", "-F", "/var/log/a.log;reboot")));
        assertEquals(Violation.COMMAND_HAS_METACHARACTER, meta.violation);
    }

    @Test
    void lsSizeIsTheFifthColumn () {
        assertEquals(52345, RemoteCommands.parseLsSize("-rw-r----- 1 0 4 52345 Mar  3 10:12 /var/log/syslog\n"));
        assertEquals(-1, RemoteCommands.parseLsSize(""));
        assertEquals(-1, RemoteCommands.parseLsSize("drwxr-xr-x 2 0 0 4096 Mar  3 10:12 /var/log\n"));
        assertEquals(-1, RemoteCommands.parseLsSize("total 0\n"));
    }

    @Test
    void runReturnsOutputAndReleasesTheSession () {
        FakeSshConnector connector = new FakeSshConnector();
        connector.file("/var/log/app/a.log").append("hello\n");
        RemoteHost host = RemoteSessionPoolTest.host("web-1");
        try (RemoteSessionPool pool = new RemoteSessionPool(connector, new RemoteSessionPool.Settings(1,
            Duration.ofMinutes(5), Duration.ofMinutes(30), Duration.ofSeconds(1)), Clock.systemUTC())) {
            String output = RemoteCommands.run(pool, host, List.of("ls", "-ln", "/var/log/app/a.log"));
            assertEquals(6, RemoteCommands.parseLsSize(output));
            assertEquals(1, pool.idleCount(host));
            assertEquals(0, pool.leasedCount(host));
        }
    }
}
