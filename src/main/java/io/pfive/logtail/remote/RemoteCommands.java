// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import io.pfive.logtail.guard.AccessGuard;
import io.pfive.logtail.model.RemoteHost;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/// Static helpers for the short, bounded commands issued over pooled sessions (file size probes
/// and directory listings), as opposed to the long-running follow command owned by a tailer.
public abstract class RemoteCommands {

    /// Output of a bounded command is never read past this many bytes.
    public static final int MAX_OUTPUT_BYTES = 1024 * 1024;

    /// Run an argument list through the command whitelist, throwing SecurityViolationException if it
    /// is refused. Returns the same list so calls can be chained.
    public static List<String> approve (List<String> argv) {
        AccessGuard.require(AccessGuard.validateCommand(String.join(" ", argv), AccessGuard.DEFAULT_ALLOWED_VERBS));
        return argv;
    }

    /// Quote each argument for the remote login shell. The AccessGuard has already refused every
    /// character that could end a single-quoted string except the quote itself, handled here.
    public static String toCommandLine (List<String> argv) {
        List<String> quoted = new ArrayList<>(argv.size());
        for (String arg : argv) {
            if (arg.matches("[A-Za-z0-9_+=,./:@%-]+")) {
                quoted.add(arg);
            } else {
                quoted.add("'" + arg.replace("'", "'\\''") + "'");
            }
        }
        return String.join(" ", quoted);
    }

    /// Lease a session, run a whitelisted command to completion and return its standard output.
    /// The session is discarded if the command could not be run, otherwise released.
    public static String run (RemoteSessionPool pool, RemoteHost host, List<String> argv) {
        approve(argv);
        RemoteSession session = pool.acquire(host);
        boolean healthy = false;
        try (RemoteProcess process = session.exec(argv)) {
            String output = readOutput(process.stdout(), MAX_OUTPUT_BYTES);
            healthy = true;
            return output;
        } catch (IOException e) {
            throw new UnreachableException(host, "Reading output of '%s' failed.".formatted(argv.get(0)), e);
        } finally {
            if (healthy) {
                pool.release(session);
            } else {
                pool.discard(session);
            }
        }
    }

    static String readOutput (InputStream in, int maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int n;
        while ((n = in.read(buffer)) > 0) {
            int room = maxBytes - out.size();
            if (room <= 0) break;
            out.write(buffer, 0, Math.min(n, room));
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    /// Parse the size column of `ls -ln` output. Returns -1 if the output doesn't describe a file,
    /// for example because it does not exist (ls reports that on its error stream).
    public static long parseLsSize (String lsOutput) {
        for (String line : lsOutput.split("\n")) {
            String[] fields = line.trim().split("\\s+");
            if (fields.length >= 5 && fields[0].startsWith("-")) {
                try {
                    return Long.parseLong(fields[4]);
                } catch (NumberFormatException e) {
                    return -1;
                }
            }
        }
        return -1;
    }

}
