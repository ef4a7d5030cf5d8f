// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import io.pfive.logtail.model.Credential;
import io.pfive.logtail.model.HostKeyPolicy;
import io.pfive.logtail.model.RemoteHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/// Opens SSH connections with JSch. Each connection gets its own JSch instance so identities and
/// known hosts loaded for one host never leak into connections to another.
public class JschConnector implements SshConnector {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final Set<PosixFilePermission> EXPOSED = EnumSet.of(
        PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE,
        PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE
    );

    private final int connectTimeoutMs;

    public JschConnector (int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    @Override
    public RemoteConnection connect (RemoteHost host) {
        JSch jsch = new JSch();
        try {
            if (host.credential.method == Credential.Method.KEY) {
                String keyPath = expandHome(host.credential.secret());
                warnIfExposed(Path.of(keyPath));
                jsch.addIdentity(keyPath);
            }
            Session session = jsch.getSession(host.user, host.host, host.port);
            if (host.credential.method == Credential.Method.PASSWORD) {
                session.setPassword(host.credential.secret());
                session.setConfig("PreferredAuthentications", "password,keyboard-interactive");
            } else {
                session.setConfig("PreferredAuthentications", "publickey");
            }
            if (host.hostKeyPolicy == HostKeyPolicy.VERIFY) {
                jsch.setKnownHosts(knownHostsFile(host));
                session.setConfig("StrictHostKeyChecking", "yes");
            } else {
                LOG.warn("Host key of {} will be accepted without verification (hostKeyPolicy auto-accept).", host.key());
                session.setConfig("StrictHostKeyChecking", "no");
            }
            session.connect(connectTimeoutMs);
            return new JschConnection(host, session, connectTimeoutMs);
        } catch (JSchException e) {
            throw classify(host, e);
        }
    }

    /// JSch reports everything as JSchException, distinguished only by message.
    static RemoteAccessException classify (RemoteHost host, JSchException e) {
        String message = String.valueOf(e.getMessage());
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("auth fail") || lower.contains("auth cancel") || lower.contains("hostkey")) {
            return new AuthFailedException(host, message, e);
        }
        return new UnreachableException(host, message, e);
    }

    private static String knownHostsFile (RemoteHost host) {
        if (host.knownHosts != null && !host.knownHosts.isBlank()) {
            return expandHome(host.knownHosts);
        }
        return System.getProperty("user.home") + "/.ssh/known_hosts";
    }

    private static String expandHome (String path) {
        if (path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    /// Private keys readable by anyone but their owner are probably compromised. We still use them.
    private static void warnIfExposed (Path keyFile) {
        try {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(keyFile);
            permissions.retainAll(EXPOSED);
            if (!permissions.isEmpty()) {
                LOG.warn("Private key {} is accessible to group or others {}. Consider chmod 600.", keyFile, permissions);
            }
        } catch (UnsupportedOperationException | IOException e) {
            LOG.debug("Could not check permissions of key file {}: {}", keyFile, e.toString());
        }
    }

}
