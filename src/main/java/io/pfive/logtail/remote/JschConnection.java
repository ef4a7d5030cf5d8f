// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.remote;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import io.pfive.logtail.model.RemoteHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.List;

public class JschConnection implements RemoteConnection {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final RemoteHost host;
    private final Session session;
    private final int timeoutMs;

    JschConnection (RemoteHost host, Session session, int timeoutMs) {
        this.host = host;
        this.session = session;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public boolean isOpen () {
        return session.isConnected();
    }

    @Override
    public boolean probe () {
        if (!session.isConnected()) return false;
        try {
            session.sendKeepAliveMsg();
            return session.isConnected();
        } catch (Exception e) {
            // sendKeepAliveMsg is declared to throw Exception.
            LOG.debug("Keepalive to {} failed: {}", host.key(), e.toString());
            return false;
        }
    }

    @Override
    public RemoteProcess exec (List<String> argv) {
        ChannelExec channel = null;
        try {
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(RemoteCommands.toCommandLine(argv));
            channel.setInputStream(null);
            JschProcess.Output output = new JschProcess.Output();
            // Closed by JSch when the channel ends, so a reader sees end of stream.
            channel.setOutputStream(output.stdoutSink, false);
            channel.setErrStream(output.stderr, true);
            channel.connect(timeoutMs);
            return new JschProcess(channel, output);
        } catch (JSchException | IOException e) {
            if (channel != null) channel.disconnect();
            throw new UnreachableException(host, "Could not start '%s': %s".formatted(argv.get(0), e.getMessage()), e);
        }
    }

    @Override
    public void close () {
        session.disconnect();
        LOG.info("Disconnected from {}.", host.key());
    }
}
