package io.github.drompincen.javacron.runtime.remote;

import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ChannelShell;
import org.apache.sshd.client.channel.ClientChannelEvent;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.sftp.client.SftpClient;
import org.apache.sshd.sftp.client.SftpClientFactory;
import org.apache.sshd.sftp.common.SftpConstants;
import org.apache.sshd.sftp.common.SftpException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

class MinaSshSession implements RemoteSession {

    private static final long SHELL_OPEN_TIMEOUT_MS = 10_000;

    private final ClientSession session;

    MinaSshSession(ClientSession session) {
        this.session = session;
    }

    @Override
    public CommandResult exec(String command, Duration timeout) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try (ChannelExec channel = session.createExecChannel(command)) {
            channel.setOut(out);
            channel.setErr(err);
            channel.open().verify(timeout.toMillis());
            Set<ClientChannelEvent> events = channel.waitFor(EnumSet.of(ClientChannelEvent.CLOSED), timeout.toMillis());
            String stdout = out.toString(StandardCharsets.UTF_8);
            String stderr = err.toString(StandardCharsets.UTF_8);
            if (events.contains(ClientChannelEvent.TIMEOUT)) {
                return CommandResult.timeout(stdout, stderr + "Command timed out after " + timeout.toSeconds() + "s");
            }
            return new CommandResult(stdout, stderr, channel.getExitStatus(), false);
        } catch (IOException | RuntimeException e) {
            return CommandResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    @Override
    public void writeFile(String path, byte[] content) throws IOException {
        try (SftpClient sftp = SftpClientFactory.instance().createSftpClient(session);
             OutputStream os = sftp.write(path)) {
            os.write(content);
        }
    }

    @Override
    public Optional<byte[]> readFile(String path) throws IOException {
        try (SftpClient sftp = SftpClientFactory.instance().createSftpClient(session);
             InputStream in = sftp.read(path)) {
            return Optional.of(in.readAllBytes());
        } catch (SftpException e) {
            if (e.getStatus() == SftpConstants.SSH_FX_NO_SUCH_FILE) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public InteractiveShell openShell(int cols, int rows) throws IOException {
        ChannelShell channel = session.createShellChannel();
        channel.setPtyType("xterm");
        channel.setPtyColumns(cols);
        channel.setPtyLines(rows);
        channel.open().verify(SHELL_OPEN_TIMEOUT_MS);
        return new MinaShell(channel);
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        session.close(false);
    }

    private static final class MinaShell implements InteractiveShell {

        private final ChannelShell channel;

        MinaShell(ChannelShell channel) {
            this.channel = channel;
        }

        @Override public OutputStream stdin() { return channel.getInvertedIn(); }
        @Override public InputStream stdout() { return channel.getInvertedOut(); }
        @Override public InputStream stderr() { return channel.getInvertedErr(); }
        @Override public boolean isOpen() { return channel.isOpen(); }

        @Override
        public void whenClosed(Runnable callback) {
            channel.addCloseFutureListener(future -> callback.run());
        }

        @Override
        public void close() {
            channel.close(false);
        }
    }
}
