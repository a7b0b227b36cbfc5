package io.github.drompincen.javacron.runtime.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * The machine the engine runs on, seen through the same session contract as a remote host, so a
 * local script run follows the identical work-directory protocol.
 */
public class LocalHost implements RemoteSession {

    private static final Logger log = LoggerFactory.getLogger(LocalHost.class);

    @Override
    public CommandResult exec(String command, Duration timeout) {
        File stdoutFile = null;
        File stderrFile = null;
        try {
            stdoutFile = File.createTempFile("javacron-out", ".log");
            stderrFile = File.createTempFile("javacron-err", ".log");
            Process process = new ProcessBuilder("/bin/sh", "-c", command)
                    .redirectOutput(stdoutFile)
                    .redirectError(stderrFile)
                    .start();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return CommandResult.timeout(read(stdoutFile),
                        read(stderrFile) + "Command timed out after " + timeout.toSeconds() + "s");
            }
            return new CommandResult(read(stdoutFile), read(stderrFile), process.exitValue(), false);
        } catch (IOException e) {
            return CommandResult.failure(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CommandResult.failure("Interrupted while running command");
        } finally {
            delete(stdoutFile);
            delete(stderrFile);
        }
    }

    @Override
    public void writeFile(String path, byte[] content) throws IOException {
        Path target = Path.of(path);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.write(target, content);
    }

    @Override
    public Optional<byte[]> readFile(String path) throws IOException {
        Path source = Path.of(path);
        if (!Files.isRegularFile(source)) return Optional.empty();
        return Optional.of(Files.readAllBytes(source));
    }

    @Override
    public InteractiveShell openShell(int cols, int rows) throws IOException {
        throw new IOException("Interactive shells are only available on remote servers");
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public void close() {
        // nothing held open
    }

    private static String read(File file) throws IOException {
        return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }

    private static void delete(File file) {
        if (file != null && !file.delete() && file.exists()) {
            log.debug("Could not delete temp file {}", file);
        }
    }
}
