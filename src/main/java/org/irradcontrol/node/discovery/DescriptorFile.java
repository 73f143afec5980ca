package org.irradcontrol.node.discovery;

import org.irradcontrol.protocol.MessageCodec;
import org.irradcontrol.protocol.ProcessDescriptor;
import org.irradcontrol.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The discovery file of one role on this host, {@code <dir>/.<role>.pid}. It holds the
 * {@link ProcessDescriptor} of the running instance as JSON and exists only while that
 * instance is alive.
 */
public final class DescriptorFile {

    private static final Logger LOGGER = LoggerFactory.getLogger(DescriptorFile.class);

    private final Path path;

    public DescriptorFile(final Path directory, final String roleName) {
        this.path = directory.resolve("." + roleName + ".pid");
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    /**
     * Writes the descriptor atomically, creating the directory if needed.
     *
     * @throws DescriptorException if the file cannot be written.
     */
    public void write(final ProcessDescriptor descriptor) {
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            final Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, MessageCodec.encode(descriptor), StandardCharsets.UTF_8);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOGGER.debug("Wrote process descriptor {}", path);
        } catch (IOException e) {
            throw new DescriptorException("Could not write process descriptor " + path, e);
        }
    }

    /**
     * @return The stored descriptor, or empty if there is no file.
     * @throws DescriptorException if the file exists but cannot be read or parsed.
     */
    public Optional<ProcessDescriptor> read() {
        if (!exists()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MessageCodec.decode(Files.readString(path, StandardCharsets.UTF_8), ProcessDescriptor.class));
        } catch (IOException | ProtocolException e) {
            throw new DescriptorException("Could not read process descriptor " + path, e);
        }
    }

    public void delete() {
        try {
            if (Files.deleteIfExists(path)) {
                LOGGER.debug("Removed process descriptor {}", path);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not remove process descriptor {}: {}", path, e.getMessage());
        }
    }

    /**
     * Looks for a previous instance of this role that is still running.
     *
     * @return The descriptor of the live orphan, or empty if there is none. A stale descriptor
     *     of a dead process yields empty.
     */
    public Optional<ProcessDescriptor> findOrphan() {
        final Optional<ProcessDescriptor> stored;
        try {
            stored = read();
        } catch (DescriptorException e) {
            LOGGER.warn("Ignoring unreadable process descriptor {}: {}", path, e.getMessage());
            return Optional.empty();
        }
        return stored.filter(d -> d.pid() != ProcessHandle.current().pid())
            .filter(d -> ProcessHandle.of(d.pid()).map(ProcessHandle::isAlive).orElse(false));
    }

    /**
     * Terminates the process of an orphaned descriptor and removes the file.
     *
     * @return {@code true} if the process is gone afterwards.
     */
    public boolean killOrphan(final ProcessDescriptor orphan, final Duration timeout) throws InterruptedException {
        final Optional<ProcessHandle> handle = ProcessHandle.of(orphan.pid());
        if (handle.isEmpty() || !handle.get().isAlive()) {
            delete();
            return true;
        }
        LOGGER.info("Terminating orphaned {} process with pid {}", orphan.name(), orphan.pid());
        handle.get().destroy();
        try {
            handle.get().onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOGGER.warn("Process {} did not exit within {}, killing it", orphan.pid(), timeout);
            handle.get().destroyForcibly();
        } catch (ExecutionException e) {
            LOGGER.warn("Waiting for process {} failed: {}", orphan.pid(), e.getMessage());
        }
        final boolean gone = !handle.get().isAlive();
        if (gone) {
            delete();
        }
        return gone;
    }
}
