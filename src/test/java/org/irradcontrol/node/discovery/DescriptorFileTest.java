package org.irradcontrol.node.discovery;

import org.irradcontrol.junit.extensions.logging.ExpectLog;
import org.irradcontrol.junit.extensions.logging.LogLevel;
import org.irradcontrol.junit.extensions.logging.LogWatchExtension;
import org.irradcontrol.protocol.ChannelKind;
import org.irradcontrol.protocol.ProcessDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DescriptorFileTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("A written descriptor can be read back")
    void write_thenRead() {
        final DescriptorFile file = new DescriptorFile(tempDir, "server");
        final ProcessDescriptor descriptor = ProcessDescriptor.of(1234L, "server",
            Map.of(ChannelKind.CMD, 8501, ChannelKind.DATA, 8502));

        file.write(descriptor);

        assertThat(file.path()).isEqualTo(tempDir.resolve(".server.pid"));
        assertThat(file.read()).contains(descriptor);
    }

    @Test
    @DisplayName("Deleting removes the file and reading yields empty")
    void delete_removesFile() {
        final DescriptorFile file = new DescriptorFile(tempDir, "interpreter");
        file.write(ProcessDescriptor.of(1L, "interpreter", Map.of()));

        file.delete();

        assertThat(file.exists()).isFalse();
        assertThat(file.read()).isEmpty();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("A descriptor of a dead process is not an orphan")
    void findOrphan_deadProcess_isEmpty() throws Exception {
        final Process process = new ProcessBuilder("true").start();
        process.waitFor();
        final DescriptorFile file = new DescriptorFile(tempDir, "server");
        file.write(ProcessDescriptor.of(process.pid(), "server", Map.of()));

        assertThat(file.findOrphan()).isEmpty();
    }

    @Test
    @DisplayName("The descriptor of the current process is not an orphan")
    void findOrphan_ownProcess_isEmpty() {
        final DescriptorFile file = new DescriptorFile(tempDir, "server");
        file.write(ProcessDescriptor.of(ProcessHandle.current().pid(), "server", Map.of()));

        assertThat(file.findOrphan()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unreadable process descriptor.*")
    @DisplayName("An unreadable descriptor is ignored")
    void findOrphan_garbage_isIgnored() throws Exception {
        final DescriptorFile file = new DescriptorFile(tempDir, "server");
        Files.writeString(file.path(), "not json");

        assertThat(file.findOrphan()).isEmpty();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("A live orphan is found and killed")
    void killOrphan_liveProcess_isTerminated() throws Exception {
        // Arrange
        final Process orphan = new ProcessBuilder("sleep", "60").start();
        final DescriptorFile file = new DescriptorFile(tempDir, "server");
        file.write(ProcessDescriptor.of(orphan.pid(), "server", Map.of()));

        // Act
        final ProcessDescriptor found = file.findOrphan().orElseThrow();
        final boolean gone = file.killOrphan(found, Duration.ofSeconds(5));

        // Assert
        assertThat(gone).isTrue();
        assertThat(orphan.isAlive()).isFalse();
        assertThat(file.exists()).isFalse();
    }
}
