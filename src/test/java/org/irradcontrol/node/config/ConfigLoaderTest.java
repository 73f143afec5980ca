package org.irradcontrol.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.irradcontrol.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies the configuration precedence: system properties over file over reference.conf.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("irrad.process.ports.min");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults come from reference.conf when no file exists")
    void load_withoutFile_usesReferenceDefaults() {
        final Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        final ProcessSettings settings = ProcessSettings.fromConfig(config);
        assertEquals(8500, settings.minPort());
        assertEquals(8800, settings.maxPort());
        assertEquals(Duration.ofSeconds(5), settings.shutdownTimeout());
        assertEquals(Duration.ofMillis(1), settings.commandPoll());
        assertEquals(Duration.ofMillis(10), settings.stopPoll());
        assertEquals("INFO", settings.logChannelLevel());
        assertTrue(config.hasPath("irrad.server.simulated-stage.native-length"));
    }

    @Test
    @DisplayName("A configuration file overrides reference defaults")
    void load_fileOverridesDefaults() throws Exception {
        final File file = tempDir.resolve("irrad.conf").toFile();
        Files.writeString(file.toPath(), "irrad.process.ports { min = 9000, max = 9100 }\nirrad.server.id = dut-server\n");

        final Config config = ConfigLoader.load(file);

        assertEquals(9000, config.getInt("irrad.process.ports.min"));
        assertEquals(9100, config.getInt("irrad.process.ports.max"));
        assertEquals("dut-server", config.getString("irrad.server.id"));
        assertEquals(100, config.getInt("irrad.process.ports.max-tries"));
    }

    @Test
    @DisplayName("System properties override the configuration file")
    void load_systemPropertyOverridesFile() throws Exception {
        final File file = tempDir.resolve("irrad.conf").toFile();
        Files.writeString(file.toPath(), "irrad.process.ports.min = 9000\n");
        System.setProperty("irrad.process.ports.min", "9500");
        ConfigFactory.invalidateCaches();

        final Config config = ConfigLoader.load(file);

        assertEquals(9500, config.getInt("irrad.process.ports.min"));
    }
}
