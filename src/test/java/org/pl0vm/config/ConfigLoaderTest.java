package org.pl0vm.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests configuration layering and the runtime logging setup.
 */
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty("pl0vm.vm.max-steps");
        ConfigFactory.invalidateCaches();
        LoggingConfigurator.reset();
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger("org.pl0vm.sample").setLevel(null);
    }

    @Test
    @Tag("unit")
    void testReferenceDefaults() {
        Config config = ConfigLoader.load();

        assertThat(config.getInt("pl0vm.vm.memory-size")).isEqualTo(256);
        assertThat(config.getLong("pl0vm.vm.max-steps")).isEqualTo(1_000_000L);
        assertThat(config.getInt("pl0vm.compiler.fx-scale")).isEqualTo(65536);
        assertThat(ConfigLoader.section(config, "vm").getInt("registers")).isEqualTo(4);
        assertThat(ConfigLoader.section(config, "missing").isEmpty()).isTrue();
    }

    @Test
    @Tag("unit")
    void testExplicitFileOverridesDefaults() throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "pl0vm.vm.max-steps = 42\npl0vm.compiler.fx-scale = 1000\n");

        Config config = ConfigLoader.load(file);

        assertThat(config.getLong("pl0vm.vm.max-steps")).isEqualTo(42);
        assertThat(config.getInt("pl0vm.compiler.fx-scale")).isEqualTo(1000);
        assertThat(config.getInt("pl0vm.vm.memory-size")).isEqualTo(256);
    }

    @Test
    @Tag("unit")
    void testSystemPropertiesOverrideFile() throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "pl0vm.vm.max-steps = 42\n");
        System.setProperty("pl0vm.vm.max-steps", "7");
        ConfigFactory.invalidateCaches();

        assertThat(ConfigLoader.load(file).getLong("pl0vm.vm.max-steps")).isEqualTo(7);
    }

    @Test
    @Tag("unit")
    void testMissingExplicitFileIsRejected() {
        assertThatThrownBy(() -> ConfigLoader.load(tempDir.resolve("absent.conf")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absent.conf");
    }

    @Test
    @Tag("unit")
    void testLoggingLevelsAreApplied() {
        Config config = ConfigFactory.parseString("logging.levels { \"org.pl0vm.sample\" = \"DEBUG\" }");
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        LoggingConfigurator.reset();

        LoggingConfigurator.configure(config);
        assertThat(context.getLogger("org.pl0vm.sample").getLevel()).isEqualTo(Level.DEBUG);

        context.getLogger("org.pl0vm.sample").setLevel(Level.ERROR);
        LoggingConfigurator.configure(config);
        assertThat(context.getLogger("org.pl0vm.sample").getLevel()).isEqualTo(Level.ERROR);
    }
}
