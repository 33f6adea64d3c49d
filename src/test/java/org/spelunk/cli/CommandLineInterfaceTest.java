package org.spelunk.cli;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.spelunk.config.LoggingConfigurator;
import org.spelunk.junit.extensions.logging.AllowLog;
import org.spelunk.junit.extensions.logging.LogLevel;
import org.spelunk.junit.extensions.logging.LogWatchExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.WARN)
class CommandLineInterfaceTest {

    private static final String TEST_CONFIG = String.join("\n",
        "spelunk {",
        "  generation { seed = \"test-cave\", width = 48, height = 32 }",
        "  platforms { max-platforms = 12, max-attempts = 120 }",
        "  coins { count = 6 }",
        "}",
        "logging { default-level = \"WARN\" }");

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        ConfigFactory.invalidateCaches();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggingConfigurator.reset();
    }

    private Path configFile(String content) throws IOException {
        Path file = tempDir.resolve("spelunk.conf");
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("generate writes a level file and reports it")
    void generate_writesLevel() throws IOException {
        Path config = configFile(TEST_CONFIG);
        Path output = tempDir.resolve("out/level.json");

        int exitCode = commandLine.execute("-c", config.toString(), "generate", "-o", output.toString());

        assertThat(exitCode).as(err.toString()).isZero();
        assertThat(output).exists();
        assertThat(Files.readString(output)).contains("\"seed\" : \"test-cave\"");
        assertThat(out.toString()).contains("Level 'test-cave' written to").contains("reachability").contains("quality");
    }

    @Test
    @DisplayName("Command line seed and size override the configuration")
    void generate_overrides() throws IOException {
        Path config = configFile(TEST_CONFIG);
        Path output = tempDir.resolve("level.json");

        commandLine.execute("-c", config.toString(), "generate", "-s", "test-cave", "-W", "48", "-H", "32",
            "-o", output.toString());

        if (Files.exists(output)) {
            String json = Files.readString(output);
            assertThat(json).contains("\"width\" : 48").contains("\"height\" : 32");
        } else {
            assertThat(err.toString()).startsWith("Generation failed at");
        }
    }

    @Test
    @DisplayName("Invalid size is rejected before generation")
    void generate_invalidSize() throws IOException {
        Path config = configFile(TEST_CONFIG);

        int exitCode = commandLine.execute("-c", config.toString(), "generate", "-W", "5",
            "-o", tempDir.resolve("level.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Invalid settings: width and height must be between 10 and 1000, got 5x32");
        assertThat(tempDir.resolve("level.json")).doesNotExist();
    }

    @Test
    @DisplayName("Unsatisfiable constraints report the failing stage")
    void generate_failure() throws IOException {
        Path config = configFile(TEST_CONFIG
            + "\nspelunk.spawn { safety-radius = 10, left-side-boundary = 0.05, allow-fallback = false }");

        int exitCode = commandLine.execute("-c", config.toString(), "generate",
            "-o", tempDir.resolve("level.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Generation failed at SPAWN: No valid spawn position");
    }

    @Test
    @DisplayName("A missing configuration file is a usage error")
    void missingConfigFile() {
        int exitCode = commandLine.execute("-c", tempDir.resolve("nope.conf").toString(), "generate");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("Configuration file not found");
    }

    @Test
    @DisplayName("Without a subcommand the usage is shown")
    void noSubcommand() {
        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
    }
}
