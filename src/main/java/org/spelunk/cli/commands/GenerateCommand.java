package org.spelunk.cli.commands;

import org.spelunk.cli.CommandLineInterface;
import org.spelunk.config.GenerationSettings;
import org.spelunk.export.LevelJsonExporter;
import org.spelunk.runtime.GenerationResult;
import org.spelunk.runtime.LevelGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "generate",
    description = "Generate a cave level and write it as JSON"
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

    @Option(names = {"-s", "--seed"}, description = "Level seed (default: spelunk.generation.seed)")
    private String seed;

    @Option(names = {"-W", "--width"}, description = "Grid width in cells")
    private Integer width;

    @Option(names = {"-H", "--height"}, description = "Grid height in cells")
    private Integer height;

    @Option(names = {"-o", "--output"}, description = "Output file (default: level.json)")
    private Path output = Path.of("level.json");

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final GenerationSettings settings;
        try {
            GenerationSettings loaded = GenerationSettings.fromConfig(parent.getConfig());
            if (seed != null) {
                loaded = loaded.withSeed(seed);
            }
            if (width != null || height != null) {
                loaded = loaded.withSize(width != null ? width : loaded.seed().width(),
                    height != null ? height : loaded.seed().height());
            }
            settings = loaded;
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Invalid settings: " + e.getMessage());
            return 1;
        }

        final GenerationResult result = new LevelGenerator(settings).generate();
        if (!result.success()) {
            spec.commandLine().getErr().println("Generation failed at " + result.failedStage() + ": " + result.error());
            return 1;
        }

        try {
            new LevelJsonExporter(settings.physics().tileSize()).write(result.level(), output);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Failed to write " + output + ": " + e.getMessage());
            return 1;
        }
        LOG.info("Level written to {}", output.toAbsolutePath());
        spec.commandLine().getOut().println(String.format(Locale.ROOT, "Level '%s' written to %s (reachability %.3f, quality %d/100)",
            settings.seed().seed(), output, result.reachability(), result.quality().score()));
        return 0;
    }
}
