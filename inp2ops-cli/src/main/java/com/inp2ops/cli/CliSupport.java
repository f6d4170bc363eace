package com.inp2ops.cli;

import com.inp2ops.core.ConversionPipeline;
import com.inp2ops.core.config.ConfigLoader;
import com.inp2ops.core.config.ConverterConfig;
import com.inp2ops.core.model.FeModel;
import com.inp2ops.core.translator.ConversionWarning;
import com.inp2ops.core.translator.UnmappedPolicy;
import com.inp2ops.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Shared plumbing of the subcommands: configuration, pipeline setup and console output.
 */
final class CliSupport {

    private static final Logger log = LoggerFactory.getLogger(CliSupport.class);

    static final String INPUT_EXTENSION = "inp";

    private CliSupport() {
        // Utility class
    }

    /**
     * Loads configuration; an explicit path wins over {@code inp2ops.yaml} in the working directory.
     */
    static ConverterConfig loadConfiguration(Path configPath) {
        Path path = configPath != null ? configPath : Path.of(ConfigLoader.DEFAULT_FILE_NAME);
        return ConfigLoader.load(path);
    }

    /**
     * Builds a pipeline from configuration, switching to the fail policy when {@code strict} is set.
     */
    static ConversionPipeline createPipeline(ConverterConfig config, Path configPath, boolean strict)
        throws IOException {
        ConverterConfig effective = config;
        if (strict) {
            effective = new ConverterConfig(
                new ConverterConfig.ConversionSettings(UnmappedPolicy.FAIL.name(),
                    config.conversion().defaultNdf()),
                config.mappings(),
                config.output());
        }
        Path base = configPath != null && configPath.toAbsolutePath().getParent() != null
            ? configPath.toAbsolutePath().getParent()
            : Path.of(".");
        return ConversionPipeline.fromConfig(effective, base);
    }

    /**
     * Checks that a path names an existing {@code .inp} file.
     *
     * @throws IllegalArgumentException with a user-facing message otherwise
     */
    static void requireInputFile(Path input) {
        if (!Files.isRegularFile(input)) {
            throw new IllegalArgumentException("Input file not found: " + input);
        }
        if (!INPUT_EXTENSION.equals(FileUtils.getExtension(input).toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Input must be an ." + INPUT_EXTENSION + " file: " + input);
        }
    }

    static void printModelSummary(FeModel model) {
        System.out.println("  Nodes:               " + model.nodes().size());
        System.out.println("  Elements:            " + model.elements().size());
        System.out.println("  Node sets:           " + model.nodeSets().size());
        System.out.println("  Element sets:        " + model.elementSets().size());
        System.out.println("  Materials:           " + model.materials().size());
        System.out.println("  Sections:            " + model.sections().size());
        System.out.println("  Boundary conditions: " + model.boundaryConditions().size());
        System.out.println("  Loads:               " + model.loads().size());
        if (!model.skippedSections().isEmpty()) {
            System.out.println("  Skipped keywords:    " + model.skippedSections().size());
        }
    }

    static void printWarnings(List<ConversionWarning> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        System.out.println("⚠ " + warnings.size() + " warning(s):");
        for (ConversionWarning warning : warnings) {
            System.out.println("  - " + warning.message() + " [" + warning.kind() + "]");
        }
    }

    /**
     * Reports a failed command the way every subcommand does and returns the exit code.
     */
    static int fail(String action, Exception e) {
        log.error("{} failed: {}", action, e.getMessage());
        System.err.println("✗ " + action + " failed: " + e.getMessage());
        if (log.isDebugEnabled()) {
            e.printStackTrace();
        }
        return 1;
    }
}
