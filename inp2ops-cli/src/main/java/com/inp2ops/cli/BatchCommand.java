package com.inp2ops.cli;

import com.inp2ops.core.ConversionPipeline;
import com.inp2ops.core.ConversionReport;
import com.inp2ops.core.config.ConverterConfig;
import com.inp2ops.core.output.FileSystemScriptWriter;
import com.inp2ops.core.output.GeneratedScript;
import com.inp2ops.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to convert every input deck in a directory.
 *
 * <p>Files are converted one after another. A failing file is reported and counted but does not stop the
 * batch; the exit code is 1 if any file failed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * inp2ops batch models/
 * inp2ops batch models/ -o scripts/ --overwrite
 * }</pre>
 */
@Command(
    name = "batch",
    description = "Convert all .inp files in a directory",
    mixinStandardHelpOptions = true
)
public class BatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    // Top-level files only; the extension is compared ignoring case
    private static final String INPUT_GLOB = "*";

    @Parameters(index = "0", description = "Directory containing .inp files")
    private Path directory;

    @Option(names = {"-o", "--output-dir"}, description = "Output directory (default: input directory)")
    private Path outputDir;

    @Option(names = {"--overwrite"}, description = "Overwrite existing output files")
    private boolean overwrite;

    @Option(names = {"--strict"}, description = "Fail files with element types without an OpenSees equivalent")
    private boolean strict;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: inp2ops.yaml)")
    private Path configPath;

    @Override
    public Integer call() {
        try {
            if (!Files.isDirectory(directory)) {
                throw new IllegalArgumentException("Not a directory: " + directory);
            }

            List<Path> inputs = FileUtils.findFiles(directory, INPUT_GLOB).stream()
                .filter(path -> CliSupport.INPUT_EXTENSION.equalsIgnoreCase(FileUtils.getExtension(path)))
                .toList();
            if (inputs.isEmpty()) {
                System.out.println("No .inp files found in " + directory);
                return 0;
            }
            System.out.println("Found " + inputs.size() + " .inp files");

            ConverterConfig config = CliSupport.loadConfiguration(configPath);
            ConversionPipeline pipeline = CliSupport.createPipeline(config, configPath, strict);
            Path target = outputDir != null ? outputDir : directory;
            FileSystemScriptWriter writer = new FileSystemScriptWriter(target,
                overwrite || config.output().overwrite());

            int succeeded = 0;
            int failed = 0;
            for (Path input : inputs) {
                try {
                    ConversionReport report = pipeline.run(FileUtils.readInputText(input));
                    String fileName = FileUtils.replaceExtension(input.getFileName(),
                        pipeline.getRenderer().getFileExtension()).toString();
                    writer.write(new GeneratedScript(fileName, report.script()));
                    succeeded++;
                    System.out.println("  ✓ " + input.getFileName()
                        + (report.warnings().isEmpty() ? "" : " (" + report.warnings().size() + " warnings)"));
                } catch (Exception e) {
                    failed++;
                    log.debug("Conversion of {} failed", input, e);
                    System.out.println("  ✗ " + input.getFileName() + ": " + e.getMessage());
                }
            }

            System.out.println();
            System.out.println("Results:");
            System.out.println("  Successful: " + succeeded);
            if (failed > 0) {
                System.out.println("  Failed:     " + failed);
            }
            return failed > 0 ? 1 : 0;

        } catch (Exception e) {
            return CliSupport.fail("Batch conversion", e);
        }
    }
}
