package com.inp2ops.cli;

import com.inp2ops.core.ConversionPipeline;
import com.inp2ops.core.ConversionReport;
import com.inp2ops.core.config.ConverterConfig;
import com.inp2ops.core.model.FeModel;
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
import java.util.concurrent.Callable;

/**
 * Command to convert one input deck into a script.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Read and parse the input</li>
 *   <li>Translate the model and report warnings</li>
 *   <li>Render and write the script</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Writes frame.py next to frame.inp
 * inp2ops convert frame.inp
 *
 * # Explicit output, replacing an existing file
 * inp2ops convert frame.inp -o out/frame_model.py --overwrite
 *
 * # Parse only and show statistics
 * inp2ops convert frame.inp --dry-run
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Convert an Abaqus .inp file to an OpenSeesPy script",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Parameters(index = "0", description = "Abaqus input file (.inp)")
    private Path inputFile;

    @Option(names = {"-o", "--output"}, description = "Output script (default: input file with .py)")
    private Path outputFile;

    @Option(names = {"--overwrite"}, description = "Overwrite the output file if it exists")
    private boolean overwrite;

    @Option(names = {"--dry-run"}, description = "Parse the file and show statistics without converting")
    private boolean dryRun;

    @Option(names = {"--strict"}, description = "Fail on element types without an OpenSees equivalent")
    private boolean strict;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: inp2ops.yaml)")
    private Path configPath;

    @Override
    public Integer call() {
        try {
            CliSupport.requireInputFile(inputFile);
            log.info("Converting: {}", inputFile.toAbsolutePath());
            System.out.println("Converting: " + inputFile);

            ConverterConfig config = CliSupport.loadConfiguration(configPath);
            ConversionPipeline pipeline = CliSupport.createPipeline(config, configPath, strict);
            String text = FileUtils.readInputText(inputFile);

            if (dryRun) {
                FeModel model = pipeline.parse(text);
                System.out.println("✓ Parsed " + inputFile.getFileName());
                CliSupport.printModelSummary(model);
                System.out.println();
                System.out.println("Dry-run mode: no script written");
                return 0;
            }

            Path target = outputFile != null
                ? outputFile
                : FileUtils.replaceExtension(inputFile, pipeline.getRenderer().getFileExtension());
            boolean replace = overwrite || config.output().overwrite();
            if (Files.exists(target) && !replace) {
                throw new IllegalStateException("Output file already exists: " + target + " (use --overwrite)");
            }

            ConversionReport report = pipeline.run(text);
            System.out.println("✓ Parsed " + report.model().nodes().size() + " nodes and "
                + report.model().elements().size() + " elements");
            CliSupport.printWarnings(report.warnings());

            Path parent = target.toAbsolutePath().getParent();
            FileSystemScriptWriter writer = new FileSystemScriptWriter(parent, replace);
            Path written = writer.write(new GeneratedScript(target.getFileName().toString(), report.script()));

            System.out.println("✓ Conversion complete");
            System.out.println("Output: " + written);
            return 0;

        } catch (Exception e) {
            return CliSupport.fail("Conversion", e);
        }
    }
}
