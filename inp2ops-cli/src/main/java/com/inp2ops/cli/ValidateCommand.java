package com.inp2ops.cli;

import com.inp2ops.core.ConversionPipeline;
import com.inp2ops.core.ConversionReport;
import com.inp2ops.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to check that an input deck converts, without writing anything.
 */
@Command(
    name = "validate",
    description = "Parse and convert an Abaqus .inp file without writing output",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Abaqus input file (.inp)")
    private Path inputFile;

    @Option(names = {"--strict"}, description = "Fail on element types without an OpenSees equivalent")
    private boolean strict;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: inp2ops.yaml)")
    private Path configPath;

    @Override
    public Integer call() {
        try {
            CliSupport.requireInputFile(inputFile);
            log.info("Validating: {}", inputFile);
            ConversionPipeline pipeline = CliSupport.createPipeline(
                CliSupport.loadConfiguration(configPath), configPath, strict);

            ConversionReport report = pipeline.run(FileUtils.readInputText(inputFile));
            System.out.println("✓ " + inputFile.getFileName() + " converts ("
                + report.model().nodes().size() + " nodes, " + report.model().elements().size() + " elements)");
            CliSupport.printWarnings(report.warnings());
            return 0;

        } catch (Exception e) {
            return CliSupport.fail("Validation", e);
        }
    }
}
