package com.inp2ops.cli;

import com.inp2ops.core.model.Element;
import com.inp2ops.core.model.FeModel;
import com.inp2ops.core.model.Material;
import com.inp2ops.core.model.SkippedSection;
import com.inp2ops.core.parser.InpParser;
import com.inp2ops.core.util.FileUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Command to show what an input deck contains without converting it.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * inp2ops info frame.inp
 * inp2ops info frame.inp --details
 * }</pre>
 */
@Command(
    name = "info",
    description = "Show information about an Abaqus .inp file",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Abaqus input file (.inp)")
    private Path inputFile;

    @Option(names = {"-d", "--details"}, description = "Show element types, materials and skipped keywords")
    private boolean details;

    @Override
    public Integer call() {
        try {
            CliSupport.requireInputFile(inputFile);
            FeModel model = new InpParser().parse(FileUtils.readInputText(inputFile));

            System.out.println("Analysis summary: " + inputFile.getFileName());
            CliSupport.printModelSummary(model);

            if (details) {
                printDetails(model);
            }
            return 0;

        } catch (Exception e) {
            return CliSupport.fail("Analysis", e);
        }
    }

    private void printDetails(FeModel model) {
        Map<String, Integer> typeCounts = new TreeMap<>();
        for (Element element : model.elements().values()) {
            typeCounts.merge(element.type().tag(), 1, Integer::sum);
        }
        if (!typeCounts.isEmpty()) {
            System.out.println();
            System.out.println("Element types:");
            typeCounts.forEach((type, count) -> System.out.printf("  • %-8s %d%n", type, count));
        }

        if (!model.materials().isEmpty()) {
            System.out.println();
            System.out.println("Materials:");
            for (Material material : model.materials().values()) {
                System.out.printf("  • %s (%s)%n", material.name(), material.kind());
            }
        }

        if (!model.skippedSections().isEmpty()) {
            System.out.println();
            System.out.println("Skipped keywords:");
            for (SkippedSection skipped : model.skippedSections()) {
                System.out.printf("  • *%s at line %d (%d data lines)%n",
                    skipped.keyword(), skipped.line(), skipped.discardedLines());
            }
        }
    }
}
