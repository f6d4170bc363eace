package com.inp2ops.core.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes rendered scripts to the filesystem.
 *
 * <p>Creates the output directory when needed. Existing files are only replaced when the writer was created
 * with {@code overwrite} set; otherwise writing fails before anything is touched.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * FileSystemScriptWriter writer = new FileSystemScriptWriter(Path.of("out"), false);
 * Path written = writer.write(new GeneratedScript("frame.py", script));
 * }</pre>
 */
public class FileSystemScriptWriter {

    private static final Logger log = LoggerFactory.getLogger(FileSystemScriptWriter.class);

    private final Path outputDirectory;
    private final boolean overwrite;

    public FileSystemScriptWriter(Path outputDirectory, boolean overwrite) {
        this.outputDirectory = outputDirectory;
        this.overwrite = overwrite;
    }

    /**
     * Writes one script.
     *
     * @param script the script
     * @return path of the written file
     * @throws IllegalStateException if the file exists and overwriting is off, or writing fails
     */
    public Path write(GeneratedScript script) {
        Path target = outputDirectory.resolve(script.fileName());
        if (Files.exists(target) && !overwrite) {
            throw new IllegalStateException("Output file already exists: " + target + " (use --overwrite)");
        }

        try {
            Path parentDir = target.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(target, script.content(), StandardCharsets.UTF_8);
            log.info("Wrote script: {} ({} bytes)", target, script.content().length());
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }
}
