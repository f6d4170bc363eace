package com.inp2ops.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>The pattern is matched against paths relative to the root, so {@code *.inp} finds input files
     * directly in the root and {@code **}{@code /*.inp} finds them at any depth. Results are sorted.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern
     * @return sorted list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(rootPath.relativize(path)))
                .sorted(Comparator.comparing(Path::toString))
                .toList();
        }
    }

    /**
     * Reads an input deck as text.
     *
     * <p>Decodes as UTF-8 and, when the bytes are not valid UTF-8, falls back to ISO-8859-1, which accepts any
     * byte sequence. Older pre-processors still write Latin-1 comments.
     *
     * @param path path to file
     * @return file content
     * @throws IOException if reading fails
     */
    public static String readInputText(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            log.debug("{} is not valid UTF-8, decoding as ISO-8859-1", path);
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Replaces the file extension, or appends one if there is none.
     *
     * @param path file path
     * @param extension new extension without dot
     * @return sibling path with the new extension
     */
    public static Path replaceExtension(Path path, String extension) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        String base = lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
        return path.resolveSibling(base + "." + extension);
    }
}
