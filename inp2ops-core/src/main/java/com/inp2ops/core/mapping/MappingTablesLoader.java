package com.inp2ops.core.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link MappingTables} from YAML.
 *
 * <p>The bundled {@code mapping-tables.yaml} is read once per process and shared. A replacement table file can
 * be loaded from disk with {@link #load(Path)}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MappingTables tables = MappingTablesLoader.loadDefault();
 * ElementLookup lookup = tables.lookupElement("S4R");
 * }</pre>
 */
public final class MappingTablesLoader {

    private static final Logger log = LoggerFactory.getLogger(MappingTablesLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Classpath location of the bundled tables. */
    public static final String DEFAULT_RESOURCE = "/mapping-tables.yaml";

    private MappingTablesLoader() {
        // Utility class
    }

    private static final class DefaultHolder {
        private static final MappingTables INSTANCE = readDefault();
    }

    /**
     * Returns the bundled mapping tables.
     *
     * @return shared immutable tables
     */
    public static MappingTables loadDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Loads mapping tables from a YAML file.
     *
     * @param path table file
     * @return the loaded tables
     * @throws IOException if the file cannot be read or is not a valid table file
     */
    public static MappingTables load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Mapping table file not found: " + path);
        }
        log.debug("Loading mapping tables from: {}", path);
        MappingTables tables = YAML_MAPPER.readValue(path.toFile(), MappingTables.class);
        log.info("Loaded {} element mappings from: {}", tables.elements().size(), path);
        return tables;
    }

    private static MappingTables readDefault() {
        try (InputStream in = MappingTablesLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled mapping tables missing: " + DEFAULT_RESOURCE);
            }
            MappingTables tables = YAML_MAPPER.readValue(in, MappingTables.class);
            log.debug("Loaded {} bundled element mappings", tables.elements().size());
            return tables;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled mapping tables", e);
        }
    }
}
