package com.inp2ops.cli;

import com.inp2ops.core.mapping.ElementMapping;
import com.inp2ops.core.mapping.MappingTables;
import com.inp2ops.core.mapping.MappingTablesLoader;
import com.inp2ops.core.mapping.MaterialMapping;
import com.inp2ops.core.renderer.ScriptRenderer;
import com.inp2ops.core.renderer.ScriptRenderers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to list supported element types, materials, or renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * inp2ops list elements
 * inp2ops list materials
 * inp2ops list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported elements, materials, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: elements, materials, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "elements", "element" -> listElements();
            case "materials", "material" -> listMaterials();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: elements, materials, or renderers", type);
                yield 1;
            }
        };
    }

    private int listElements() {
        System.out.println("Supported Element Types:");
        System.out.println();

        MappingTables tables = MappingTablesLoader.loadDefault();
        for (Map.Entry<String, ElementMapping> entry : tables.elements().entrySet()) {
            ElementMapping mapping = entry.getValue();
            System.out.printf("  • %-7s -> %-20s %2d nodes  %s%n",
                entry.getKey(), mapping.target(), mapping.arity(), mapping.family());
        }
        return 0;
    }

    private int listMaterials() {
        System.out.println("Supported Materials:");
        System.out.println();

        MappingTables tables = MappingTablesLoader.loadDefault();
        for (Map.Entry<String, MaterialMapping> entry : tables.materials().entrySet()) {
            System.out.printf("  • %s -> nDMaterial %s, uniaxialMaterial %s%n",
                entry.getKey(), entry.getValue().ndMaterial(), entry.getValue().uniaxialMaterial());
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<ScriptRenderer> renderers = ScriptRenderers.all();
        for (ScriptRenderer renderer : renderers) {
            System.out.printf("  • %s (ID: %s)%n", renderer.getDisplayName(), renderer.getId());
            System.out.printf("    File Extension: .%s%n", renderer.getFileExtension());
            System.out.println();
        }

        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
