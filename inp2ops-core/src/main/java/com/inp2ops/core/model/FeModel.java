package com.inp2ops.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated, immutable finite-element model produced by the parser.
 *
 * <p>This is the intermediate representation between the parser and the translator. Every cross reference
 * it contains (element nodes, set members, section materials, boundary and load targets) has been resolved
 * before construction. All maps preserve definition order; named entities are keyed by
 * {@link #nameKey(String)} so lookups are case-insensitive, like Abaqus names.
 *
 * @param nodes nodes by id
 * @param elements elements by id
 * @param nodeSets node sets by normalized name
 * @param elementSets element sets by normalized name
 * @param materials materials by normalized name
 * @param sections sections in definition order
 * @param boundaryConditions boundary conditions in definition order
 * @param loads concentrated loads in definition order
 * @param skippedSections directives that were tolerated but not interpreted
 */
public record FeModel(
    Map<Integer, Node> nodes,
    Map<Integer, Element> elements,
    Map<String, NodeSet> nodeSets,
    Map<String, ElementSet> elementSets,
    Map<String, Material> materials,
    List<Section> sections,
    List<BoundaryCondition> boundaryConditions,
    List<Load> loads,
    List<SkippedSection> skippedSections
) {
    /**
     * Compact constructor: null collections become empty, all collections are copied read-only.
     */
    public FeModel {
        nodes = freeze(nodes);
        elements = freeze(elements);
        nodeSets = freeze(nodeSets);
        elementSets = freeze(elementSets);
        materials = freeze(materials);
        sections = sections == null ? List.of() : List.copyOf(sections);
        boundaryConditions = boundaryConditions == null ? List.of() : List.copyOf(boundaryConditions);
        loads = loads == null ? List.of() : List.copyOf(loads);
        skippedSections = skippedSections == null ? List.of() : List.copyOf(skippedSections);
    }

    /**
     * Creates a model without any entity.
     *
     * @return empty model
     */
    public static FeModel empty() {
        return new FeModel(null, null, null, null, null, null, null, null, null);
    }

    /**
     * Normalizes an Abaqus name for case-insensitive lookup.
     *
     * @param name name as written
     * @return lookup key
     */
    public static String nameKey(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return name.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Finds a node set by name, ignoring case.
     *
     * @param name set name
     * @return the set, if defined
     */
    public Optional<NodeSet> nodeSet(String name) {
        return Optional.ofNullable(nodeSets.get(nameKey(name)));
    }

    /**
     * Finds an element set by name, ignoring case.
     *
     * @param name set name
     * @return the set, if defined
     */
    public Optional<ElementSet> elementSet(String name) {
        return Optional.ofNullable(elementSets.get(nameKey(name)));
    }

    /**
     * Finds a material by name, ignoring case.
     *
     * @param name material name
     * @return the material, if defined
     */
    public Optional<Material> material(String name) {
        return Optional.ofNullable(materials.get(nameKey(name)));
    }

    /**
     * Returns true if the model defines neither nodes nor elements.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return nodes.isEmpty() && elements.isEmpty();
    }

    private static <K, V> Map<K, V> freeze(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
