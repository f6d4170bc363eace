package com.inp2ops.core.mapping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.inp2ops.core.model.SectionKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static lookup data from source entity kinds to target commands.
 *
 * <p>Everything target-specific that is not formatting lives here: element type names and arities,
 * material and section command names, the geometric transformation and load pattern types and the analysis
 * template. Loaded from {@code mapping-tables.yaml} by {@link MappingTablesLoader}; immutable afterwards.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * ndm: 3
 * elements:
 *   S4: { target: ShellMITC4, arity: 4, dimension: 2, family: SHELL, ndf: 6 }
 * materials:
 *   ELASTIC: { nd: ElasticIsotropic, uniaxial: Elastic }
 * sections:
 *   SHELL: ElasticMembranePlateSection
 * analysis:
 *   - { command: constraints, args: [Plain] }
 * }</pre>
 *
 * @param ndm spatial dimension of the generated model
 * @param elements Element Type Map keyed by upper-case source tag
 * @param materials Material Model Map keyed by upper-case material kind
 * @param sections section command type keyed by section kind
 * @param geometricTransformation transformation type used for beams
 * @param timeSeries time series type of the load pattern
 * @param loadPattern load pattern type
 * @param analysis static analysis command template
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MappingTables(
    @JsonProperty("ndm") int ndm,
    @JsonProperty("elements") Map<String, ElementMapping> elements,
    @JsonProperty("materials") Map<String, MaterialMapping> materials,
    @JsonProperty("sections") Map<SectionKind, String> sections,
    @JsonProperty("geometricTransformation") String geometricTransformation,
    @JsonProperty("timeSeries") String timeSeries,
    @JsonProperty("loadPattern") String loadPattern,
    @JsonProperty("analysis") List<AnalysisStep> analysis
) {
    public MappingTables {
        elements = upperCaseKeys(elements);
        materials = upperCaseKeys(materials);
        sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
        analysis = analysis == null ? List.of() : List.copyOf(analysis);
        if (ndm <= 0) {
            ndm = 3;
        }
    }

    /**
     * Looks up a source element type.
     *
     * @param sourceTag source element tag, any case
     * @return the mapping or {@link ElementLookup.Unmapped}
     */
    public ElementLookup lookupElement(String sourceTag) {
        String key = key(sourceTag);
        ElementMapping mapping = elements.get(key);
        return mapping != null ? new ElementLookup.Mapped(key, mapping) : new ElementLookup.Unmapped(key);
    }

    /**
     * Looks up a material kind.
     *
     * @param kind material kind, any case
     * @return the mapping or {@link MaterialLookup.Unmapped}
     */
    public MaterialLookup lookupMaterial(String kind) {
        String key = key(kind);
        MaterialMapping mapping = materials.get(key);
        return mapping != null ? new MaterialLookup.Mapped(key, mapping) : new MaterialLookup.Unmapped(key);
    }

    /**
     * Returns the section command type for a section kind.
     *
     * @param kind section kind
     * @return target section type, empty when the kind needs no section command
     */
    public Optional<String> sectionType(SectionKind kind) {
        return Optional.ofNullable(sections.get(kind));
    }

    private static <V> Map<String, V> upperCaseKeys(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, V> result = new LinkedHashMap<>();
        source.forEach((k, v) -> result.put(key(k), v));
        return Collections.unmodifiableMap(result);
    }

    private static String key(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }
}
