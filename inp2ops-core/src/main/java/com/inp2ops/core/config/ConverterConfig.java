package com.inp2ops.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.inp2ops.core.translator.ConversionOptions;
import com.inp2ops.core.translator.UnmappedPolicy;

import java.util.Locale;

/**
 * Root configuration of the converter.
 *
 * <p>Loaded from {@code inp2ops.yaml}. Every section is optional; missing values fall back to
 * {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * conversion:
 *   unmappedElements: skip   # or fail
 *   defaultNdf: 6
 *
 * mappings:
 *   path: ./custom-mapping-tables.yaml
 *
 * output:
 *   overwrite: false
 * }</pre>
 *
 * @param conversion translation settings
 * @param mappings mapping table location
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConverterConfig(
    @JsonProperty("conversion") ConversionSettings conversion,
    @JsonProperty("mappings") MappingSettings mappings,
    @JsonProperty("output") OutputSettings output
) {
    public ConverterConfig {
        conversion = conversion == null ? ConversionSettings.defaults() : conversion;
        mappings = mappings == null ? new MappingSettings(null) : mappings;
        output = output == null ? new OutputSettings(false) : output;
    }

    /**
     * Skip unmapped elements, six DOFs per node, bundled tables, never overwrite.
     *
     * @return default configuration
     */
    public static ConverterConfig defaults() {
        return new ConverterConfig(ConversionSettings.defaults(), new MappingSettings(null), new OutputSettings(false));
    }

    /**
     * Translation settings.
     *
     * @param unmappedElements {@code skip} or {@code fail}
     * @param defaultNdf DOFs per node when no element type decides (3 or 6)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConversionSettings(
        @JsonProperty("unmappedElements") String unmappedElements,
        @JsonProperty("defaultNdf") Integer defaultNdf
    ) {
        public static ConversionSettings defaults() {
            return new ConversionSettings("skip", 6);
        }

        /**
         * Converts these settings into translator options.
         *
         * <p>Unknown policy names fall back to skip and DOF counts other than 3 fall back to 6.
         *
         * @return translator options
         */
        public ConversionOptions toOptions() {
            UnmappedPolicy policy = unmappedElements != null
                && "fail".equals(unmappedElements.trim().toLowerCase(Locale.ROOT))
                ? UnmappedPolicy.FAIL
                : UnmappedPolicy.SKIP;
            int ndf = defaultNdf != null && defaultNdf == 3 ? 3 : 6;
            return new ConversionOptions(policy, ndf);
        }
    }

    /**
     * Mapping table location.
     *
     * @param path YAML table file replacing the bundled tables, or null
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MappingSettings(
        @JsonProperty("path") String path
    ) {}

    /**
     * Output settings.
     *
     * @param overwrite whether existing scripts may be replaced
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("overwrite") boolean overwrite
    ) {}
}
