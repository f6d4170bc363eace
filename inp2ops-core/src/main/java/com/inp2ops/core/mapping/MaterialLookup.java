package com.inp2ops.core.mapping;

import java.util.Objects;

/**
 * Result of a Material Model Map lookup.
 */
public sealed interface MaterialLookup permits MaterialLookup.Mapped, MaterialLookup.Unmapped {

    /**
     * Material kind that was looked up.
     *
     * @return upper-case material kind
     */
    String kind();

    /**
     * The kind has target material templates.
     *
     * @param kind material kind
     * @param mapping target templates
     */
    record Mapped(String kind, MaterialMapping mapping) implements MaterialLookup {
        public Mapped {
            Objects.requireNonNull(mapping, "mapping must not be null");
        }
    }

    /**
     * The kind has no target equivalent.
     *
     * @param kind material kind
     */
    record Unmapped(String kind) implements MaterialLookup {}
}
