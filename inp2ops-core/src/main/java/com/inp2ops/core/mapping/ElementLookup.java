package com.inp2ops.core.mapping;

import java.util.Objects;

/**
 * Result of an Element Type Map lookup.
 *
 * <p>A miss is a value, not an exception; the caller decides whether an unmapped type is fatal.
 */
public sealed interface ElementLookup permits ElementLookup.Mapped, ElementLookup.Unmapped {

    /**
     * Source tag that was looked up.
     *
     * @return upper-case source element tag
     */
    String sourceTag();

    /**
     * The type has a target equivalent.
     *
     * @param sourceTag source element tag
     * @param mapping target element data
     */
    record Mapped(String sourceTag, ElementMapping mapping) implements ElementLookup {
        public Mapped {
            Objects.requireNonNull(mapping, "mapping must not be null");
        }
    }

    /**
     * The type has no target equivalent.
     *
     * @param sourceTag source element tag
     */
    record Unmapped(String sourceTag) implements ElementLookup {}
}
