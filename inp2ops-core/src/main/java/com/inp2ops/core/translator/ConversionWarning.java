package com.inp2ops.core.translator;

import java.util.Objects;

/**
 * Non-fatal finding of a translation run.
 *
 * @param kind what kind of degradation happened
 * @param message human-readable description naming the entity
 */
public record ConversionWarning(
    Kind kind,
    String message
) {
    public ConversionWarning {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Warning categories.
     */
    public enum Kind {
        /** Element type absent from the Element Type Map; the element was left out. */
        UNMAPPED_ELEMENT_TYPE,

        /** Material kind absent from the Material Model Map. */
        UNMAPPED_MATERIAL,

        /** Section that cannot be expressed in the target runtime. */
        UNMAPPED_SECTION,

        /** Optional property missing, a default was used. */
        DEFAULTED_PROPERTY,

        /** Element without a usable section or material, default tags were used. */
        UNASSIGNED_SECTION,

        /** Constraint or load on a DOF the model does not have. */
        DROPPED_DOF,

        /** Non-zero prescribed displacement emitted as a plain fix. */
        PRESCRIBED_DISPLACEMENT
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
