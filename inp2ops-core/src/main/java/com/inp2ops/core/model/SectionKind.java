package com.inp2ops.core.model;

/**
 * Kinds of section property definitions.
 */
public enum SectionKind {
    /** {@code *SHELL SECTION}: thickness */
    SHELL,

    /** {@code *SOLID SECTION} on continuum elements */
    SOLID,

    /** {@code *BEAM SECTION}: profile dimensions */
    BEAM,

    /** {@code *SOLID SECTION} on truss elements: cross-sectional area */
    TRUSS,

    /** Recognized section keyword that has no target equivalent */
    UNSUPPORTED
}
