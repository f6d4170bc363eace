package com.inp2ops.core.mapping;

/**
 * Structural role of a target element; decides which trailing arguments an element command takes.
 */
public enum ElementFamily {
    /** Axial bar: cross-section area and material tag. */
    TRUSS,

    /** Frame member: section tag and geometric transformation tag. */
    BEAM,

    /** Shell: section tag. */
    SHELL,

    /** Continuum solid: material tag. */
    SOLID
}
