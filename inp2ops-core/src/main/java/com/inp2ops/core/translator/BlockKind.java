package com.inp2ops.core.translator;

/**
 * Entity blocks of a command sequence, in output order.
 */
public enum BlockKind {
    MODEL("Model"),
    NODES("Nodes"),
    MATERIALS("Materials"),
    SECTIONS("Sections"),
    ELEMENTS("Elements"),
    BOUNDARY_CONDITIONS("Boundary conditions"),
    LOADS("Loads"),
    ANALYSIS("Analysis");

    private final String title;

    BlockKind(String title) {
        this.title = title;
    }

    /**
     * Human-readable block title.
     *
     * @return title used as the block's header comment
     */
    public String title() {
        return title;
    }
}
