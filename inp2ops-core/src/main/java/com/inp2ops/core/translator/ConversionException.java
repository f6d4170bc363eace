package com.inp2ops.core.translator;

/**
 * Unrecoverable translation failure. No partial command sequence is produced.
 */
public class ConversionException extends Exception {

    /**
     * Failure categories.
     */
    public enum Kind {
        /** Element node count differs from the mapped type's arity. */
        ARITY_MISMATCH,

        /** Boundary or load target that does not resolve to a node. */
        UNDEFINED_REFERENCE,

        /** Unmapped element type under the fail policy. */
        UNMAPPED_TYPE,

        /** Element types needing different DOFs per node in one model. */
        MIXED_DOF
    }

    private final Kind kind;

    public ConversionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
