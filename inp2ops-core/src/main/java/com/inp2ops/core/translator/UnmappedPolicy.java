package com.inp2ops.core.translator;

/**
 * What to do with an element whose type has no target equivalent.
 */
public enum UnmappedPolicy {
    /** Leave the element out with a comment and a warning. */
    SKIP,

    /** Abort the conversion. */
    FAIL
}
