package com.inp2ops.core.translator;

import java.util.Objects;

/**
 * Translation settings.
 *
 * @param unmappedPolicy handling of unmapped element types
 * @param defaultNdf DOFs per node when no element type dictates one (3 or 6)
 */
public record ConversionOptions(
    UnmappedPolicy unmappedPolicy,
    int defaultNdf
) {
    public ConversionOptions {
        Objects.requireNonNull(unmappedPolicy, "unmappedPolicy must not be null");
        if (defaultNdf != 3 && defaultNdf != 6) {
            throw new IllegalArgumentException("defaultNdf must be 3 or 6 but was " + defaultNdf);
        }
    }

    /**
     * Skip unmapped elements, six DOFs per node.
     *
     * @return default options
     */
    public static ConversionOptions defaults() {
        return new ConversionOptions(UnmappedPolicy.SKIP, 6);
    }

    public ConversionOptions withUnmappedPolicy(UnmappedPolicy policy) {
        return new ConversionOptions(policy, defaultNdf);
    }
}
