package com.inp2ops.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Six-bit degree-of-freedom mask (UX, UY, UZ, RX, RY, RZ). Bit {@code i} corresponds to DOF {@code i + 1}.
 *
 * @param bits mask bits, only the lowest six are used
 */
public record DofMask(int bits) {

    /** Number of degrees of freedom per node in a full 3D frame model. */
    public static final int DOF_COUNT = 6;

    private static final int ALL = (1 << DOF_COUNT) - 1;

    /**
     * Compact constructor with validation.
     */
    public DofMask {
        if ((bits & ~ALL) != 0) {
            throw new IllegalArgumentException("mask has bits beyond DOF 6: " + Integer.toBinaryString(bits));
        }
    }

    /**
     * Mask with no DOF fixed.
     *
     * @return empty mask
     */
    public static DofMask free() {
        return new DofMask(0);
    }

    /**
     * Mask with all six DOFs fixed.
     *
     * @return full mask
     */
    public static DofMask all() {
        return new DofMask(ALL);
    }

    /**
     * Mask fixing the inclusive 1-based DOF range.
     *
     * @param first first DOF (1..6)
     * @param last last DOF (first..6)
     * @return mask with the range set
     */
    public static DofMask range(int first, int last) {
        if (first < 1 || last > DOF_COUNT || first > last) {
            throw new IllegalArgumentException("invalid DOF range " + first + ".." + last);
        }
        int bits = 0;
        for (int dof = first; dof <= last; dof++) {
            bits |= 1 << (dof - 1);
        }
        return new DofMask(bits);
    }

    /**
     * Mask fixing the listed 1-based DOFs.
     *
     * @param dofs DOF numbers (1..6)
     * @return mask with the DOFs set
     */
    public static DofMask of(int... dofs) {
        int bits = 0;
        for (int dof : dofs) {
            if (dof < 1 || dof > DOF_COUNT) {
                throw new IllegalArgumentException("DOF out of range: " + dof);
            }
            bits |= 1 << (dof - 1);
        }
        return new DofMask(bits);
    }

    /**
     * Union of this mask with another.
     *
     * @param other mask to merge
     * @return combined mask
     */
    public DofMask or(DofMask other) {
        return new DofMask(bits | other.bits);
    }

    /**
     * Whether the 1-based DOF is fixed.
     *
     * @param dof DOF number (1..6)
     * @return true if fixed
     */
    public boolean isFixed(int dof) {
        return (bits & (1 << (dof - 1))) != 0;
    }

    /**
     * Returns true if any DOF above {@code count} is fixed.
     *
     * @param count number of DOFs kept
     * @return true if truncation to {@code count} would drop a constraint
     */
    public boolean hasFixedBeyond(int count) {
        return (bits >> count) != 0;
    }

    /**
     * Expands the mask into 0/1 flags for the first {@code count} DOFs.
     *
     * @param count number of flags (3 or 6)
     * @return list of 1 (fixed) and 0 (free)
     */
    public List<Integer> toFlags(int count) {
        List<Integer> flags = new ArrayList<>(count);
        for (int dof = 1; dof <= count; dof++) {
            flags.add(isFixed(dof) ? 1 : 0);
        }
        return flags;
    }
}
