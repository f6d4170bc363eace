package com.inp2ops.core.model;

/**
 * Isotropic linear-elastic constants.
 *
 * @param youngsModulus Young's modulus E, strictly positive
 * @param poissonsRatio Poisson's ratio, or null if the input omitted it
 */
public record ElasticProperties(
    double youngsModulus,
    Double poissonsRatio
) {
    /**
     * Compact constructor with validation.
     */
    public ElasticProperties {
        if (!(youngsModulus > 0.0)) {
            throw new IllegalArgumentException("Young's modulus must be positive: " + youngsModulus);
        }
    }

    /**
     * Poisson's ratio with 0.0 substituted when it was omitted.
     *
     * @return effective Poisson's ratio
     */
    public double effectivePoissonsRatio() {
        return poissonsRatio != null ? poissonsRatio : 0.0;
    }

    /**
     * Returns true when Poisson's ratio was given and lies in the open interval (-1, 0.5).
     *
     * @return true if the ratio is admissible
     */
    public boolean hasAdmissiblePoissonsRatio() {
        return poissonsRatio != null && poissonsRatio > -1.0 && poissonsRatio < 0.5;
    }

    /**
     * Shear modulus G = E / (2 (1 + nu)).
     *
     * @return shear modulus
     */
    public double shearModulus() {
        return youngsModulus / (2.0 * (1.0 + effectivePoissonsRatio()));
    }
}
