package com.inp2ops.core.translator;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Cross-section constants of the standard beam profiles.
 */
final class BeamProfiles {

    /**
     * Area, second moments of area and torsion constant of a profile.
     *
     * @param area cross-section area
     * @param iz second moment about the local z axis
     * @param iy second moment about the local y axis
     * @param j torsion constant
     */
    record Properties(double area, double iz, double iy, double j) {
    }

    private BeamProfiles() {
        // Utility class
    }

    /**
     * Computes section constants from profile dimensions.
     *
     * @param profile profile name: RECT (width, height), CIRC (radius) or PIPE (outer radius, wall thickness)
     * @param dimensions dimensions in the order above
     * @return the constants, empty for an unknown profile or too few dimensions
     */
    static Optional<Properties> compute(String profile, List<Double> dimensions) {
        if (profile == null) {
            return Optional.empty();
        }
        return switch (profile.toUpperCase(Locale.ROOT)) {
            case "RECT" -> dimensions.size() < 2 ? Optional.empty()
                : Optional.of(rectangle(dimensions.get(0), dimensions.get(1)));
            case "CIRC" -> dimensions.isEmpty() ? Optional.empty() : Optional.of(circle(dimensions.get(0)));
            case "PIPE" -> dimensions.size() < 2 ? Optional.empty()
                : Optional.of(pipe(dimensions.get(0), dimensions.get(1)));
            default -> Optional.empty();
        };
    }

    static Properties rectangle(double a, double b) {
        double area = a * b;
        double iz = a * b * b * b / 12.0;
        double iy = b * a * a * a / 12.0;
        double longSide = Math.max(a, b);
        double shortSide = Math.min(a, b);
        double ratio = shortSide / longSide;
        // Roark's approximation for a solid rectangle
        double j = longSide * Math.pow(shortSide, 3)
            * (1.0 / 3.0 - 0.21 * ratio * (1.0 - Math.pow(ratio, 4) / 12.0));
        return new Properties(area, iz, iy, j);
    }

    static Properties circle(double r) {
        double area = Math.PI * r * r;
        double i = Math.PI * Math.pow(r, 4) / 4.0;
        return new Properties(area, i, i, 2.0 * i);
    }

    static Properties pipe(double r, double t) {
        double inner = Math.max(r - t, 0.0);
        double area = Math.PI * (r * r - inner * inner);
        double i = Math.PI * (Math.pow(r, 4) - Math.pow(inner, 4)) / 4.0;
        return new Properties(area, i, i, 2.0 * i);
    }
}
