package com.inp2ops.core.parser;

import com.inp2ops.core.model.ElementType;
import com.inp2ops.core.model.SectionKind;

import java.util.Locale;
import java.util.Map;

/**
 * Transition function of the keyword state machine.
 *
 * <p>Maps a directive, together with the context it follows, to the next {@link SectionContext}. The function
 * is pure: it depends only on its arguments and never touches the model being built.
 */
public final class SectionContexts {

    private static final Map<String, SectionKind> SECTION_KEYWORDS = Map.of(
        "SHELL SECTION", SectionKind.SHELL,
        "SOLID SECTION", SectionKind.SOLID,
        "BEAM SECTION", SectionKind.BEAM,
        "MEMBRANE SECTION", SectionKind.UNSUPPORTED,
        "SHELL GENERAL SECTION", SectionKind.UNSUPPORTED,
        "BEAM GENERAL SECTION", SectionKind.UNSUPPORTED
    );

    private static final String ISOTROPIC = "ISOTROPIC";

    private SectionContexts() {
        // Utility class
    }

    /**
     * Returns the initial context.
     *
     * @return context before the first directive
     */
    public static SectionContext initial() {
        return new SectionContext.Preamble();
    }

    /**
     * Computes the context opened by a directive.
     *
     * @param directive the directive just read
     * @param previous the context in effect before it
     * @return the new context
     * @throws ParseException if the directive lacks a required parameter or appears out of place
     */
    public static SectionContext enter(DirectiveLine directive, SectionContext previous) throws ParseException {
        String keyword = directive.keyword();
        int line = directive.line();

        if (SECTION_KEYWORDS.containsKey(keyword)) {
            SectionKind kind = SECTION_KEYWORDS.get(keyword);
            String material = kind == SectionKind.UNSUPPORTED
                ? directive.parameter("material")
                : directive.requireParameter("material");
            String profile = kind == SectionKind.BEAM ? upper(directive.parameter("section")) : null;
            return new SectionContext.SectionBlock(keyword, kind, directive.requireParameter("elset"),
                material, profile, line);
        }

        return switch (keyword) {
            case "NODE" -> new SectionContext.NodeBlock(directive.parameter("nset"), line);
            case "ELEMENT" -> new SectionContext.ElementBlock(
                new ElementType(directive.requireParameter("type")), directive.parameter("elset"), line);
            case "NSET" -> new SectionContext.NodeSetBlock(
                directive.requireParameter("nset"), directive.hasFlag("generate"), line);
            case "ELSET" -> new SectionContext.ElementSetBlock(
                directive.requireParameter("elset"), directive.hasFlag("generate"), line);
            case "MATERIAL" -> new SectionContext.MaterialBlock(directive.requireParameter("name"), line);
            case "ELASTIC" -> enterElastic(directive, previous);
            case "DENSITY" -> new SectionContext.DensityBlock(requireMaterial(directive, previous), line);
            case "BOUNDARY" -> new SectionContext.BoundaryBlock(line);
            case "CLOAD" -> new SectionContext.ConcentratedLoadBlock(line);
            default -> new SectionContext.Skipped(keyword, enclosingMaterial(previous), line);
        };
    }

    /**
     * Returns true if the context interprets data lines instead of discarding them.
     *
     * @param context a context
     * @return false for skipped sections
     */
    public static boolean interpretsData(SectionContext context) {
        return !(context instanceof SectionContext.Skipped);
    }

    private static SectionContext enterElastic(DirectiveLine directive, SectionContext previous) throws ParseException {
        String material = requireMaterial(directive, previous);
        String type = directive.parameter("type");
        if (type != null && !ISOTROPIC.equals(upper(type))) {
            // Anisotropic and engineering-constant forms have no linear isotropic equivalent
            return new SectionContext.Skipped("ELASTIC, TYPE=" + upper(type), material, directive.line());
        }
        return new SectionContext.ElasticBlock(material, directive.line());
    }

    private static String requireMaterial(DirectiveLine directive, SectionContext previous) throws ParseException {
        String material = enclosingMaterial(previous);
        if (material == null) {
            throw new ParseException(ParseException.Kind.MALFORMED_DIRECTIVE, directive.line(), directive.keyword(),
                "material option outside of a *MATERIAL definition");
        }
        return material;
    }

    private static String enclosingMaterial(SectionContext context) {
        if (context instanceof SectionContext.MaterialBlock m) {
            return m.name();
        }
        if (context instanceof SectionContext.ElasticBlock e) {
            return e.materialName();
        }
        if (context instanceof SectionContext.DensityBlock d) {
            return d.materialName();
        }
        if (context instanceof SectionContext.Skipped s) {
            return s.enclosingMaterial();
        }
        return null;
    }

    private static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
