package com.inp2ops.core.parser;

import com.inp2ops.core.model.ElementType;
import com.inp2ops.core.model.SectionKind;

import java.util.Objects;

/**
 * The section in effect while reading data lines: which directive opened it and with which parameters.
 *
 * <p>Values are immutable. The parser moves from one context to the next through
 * {@link SectionContexts#enter(DirectiveLine, SectionContext)}, and each data line is interpreted against the
 * context it was read under.
 */
public sealed interface SectionContext {

    /**
     * Keyword shown in error messages.
     *
     * @return directive keyword, or null before the first directive
     */
    String keyword();

    /**
     * Line of the directive that opened this section.
     *
     * @return 1-based line number, 0 before the first directive
     */
    int line();

    /** Start of input, before any directive. */
    record Preamble() implements SectionContext {
        @Override
        public String keyword() {
            return null;
        }

        @Override
        public int line() {
            return 0;
        }
    }

    /**
     * {@code *NODE} block.
     *
     * @param nodeSetName set receiving the defined nodes, or null
     * @param line directive line
     */
    record NodeBlock(String nodeSetName, int line) implements SectionContext {
        @Override
        public String keyword() {
            return "NODE";
        }
    }

    /**
     * {@code *ELEMENT} block.
     *
     * @param type element type shared by every record
     * @param elementSetName set receiving the defined elements, or null
     * @param line directive line
     */
    record ElementBlock(ElementType type, String elementSetName, int line) implements SectionContext {
        public ElementBlock {
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public String keyword() {
            return "ELEMENT";
        }
    }

    /**
     * {@code *NSET} block.
     *
     * @param name set name
     * @param generate whether records are first, last, step triples
     * @param line directive line
     */
    record NodeSetBlock(String name, boolean generate, int line) implements SectionContext {
        @Override
        public String keyword() {
            return "NSET";
        }
    }

    /**
     * {@code *ELSET} block.
     *
     * @param name set name
     * @param generate whether records are first, last, step triples
     * @param line directive line
     */
    record ElementSetBlock(String name, boolean generate, int line) implements SectionContext {
        @Override
        public String keyword() {
            return "ELSET";
        }
    }

    /**
     * {@code *MATERIAL} header; carries no data lines itself.
     *
     * @param name material name
     * @param line directive line
     */
    record MaterialBlock(String name, int line) implements SectionContext {
        @Override
        public String keyword() {
            return "MATERIAL";
        }
    }

    /**
     * {@code *ELASTIC} option of a material.
     *
     * @param materialName enclosing material
     * @param line directive line
     */
    record ElasticBlock(String materialName, int line) implements SectionContext {
        @Override
        public String keyword() {
            return "ELASTIC";
        }
    }

    /**
     * {@code *DENSITY} option of a material.
     *
     * @param materialName enclosing material
     * @param line directive line
     */
    record DensityBlock(String materialName, int line) implements SectionContext {
        @Override
        public String keyword() {
            return "DENSITY";
        }
    }

    /**
     * A section property directive ({@code *SHELL SECTION}, {@code *SOLID SECTION}, ...).
     *
     * @param keyword directive keyword
     * @param kind section kind as far as the directive tells
     * @param elementSetName element set the section applies to
     * @param materialName referenced material, may be null for unsupported sections
     * @param profile beam profile, or null
     * @param line directive line
     */
    record SectionBlock(
        String keyword,
        SectionKind kind,
        String elementSetName,
        String materialName,
        String profile,
        int line
    ) implements SectionContext {
    }

    /**
     * {@code *BOUNDARY} block.
     *
     * @param line directive line
     */
    record BoundaryBlock(int line) implements SectionContext {
        @Override
        public String keyword() {
            return "BOUNDARY";
        }
    }

    /**
     * {@code *CLOAD} block.
     *
     * @param line directive line
     */
    record ConcentratedLoadBlock(int line) implements SectionContext {
        @Override
        public String keyword() {
            return "CLOAD";
        }
    }

    /**
     * A directive the parser does not interpret; its data lines are discarded.
     *
     * @param keyword directive keyword
     * @param enclosingMaterial material still open when the directive appeared, or null
     * @param line directive line
     */
    record Skipped(String keyword, String enclosingMaterial, int line) implements SectionContext {
    }
}
