package com.inp2ops.core.parser;

import com.inp2ops.core.model.SectionKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SectionContexts}.
 */
class SectionContextsTest {

    @Test
    void enter_elementDirective_carriesTypeAndSet() throws ParseException {
        SectionContext context = enter("*ELEMENT, TYPE=s4r, ELSET=Plate", SectionContexts.initial());

        assertThat(context).isInstanceOfSatisfying(SectionContext.ElementBlock.class, block -> {
            assertThat(block.type().tag()).isEqualTo("S4R");
            assertThat(block.elementSetName()).isEqualTo("Plate");
            assertThat(block.keyword()).isEqualTo("ELEMENT");
        });
    }

    @Test
    void enter_materialOptions_inheritEnclosingMaterial() throws ParseException {
        SectionContext material = enter("*MATERIAL, NAME=Steel", SectionContexts.initial());
        SectionContext plastic = enter("*PLASTIC", material);
        SectionContext density = enter("*DENSITY", plastic);

        assertThat(plastic).isInstanceOf(SectionContext.Skipped.class);
        assertThat(density).isEqualTo(new SectionContext.DensityBlock("Steel", 1));
    }

    @Test
    void enter_sectionDirective_mapsKind() throws ParseException {
        SectionContext context = enter("*BEAM SECTION, ELSET=Cols, MATERIAL=Steel, SECTION=pipe",
            SectionContexts.initial());

        assertThat(context).isEqualTo(new SectionContext.SectionBlock(
            "BEAM SECTION", SectionKind.BEAM, "Cols", "Steel", "PIPE", 1));
    }

    @Test
    void enter_sectionWithoutMaterial_fails() {
        assertThatThrownBy(() -> enter("*SHELL SECTION, ELSET=Plate", SectionContexts.initial()))
            .isInstanceOfSatisfying(ParseException.class, e ->
                assertThat(e.getKind()).isEqualTo(ParseException.Kind.MALFORMED_DIRECTIVE));
    }

    @Test
    void enter_unknownDirective_discardsData() throws ParseException {
        SectionContext context = enter("*AMPLITUDE, NAME=RAMP", SectionContexts.initial());

        assertThat(SectionContexts.interpretsData(context)).isFalse();
        assertThat(context.keyword()).isEqualTo("AMPLITUDE");
    }

    private static SectionContext enter(String directive, SectionContext previous) throws ParseException {
        return SectionContexts.enter(DirectiveLine.parse(directive, 1), previous);
    }
}
