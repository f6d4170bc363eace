package com.inp2ops.core.parser;

import com.inp2ops.core.model.BoundaryCondition;
import com.inp2ops.core.model.BoundaryTarget;
import com.inp2ops.core.model.DofMask;
import com.inp2ops.core.model.FeModel;
import com.inp2ops.core.model.Material;
import com.inp2ops.core.model.Node;
import com.inp2ops.core.model.Section;
import com.inp2ops.core.model.SectionKind;
import com.inp2ops.core.model.SkippedSection;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Tests for {@link InpParser}.
 */
class InpParserTest extends ParserTestBase {

    private static final String TWO_NODE_TRUSS = """
        *NODE
        1, 0.0, 0.0, 0.0
        2, 10.0, 0.0, 0.0
        *ELEMENT, TYPE=T3D2, ELSET=BARS
        1, 1, 2
        """;

    @Test
    void parse_nodesAndElements_buildsModel() throws ParseException {
        FeModel model = parse(TWO_NODE_TRUSS);

        assertThat(model.nodes()).containsOnlyKeys(1, 2);
        assertThat(model.nodes().get(2)).isEqualTo(new Node(2, 10.0, 0.0, 0.0));
        assertThat(model.elements()).containsOnlyKeys(1);
        assertThat(model.elements().get(1).type().tag()).isEqualTo("T3D2");
        assertThat(model.elements().get(1).nodeIds()).containsExactly(1, 2);
        assertThat(model.elementSet("bars")).hasValueSatisfying(set ->
            assertThat(set.elementIds()).containsExactly(1));
    }

    @Test
    void parse_missingCoordinates_defaultToZero() throws ParseException {
        FeModel model = parse("""
            *NODE
            7, 1.5
            """);

        assertThat(model.nodes().get(7)).isEqualTo(new Node(7, 1.5, 0.0, 0.0));
    }

    @Test
    void parse_keywordCaseAndSpacing_areIgnored() throws ParseException {
        FeModel model = parse("""
            *nOdE, NSet=Corner
            1, 0, 0, 0
            *Element, Type=s4r, ELSET=Plate
            1, 1, 1, 1, 1
            *Material, Name=Steel
            *elastic
            210000.0, 0.3
            *shell   section, elset=PLATE, material=STEEL
            0.01
            """);

        assertThat(model.nodeSet("CORNER")).isPresent();
        assertThat(model.elements().get(1).type().tag()).isEqualTo("S4R");
        assertThat(model.sections()).singleElement().satisfies(section -> {
            assertThat(section.kind()).isEqualTo(SectionKind.SHELL);
            assertThat(section.materialName()).isEqualTo("Steel");
            assertThat(section.properties()).containsExactly(0.01);
        });
    }

    @Test
    void parse_commentsAndBlankLines_doNotChangeContext() throws ParseException {
        FeModel model = parse("""
            *NODE
            1, 0.0, 0.0, 0.0
            ** a comment between records

            2, 1.0, 0.0, 0.0
            """);

        assertThat(model.nodes()).containsOnlyKeys(1, 2);
    }

    @Test
    void parse_windowsLineEndings_areAccepted() throws ParseException {
        FeModel model = parse("*NODE\r\n1, 0.0, 0.0, 0.0\r\n2, 1.0, 0.0, 0.0\r\n");

        assertThat(model.nodes()).hasSize(2);
    }

    @Test
    void parse_unknownKeyword_isRecordedAsSkippedSection() throws ParseException {
        FeModel model = parse("""
            *HEADING
            Cantilever test model
            *NODE
            1, 0.0, 0.0, 0.0
            *STEP, NLGEOM=NO
            *STATIC
            1.0, 1.0
            *END STEP
            """);

        assertThat(model.nodes()).hasSize(1);
        assertThat(model.skippedSections()).extracting(SkippedSection::keyword)
            .containsExactly("HEADING", "STEP", "STATIC", "END STEP");
        assertThat(model.skippedSections().get(0).discardedLines()).isEqualTo(1);
        assertThat(model.skippedSections().get(2).line()).isEqualTo(6);
    }

    @Test
    void parse_onlyUnrecognizedKeyword_returnsEmptyModel() throws ParseException {
        FeModel model = parse("""
            *PREPRINT, ECHO=NO
            """);

        assertThat(model.isEmpty()).isTrue();
        assertThat(model.skippedSections()).singleElement()
            .extracting(SkippedSection::keyword).isEqualTo("PREPRINT");
    }

    @Test
    void parse_nonNumericField_reportsLineAndFieldIndex() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0.0, abc, 0.0
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.MALFORMED_RECORD);
        assertThat(failure.getLine()).isEqualTo(2);
        assertThat(failure.getFieldIndex()).isEqualTo(2);
        assertThat(failure.getSectionName()).isEqualTo("NODE");
        assertThat(failure.getMessage()).startsWith("line 2 (*NODE), field 2:");
    }

    @Test
    void parse_fortranExponent_isAccepted() throws ParseException {
        FeModel model = parse("""
            *NODE
            1, 1.5D2, 0.0, 0.0
            """);

        assertThat(model.nodes().get(1).x()).isEqualTo(150.0);
    }

    @Test
    void parse_dataBeforeAnyKeyword_fails() {
        ParseException failure = parseFailure("""
            1, 0.0, 0.0, 0.0
            *NODE
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.MALFORMED_RECORD);
        assertThat(failure.getLine()).isEqualTo(1);
    }

    @Test
    void parse_duplicateNodeId_failsWithoutOverwriting() {
        ParseException failure = parseFailure("""
            *NODE
            7, 0.0, 0.0, 0.0
            7, 1.0, 0.0, 0.0
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.DUPLICATE_ID);
        assertThat(failure.getLine()).isEqualTo(3);
        assertThat(failure.getMessage()).contains("node 7");
    }

    @Test
    void parse_duplicateElementId_failsAtSecondDefinition() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0.0, 0.0, 0.0
            2, 1.0, 0.0, 0.0
            3, 2.0, 0.0, 0.0
            *ELEMENT, TYPE=T3D2
            4, 1, 2
            4, 2, 3
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.DUPLICATE_ID);
        assertThat(failure.getLine()).isEqualTo(7);
        assertThat(failure.getFieldIndex()).isZero();
        assertThat(failure.getMessage()).contains("element 4 already defined at line 6");
    }

    @Test
    void parse_duplicateMaterialName_fails() {
        ParseException failure = parseFailure("""
            *MATERIAL, NAME=Steel
            *MATERIAL, NAME=STEEL
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.DUPLICATE_ID);
        assertThat(failure.getLine()).isEqualTo(2);
    }

    @Test
    void parse_secondSectionOnSameElementSet_fails() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0, 0, 0
            2, 1, 0, 0
            *ELEMENT, TYPE=T3D2, ELSET=BARS
            1, 1, 2
            *MATERIAL, NAME=Steel
            *ELASTIC
            200000.0, 0.3
            *SOLID SECTION, ELSET=BARS, MATERIAL=Steel
            1.0
            *SOLID SECTION, ELSET=bars, MATERIAL=Steel
            2.0
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.DUPLICATE_ID);
        assertThat(failure.getLine()).isEqualTo(11);
    }

    @Test
    void parse_forwardReferences_resolveRegardlessOfOrder() throws ParseException {
        FeModel model = parse("""
            *BOUNDARY
            SUPPORT, ENCASTRE
            *SOLID SECTION, ELSET=BARS, MATERIAL=Steel
            2.5
            *NSET, NSET=SUPPORT
            1
            *ELSET, ELSET=BARS
            1
            *MATERIAL, NAME=Steel
            *ELASTIC
            200000.0, 0.3
            *ELEMENT, TYPE=T3D2
            1, 1, 2
            *NODE
            1, 0.0, 0.0, 0.0
            2, 10.0, 0.0, 0.0
            """);

        assertThat(model.boundaryConditions()).hasSize(1);
        assertThat(model.sections()).singleElement().satisfies(section -> {
            assertThat(section.kind()).isEqualTo(SectionKind.TRUSS);
            assertThat(section.properties()).containsExactly(2.5);
        });
    }

    @Test
    void parse_elementWithUndefinedNode_failsAtElementLine() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0.0, 0.0, 0.0
            *ELEMENT, TYPE=T3D2
            1, 1, 99
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.UNDEFINED_REFERENCE);
        assertThat(failure.getLine()).isEqualTo(4);
        assertThat(failure.getFieldIndex()).isEqualTo(2);
        assertThat(failure.getMessage()).contains("undefined node 99");
    }

    @Test
    void parse_boundaryOnUndefinedNodeSet_fails() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0.0, 0.0, 0.0
            *BOUNDARY
            MISSING, 1, 3
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.UNDEFINED_REFERENCE);
        assertThat(failure.getLine()).isEqualTo(4);
        assertThat(failure.getSectionName()).isEqualTo("BOUNDARY");
    }

    @Test
    void parse_loadOnUndefinedNode_fails() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0.0, 0.0, 0.0
            *CLOAD
            5, 2, -100.0
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.UNDEFINED_REFERENCE);
        assertThat(failure.getSectionName()).isEqualTo("CLOAD");
    }

    @Test
    void parse_sectionWithUndefinedMaterial_fails() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0, 0, 0
            *ELEMENT, TYPE=C3D8, ELSET=BLOCK
            1, 1, 1, 1, 1, 1, 1, 1, 1
            *SOLID SECTION, ELSET=BLOCK, MATERIAL=Concrete
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.UNDEFINED_REFERENCE);
        assertThat(failure.getLine()).isEqualTo(5);
        assertThat(failure.getMessage()).contains("Concrete");
    }

    @Test
    void parse_generatedSet_expandsRangeWithStep() throws ParseException {
        FeModel model = parse("""
            *NODE
            1, 0, 0, 0
            2, 1, 0, 0
            3, 2, 0, 0
            4, 3, 0, 0
            5, 4, 0, 0
            *NSET, NSET=ODD, GENERATE
            1, 5, 2
            """);

        assertThat(model.nodeSet("ODD")).hasValueSatisfying(set ->
            assertThat(set.nodeIds()).containsExactly(1, 3, 5));
    }

    @Test
    void parse_generatedRangeEndingAtIntegerLimit_terminates() {
        // Given a range whose next step would pass Integer.MAX_VALUE
        String deck = """
            *NODE
            1, 0, 0, 0
            *NSET, NSET=TOP, GENERATE
            2147483645, 2147483647, 5
            """;

        // When / Then: the single generated id is undefined and parsing stops
        ParseException failure = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> parseFailure(deck));

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.UNDEFINED_REFERENCE);
        assertThat(failure.getMessage()).contains("2147483645");
    }

    @Test
    void parse_generatedRangeAboveLimit_failsBeforeExpanding() {
        ParseException failure = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> parseFailure("""
            *NODE
            1, 0, 0, 0
            *NSET, NSET=ALL, GENERATE
            1, 2000000000
            """));

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.MALFORMED_RECORD);
        assertThat(failure.getLine()).isEqualTo(4);
        assertThat(failure.getFieldIndex()).isEqualTo(1);
        assertThat(failure.getMessage()).contains("more than the limit");
    }

    @Test
    void parse_setReferencingOtherSet_includesItsMembers() throws ParseException {
        FeModel model = parse("""
            *NODE
            1, 0, 0, 0
            2, 1, 0, 0
            3, 2, 0, 0
            *NSET, NSET=LEFT
            1, 2
            *NSET, NSET=ALL
            LEFT, 3, 1
            """);

        assertThat(model.nodeSet("ALL")).hasValueSatisfying(set ->
            assertThat(set.nodeIds()).containsExactly(1, 2, 3));
    }

    @Test
    void parse_setsWithSameName_accumulate() throws ParseException {
        FeModel model = parse("""
            *NODE, NSET=EDGE
            1, 0, 0, 0
            2, 1, 0, 0
            *NSET, NSET=EDGE
            2
            *NODE
            3, 2, 0, 0
            *NSET, NSET=edge
            3
            """);

        assertThat(model.nodeSet("EDGE")).hasValueSatisfying(set ->
            assertThat(set.nodeIds()).containsExactly(1, 2, 3));
    }

    @Test
    void parse_cyclicSetReference_fails() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0, 0, 0
            *NSET, NSET=A
            B
            *NSET, NSET=B
            A
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.UNDEFINED_REFERENCE);
        assertThat(failure.getMessage()).contains("includes itself");
    }

    @Test
    void parse_materialWithElasticAndDensity_collectsProperties() throws ParseException {
        FeModel model = parse("""
            *MATERIAL, NAME=Steel
            *DENSITY
            7.85e-9
            *ELASTIC, TYPE=ISOTROPIC
            210000.0, 0.3
            """);

        Material steel = model.material("steel").orElseThrow();
        assertThat(steel.kind()).isEqualTo("ELASTIC");
        assertThat(steel.elastic().youngsModulus()).isEqualTo(210000.0);
        assertThat(steel.elastic().poissonsRatio()).isEqualTo(0.3);
        assertThat(steel.density()).isEqualTo(7.85e-9);
    }

    @Test
    void parse_nonIsotropicElastic_isSkippedAndMaterialStaysUndefined() throws ParseException {
        FeModel model = parse("""
            *MATERIAL, NAME=Ply
            *ELASTIC, TYPE=ENGINEERING CONSTANTS
            140000.0, 10000.0, 10000.0, 0.3, 0.3, 0.45, 5000.0, 5000.0
            3500.0
            *DENSITY
            1.6e-9
            """);

        Material ply = model.material("PLY").orElseThrow();
        assertThat(ply.kind()).isEqualTo("UNDEFINED");
        assertThat(ply.density()).isEqualTo(1.6e-9);
        assertThat(model.skippedSections()).singleElement().satisfies(skipped -> {
            assertThat(skipped.keyword()).isEqualTo("ELASTIC, TYPE=ENGINEERING CONSTANTS");
            assertThat(skipped.discardedLines()).isEqualTo(2);
        });
    }

    @Test
    void parse_elasticOutsideMaterial_fails() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0, 0, 0
            *ELASTIC
            210000.0, 0.3
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.MALFORMED_DIRECTIVE);
        assertThat(failure.getLine()).isEqualTo(3);
    }

    @Test
    void parse_elementWithoutType_fails() {
        ParseException failure = parseFailure("""
            *ELEMENT, ELSET=BARS
            1, 1, 2
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.MALFORMED_DIRECTIVE);
        assertThat(failure.getMessage()).contains("type=");
    }

    @Test
    void parse_longElementRecord_continuesOnNextLine() throws ParseException {
        StringBuilder deck = new StringBuilder("*NODE\n");
        for (int id = 1; id <= 20; id++) {
            deck.append(id).append(", ").append(id).append(".0, 0.0, 0.0\n");
        }
        deck.append("*ELEMENT, TYPE=C3D20\n");
        deck.append("1, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15,\n");
        deck.append("16, 17, 18, 19, 20\n");

        FeModel model = parse(deck.toString());

        assertThat(model.elements().get(1).nodeIds()).hasSize(20).endsWith(19, 20);
    }

    @Test
    void parse_directiveEndingWithComma_continuesOnNextLine() throws ParseException {
        FeModel model = parse("""
            *NODE
            1, 0, 0, 0
            2, 1, 0, 0
            *ELEMENT, TYPE=T3D2,
            ELSET=BARS
            1, 1, 2
            """);

        assertThat(model.elementSet("BARS")).isPresent();
        assertThat(model.elements()).containsOnlyKeys(1);
    }

    @Test
    void parse_boundaryForms_mapToDofMasks() throws ParseException {
        FeModel model = parse("""
            *NODE, NSET=BASE
            1, 0, 0, 0
            2, 1, 0, 0
            *BOUNDARY
            1, ENCASTRE
            BASE, PINNED
            2, 4, 6
            2, 2, 2, 0.5
            2, XSYMM
            """);

        assertThat(model.boundaryConditions()).extracting(BoundaryCondition::fixedDofs).containsExactly(
            DofMask.all(),
            DofMask.range(1, 3),
            DofMask.range(4, 6),
            DofMask.of(2),
            DofMask.of(1, 5, 6));
        assertThat(model.boundaryConditions().get(1).target())
            .isEqualTo(new BoundaryTarget.NodeSetTarget("BASE"));
        assertThat(model.boundaryConditions().get(3).magnitude()).isEqualTo(0.5);
    }

    @Test
    void parse_boundaryDofOutOfRange_fails() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0, 0, 0
            *BOUNDARY
            1, 1, 7
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.MALFORMED_RECORD);
        assertThat(failure.getFieldIndex()).isEqualTo(2);
    }

    @Test
    void parse_unknownBoundaryType_fails() {
        ParseException failure = parseFailure("""
            *NODE
            1, 0, 0, 0
            *BOUNDARY
            1, CLAMPED
            """);

        assertThat(failure.getKind()).isEqualTo(ParseException.Kind.MALFORMED_RECORD);
        assertThat(failure.getFieldIndex()).isEqualTo(1);
    }

    @Test
    void parse_concentratedLoad_setsSingleComponent() throws ParseException {
        FeModel model = parse("""
            *NODE
            2, 10.0, 0.0, 0.0
            *CLOAD
            2, 3, -500.0
            """);

        assertThat(model.loads()).singleElement().satisfies(load -> {
            assertThat(load.target()).isEqualTo(new BoundaryTarget.NodeTarget(2));
            assertThat(load.components()).containsExactly(0.0, 0.0, -500.0, 0.0, 0.0, 0.0);
        });
    }

    @Test
    void parse_beamSection_keepsProfileAndFirstLineOnly() throws ParseException {
        FeModel model = parse("""
            *NODE
            1, 0, 0, 0
            2, 0, 0, 3
            *ELEMENT, TYPE=B31, ELSET=COLUMNS
            1, 1, 2
            *MATERIAL, NAME=Steel
            *ELASTIC
            210000.0, 0.3
            *BEAM SECTION, ELSET=COLUMNS, MATERIAL=Steel, SECTION=rect
            0.2, 0.4
            1.0, 0.0, 0.0
            """);

        Section section = model.sections().get(0);
        assertThat(section.kind()).isEqualTo(SectionKind.BEAM);
        assertThat(section.profile()).isEqualTo("RECT");
        assertThat(section.properties()).containsExactly(0.2, 0.4);
    }

    @Test
    void parse_membraneSection_isKeptAsUnsupported() throws ParseException {
        FeModel model = parse("""
            *NODE
            1, 0, 0, 0
            *ELEMENT, TYPE=M3D4, ELSET=SKIN
            1, 1, 1, 1, 1
            *MEMBRANE SECTION, ELSET=SKIN
            0.002
            """);

        assertThat(model.sections()).singleElement().satisfies(section -> {
            assertThat(section.kind()).isEqualTo(SectionKind.UNSUPPORTED);
            assertThat(section.materialName()).isNull();
            assertThat(section.properties()).isEmpty();
        });
    }

    @Test
    void parse_byteOrderMark_isIgnored() throws ParseException {
        FeModel model = parse("\uFEFF*NODE\n1, 0, 0, 0\n");

        assertThat(model.nodes()).hasSize(1);
    }
}
