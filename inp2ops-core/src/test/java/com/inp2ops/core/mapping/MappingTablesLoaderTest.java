package com.inp2ops.core.mapping;

import com.inp2ops.core.model.ElementType;
import com.inp2ops.core.model.SectionKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MappingTablesLoader} and lookups on the loaded {@link MappingTables}.
 */
class MappingTablesLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadDefault_shellElement_mapsToShellMitc4() {
        ElementLookup lookup = MappingTablesLoader.loadDefault().lookupElement("S4R");

        assertThat(lookup).isInstanceOfSatisfying(ElementLookup.Mapped.class, mapped -> {
            assertThat(mapped.mapping().target()).isEqualTo("ShellMITC4");
            assertThat(mapped.mapping().arity()).isEqualTo(4);
            assertThat(mapped.mapping().family()).isEqualTo(ElementFamily.SHELL);
            assertThat(mapped.mapping().ndf()).isEqualTo(6);
        });
    }

    @Test
    void loadDefault_lookupIsCaseInsensitive() {
        MappingTables tables = MappingTablesLoader.loadDefault();

        assertThat(tables.lookupElement("c3d8r")).isEqualTo(tables.lookupElement("C3D8R"));
        assertThat(tables.lookupMaterial("elastic")).isInstanceOf(MaterialLookup.Mapped.class);
    }

    @Test
    void loadDefault_unknownType_returnsUnmapped() {
        ElementLookup lookup = MappingTablesLoader.loadDefault().lookupElement("CPS4");

        assertThat(lookup).isEqualTo(new ElementLookup.Unmapped("CPS4"));
    }

    @Test
    void loadDefault_trussDoesNotConstrainDofs() {
        ElementLookup lookup = MappingTablesLoader.loadDefault().lookupElement("T3D2");

        assertThat(((ElementLookup.Mapped) lookup).mapping().constrainsNdf()).isFalse();
    }

    @Test
    void loadDefault_twentyNodeBrick_carriesBodyForceAndDensityArguments() {
        MappingTables tables = MappingTablesLoader.loadDefault();

        for (String tag : new String[] {"C3D20", "C3D20R"}) {
            assertThat(tables.lookupElement(tag)).isInstanceOfSatisfying(ElementLookup.Mapped.class, mapped -> {
                assertThat(mapped.mapping().target()).isEqualTo("20NodeBrick");
                assertThat(mapped.mapping().arity()).isEqualTo(20);
                assertThat(mapped.mapping().extraArguments()).containsExactly(0.0, 0.0, 0.0, 0.0);
            });
        }
        assertThat(((ElementLookup.Mapped) tables.lookupElement("C3D8")).mapping().extraArguments()).isEmpty();
    }

    @Test
    void loadDefault_trussFamily_matchesTrussTagPrefix() {
        // The parser infers truss sections from the tag prefix; the bundled table must agree with it
        MappingTables tables = MappingTablesLoader.loadDefault();

        tables.elements().forEach((tag, mapping) ->
            assertThat(new ElementType(tag).isTruss())
                .as("truss prefix of %s", tag)
                .isEqualTo(mapping.family() == ElementFamily.TRUSS));
    }

    @Test
    void loadDefault_containsAnalysisTemplateAndSections() {
        MappingTables tables = MappingTablesLoader.loadDefault();

        assertThat(tables.ndm()).isEqualTo(3);
        assertThat(tables.analysis())
            .extracting(AnalysisStep::command)
            .containsExactly("constraints", "numberer", "system", "test", "algorithm", "integrator",
                "analysis", "analyze");
        assertThat(tables.sectionType(SectionKind.SHELL)).contains("ElasticMembranePlateSection");
        assertThat(tables.sectionType(SectionKind.SOLID)).isEmpty();
    }

    @Test
    void load_customFile_replacesBundledTables() throws IOException {
        Path file = tempDir.resolve("tables.yaml");
        Files.writeString(file, """
            ndm: 2
            elements:
              cps4: { target: quad, arity: 4, dimension: 2, family: SOLID, ndf: 2 }
            analysis:
              - { command: analyze, args: [5] }
            unknownKey: ignored
            """);

        MappingTables tables = MappingTablesLoader.load(file);

        assertThat(tables.ndm()).isEqualTo(2);
        assertThat(tables.lookupElement("CPS4")).isInstanceOf(ElementLookup.Mapped.class);
        assertThat(tables.lookupElement("S4")).isInstanceOf(ElementLookup.Unmapped.class);
        assertThat(tables.analysis()).singleElement()
            .satisfies(step -> assertThat(step.arguments()).containsExactly(5));
    }

    @Test
    void load_missingFile_throwsIOException() {
        assertThatThrownBy(() -> MappingTablesLoader.load(tempDir.resolve("absent.yaml")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("absent.yaml");
    }
}
