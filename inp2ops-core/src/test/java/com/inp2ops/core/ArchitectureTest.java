package com.inp2ops.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the converter.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The model does not know about the stages that produce or consume it</li>
 *   <li>Parser, translator and renderer only depend downstream</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.inp2ops.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..parser..", "..mapping..", "..translator..", "..renderer..", "..output..");

        rule.check(classes);
    }

    /**
     * Verifies the parser produces models without knowing how they are translated.
     */
    @Test
    void parser_shouldNotDependOnTranslationOrRendering() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..mapping..", "..translator..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Verifies renderers work on command sequences only, never on the parsed model.
     */
    @Test
    void renderers_shouldNotDependOnParserOrModel() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..renderer..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..parser..", "..model..", "..mapping..");

        rule.check(classes);
    }

    @Test
    void translator_shouldNotDependOnParserOrRenderer() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..translator..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..parser..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Utilities should be low-level, reusable components with no domain dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnDomainPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..model..", "..parser..", "..translator..", "..renderer..");

        rule.check(classes);
    }
}
