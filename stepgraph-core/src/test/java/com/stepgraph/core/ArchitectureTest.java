package com.stepgraph.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>The pipeline layers only depend downwards: lexer, parser, graph, view, generator</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Generators and renderers implement their SPI interfaces</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.stepgraph.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotInterfaces()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * The model is plain data and knows nothing about how it is produced or shown.
     */
    @Test
    void models_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..graph..", "..view..", "..generator..", "..renderer..", "..loader..");

        rule.check(classes);
    }

    @Test
    void lexer_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..lexer..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..graph..", "..view..", "..generator..", "..renderer..");

        rule.check(classes);
    }

    @Test
    void graph_shouldNotDependOnPresentation() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..graph..")
            .should().dependOnClassesThat().resideInAnyPackage("..view..", "..generator..", "..renderer..");

        rule.check(classes);
    }

    @Test
    void generators_shouldImplementDiagramGenerator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .and().haveSimpleNameEndingWith("Generator")
            .should().implement("com.stepgraph.core.generator.DiagramGenerator");

        rule.check(classes);
    }

    @Test
    void renderers_shouldImplementOutputRenderer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..renderer.impl..")
            .and().haveSimpleNameEndingWith("Renderer")
            .should().implement("com.stepgraph.core.renderer.OutputRenderer");

        rule.check(classes);
    }
}
