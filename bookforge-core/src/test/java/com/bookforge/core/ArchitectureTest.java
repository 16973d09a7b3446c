package com.bookforge.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Token variants are immutable records</li>
 *   <li>Renderers implement the renderer SPI</li>
 *   <li>Markdown library types stay inside the parser</li>
 *   <li>The core library has no CLI or logging backend dependencies</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.bookforge.core");
    }

    /**
     * Verifies every token variant is a record, so token trees are immutable and comparable.
     */
    @Test
    void tokens_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..token..")
            .and().areTopLevelClasses()
            .and().areNotInterfaces()
            .and().doNotHaveSimpleName("Tokens")
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies all renderer implementations implement BookRenderer so ServiceLoader can find them.
     */
    @Test
    void renderers_shouldImplementBookRenderer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..renderer.impl..")
            .and().haveSimpleNameEndingWith("Renderer")
            .should().implement("com.bookforge.core.renderer.BookRenderer");

        rule.check(classes);
    }

    /**
     * Verifies flexmark types never leak out of the parser package.
     */
    @Test
    void flexmark_shouldOnlyBeUsedByParser() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..parser..")
            .should().dependOnClassesThat().resideInAPackage("com.vladsch.flexmark..");

        rule.check(classes);
    }

    /**
     * Verifies the token model does not depend on parsing or rendering.
     */
    @Test
    void tokens_shouldNotDependOnParserOrRenderers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..token..")
            .should().dependOnClassesThat().resideInAnyPackage("..parser..", "..renderer..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies renderers never reach back into configuration loading or publishing.
     */
    @Test
    void renderers_shouldNotDependOnPublishing() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..publish..", "..parser..");

        rule.check(classes);
    }

    /**
     * Verifies the core library stays free of CLI and logging backend classes.
     */
    @Test
    void core_shouldNotDependOnCliOrLoggingBackend() {
        ArchRule rule = noClasses()
            .should().dependOnClassesThat().resideInAnyPackage("picocli..", "ch.qos.logback..", "com.bookforge.cli..");

        rule.check(classes);
    }

    /**
     * Verifies every domain exception extends BookException.
     */
    @Test
    void exceptions_shouldExtendBookException() {
        ArchRule rule = classes()
            .that().resideInAPackage("..error..")
            .and().haveSimpleNameEndingWith("Exception")
            .and().doNotHaveSimpleName("BookException")
            .should().beAssignableTo("com.bookforge.core.error.BookException");

        rule.check(classes);
    }
}
