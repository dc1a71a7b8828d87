package com.szntopology.core;

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
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The model and utility layers stay free of parsing and injection logic</li>
 *   <li>Only the parser package touches the generated ANTLR classes</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.szntopology.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnProcessing() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.parser..", "..core.assembler..", "..core.selector..", "..core.injection..");

        rule.check(classes);
    }

    /**
     * Utilities should be low-level, reusable components with no domain dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.model..", "..core.parser..", "..core.selector..", "..core.injection..");

        rule.check(classes);
    }

    @Test
    void generatedParser_shouldOnlyBeUsedByParserPackage() {
        ArchRule rule = classes()
            .that().haveNameMatching(".*\\.Szn(Lexer|Parser|Visitor|BaseVisitor)(\\$.*)?")
            .should().onlyBeAccessed().byAnyPackage("..core.parser..");

        rule.check(classes);
    }

    @Test
    void selectors_shouldNotDependOnInjection() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.selector..")
            .should().dependOnClassesThat().resideInAPackage("..core.injection..");

        rule.check(classes);
    }
}
