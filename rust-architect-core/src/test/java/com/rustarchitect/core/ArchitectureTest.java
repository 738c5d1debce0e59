package com.rustarchitect.core;

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
 *   <li>The model package depends on no other analysis package</li>
 *   <li>Extraction never depends on detection or report generation</li>
 *   <li>Report generators are SPI implementations working on the model only</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.rustarchitect.core");
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
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on the components that produce or render it.
     */
    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..scanner..", "..extractor..", "..detector..", "..cluster..",
                "..index..", "..generator..", "..config..", "..comparison..", "..metrics..");

        rule.check(classes);
    }

    /**
     * Verifies extractors read text only and know nothing about detection or reports.
     */
    @Test
    void extractors_shouldNotDependOnDetectionOrGeneration() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..extractor..")
            .should().dependOnClassesThat().resideInAnyPackage("..detector..", "..generator..", "..scanner..");

        rule.check(classes);
    }

    /**
     * Verifies report generators implement the SPI.
     */
    @Test
    void generators_shouldImplementReportGenerator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .and().haveSimpleNameEndingWith("Generator")
            .should().implement("com.rustarchitect.core.generator.ReportGenerator");

        rule.check(classes);
    }

    /**
     * Verifies generators render the model without re-running analysis.
     */
    @Test
    void generators_shouldNotDependOnAnalysis() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..generator..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..scanner..", "..extractor..", "..detector..", "..index..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes stay free of domain dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..model..", "..scanner..", "..extractor..", "..detector..", "..generator..");

        rule.check(classes);
    }
}
