package com.contractbridge.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The model and util layers stay free of analysis and sync code</li>
 *   <li>Source analyzers extend the shared JavaParser base class</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.contractbridge.core");
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

    @Test
    void models_shouldNotDependOnServices() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..scanner..", "..extractor..", "..sync..", "..drift..", "..breaking..", "..config..", "..io..");

        rule.check(classes);
    }

    /**
     * Utilities should be low-level, reusable components with no domain dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..scanner..", "..model..", "..sync..", "..config..");

        rule.check(classes);
    }

    @Test
    void baseAnalyzers_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..scanner.base..")
            .should().dependOnClassesThat().resideInAnyPackage("..extractor..", "..drift..", "..sync..");

        rule.check(classes);
    }

    @Test
    void callSiteScanners_shouldExtendBaseAnalyzer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..scanner..")
            .and().haveSimpleNameEndingWith("Scanner")
            .should().beAssignableTo("com.contractbridge.core.scanner.base.AbstractJavaSourceAnalyzer");

        rule.check(classes);
    }

    @Test
    void extractors_shouldExtendBaseAnalyzer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..extractor..")
            .and().areTopLevelClasses()
            .and().areNotInterfaces()
            .should().beAssignableTo("com.contractbridge.core.scanner.base.AbstractJavaSourceAnalyzer");

        rule.check(classes);
    }

    /**
     * Drift and breaking-change detection consume synced contracts but never trigger a sync.
     */
    @Test
    void detectors_shouldNotDependOnSync() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..drift..", "..breaking..")
            .should().dependOnClassesThat().resideInAPackage("..sync..");

        rule.check(classes);
    }
}
