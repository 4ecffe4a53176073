package io.layerwarm.cli;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/** The command-line tool drives the core through its public packages only. */
class CliArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.layerwarm.cli");
    }

    @Test
    void configPackageDoesNotDependOnCommand() {
        ArchRule rule = noClasses()
                .that()
                .resideInAPackage("io.layerwarm.cli.config..")
                .should()
                .dependOnClassesThat()
                .resideInAnyPackage("ch.qos.logback..", "io.layerwarm.core.engine..", "io.layerwarm.core.cache..");
        rule.check(classes);
    }

    @Test
    void onlyTheConfiguratorTouchesLogback() {
        ArchRule rule = noClasses()
                .that()
                .resideInAPackage("io.layerwarm.cli..")
                .and()
                .doNotHaveSimpleName("LogbackConfigurator")
                .should()
                .dependOnClassesThat()
                .resideInAPackage("ch.qos.logback..");
        rule.check(classes);
    }
}
