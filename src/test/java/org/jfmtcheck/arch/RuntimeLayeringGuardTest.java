package org.jfmtcheck.arch;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "org.jfmtcheck", importOptions = ImportOption.DoNotIncludeTests.class)
class RuntimeLayeringGuardTest {
    @ArchTest
    static final ArchRule runtime_does_not_depend_on_testkit_or_cli = noClasses()
            .that()
            .resideInAnyPackage(
                    "org.jfmtcheck.arglist..",
                    "org.jfmtcheck.check..",
                    "org.jfmtcheck.format..",
                    "org.jfmtcheck.obs..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.jfmtcheck.testkit..", "org.jfmtcheck.cli..");

    @ArchTest
    static final ArchRule arglist_is_self_contained = noClasses()
            .that()
            .resideInAPackage("org.jfmtcheck.arglist..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "org.jfmtcheck.check..",
                    "org.jfmtcheck.format..",
                    "org.jfmtcheck.obs..",
                    "org.jfmtcheck.testkit..",
                    "org.jfmtcheck.cli..");

    @ArchTest
    static final ArchRule obs_does_not_depend_on_checker = noClasses()
            .that()
            .resideInAPackage("org.jfmtcheck.obs..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.jfmtcheck.check..", "org.jfmtcheck.format..");
}
