package io.dockerfilexform.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Architecture guardrails for the core module: layering between parser, interpretation and
 * engine packages, no reflection, and immutable stateless helpers.
 */
@AnalyzeClasses(
        packages = "io.dockerfilexform.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule parserIsLowestLayer = noClasses()
            .that()
            .resideInAPackage("io.dockerfilexform.core.parser..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.dockerfilexform.core.engine..",
                    "io.dockerfilexform.core.instructions..",
                    "io.dockerfilexform.core.reference..",
                    "io.dockerfilexform.core.shell..",
                    "io.dockerfilexform.core.config..")
            .because("the grammar parser must not know about interpretation or rewriting");

    @ArchTest
    static final ArchRule leafPackagesDoNotUseEngine = noClasses()
            .that()
            .resideInAnyPackage(
                    "io.dockerfilexform.core.instructions..",
                    "io.dockerfilexform.core.reference..",
                    "io.dockerfilexform.core.shell..",
                    "io.dockerfilexform.core.error..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("io.dockerfilexform.core.engine..")
            .because("the engine composes the other packages, never the reverse");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is forbidden by project governance");

    @ArchTest
    static final ArchRule resolverHasOnlyFinalFields = classes()
            .that()
            .haveSimpleName("ImageReferenceResolver")
            .or()
            .haveSimpleName("DockerfilePrinter")
            .or()
            .haveSimpleName("ShellLexer")
            .should()
            .haveOnlyFinalFields()
            .because("per-pass state must live in pass-local objects, not shared fields");
}
