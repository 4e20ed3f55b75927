package io.segmentnav.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Package layering of the core module: the model and error packages stay free of engine, parser
 * and listener code, and shared schema state is immutable.
 */
@AnalyzeClasses(
        packages = "io.segmentnav.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class ArchitectureTest {

    @ArchTest
    static final ArchRule modelIsSelfContained = noClasses()
            .that()
            .resideInAPackage("io.segmentnav.core.model..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.segmentnav.core.engine..", "io.segmentnav.core.spec..", "io.segmentnav.core.spi..")
            .because("schema model types must not know how they are navigated or loaded");

    @ArchTest
    static final ArchRule errorsAreLeaves = noClasses()
            .that()
            .resideInAPackage("io.segmentnav.core.error..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.segmentnav.core.model..",
                    "io.segmentnav.core.engine..",
                    "io.segmentnav.core.spec..",
                    "io.segmentnav.core.spi..");

    @ArchTest
    static final ArchRule engineDoesNotParse = noClasses()
            .that()
            .resideInAPackage("io.segmentnav.core.engine..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.segmentnav.core.spec..", "com.fasterxml.jackson..", "com.networknt..");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is forbidden by project governance");

    @ArchTest
    static final ArchRule sharedSchemaStateIsImmutable = classes()
            .that()
            .haveSimpleName("SchemaNode")
            .or()
            .haveSimpleName("SchemaTree")
            .or()
            .haveSimpleName("SchemaRegistry")
            .should()
            .haveOnlyFinalFields()
            .because("one schema tree is shared by concurrent parses");
}
