package io.specrouter.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static org.assertj.core.api.Assertions.assertThat;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the core stays transport-neutral: no HTTP server on its classpath and no
 * production class depending on a transport or a logging backend.
 */
class CoreDependencyTest {

    /** Transport group IDs that must not appear on the core classpath. */
    private static final List<String> FORBIDDEN_GROUPS = List.of(
            "io.javalin", // Javalin
            "org.eclipse.jetty" // Jetty, Javalin's server
            );

    private static JavaClasses coreClasses;

    @BeforeAll
    static void importClasses() {
        coreClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.specrouter.core");
    }

    @Test
    void coreClasspathContainsNoTransport() {
        String classpath = System.getProperty("java.class.path");
        assertThat(classpath).as("java.class.path should be set").isNotNull();

        for (String forbiddenGroup : FORBIDDEN_GROUPS) {
            String pathFragment = forbiddenGroup.replace('.', '/');
            assertThat(classpath)
                    .as("Core classpath must not contain transport: %s", forbiddenGroup)
                    .doesNotContain(pathFragment);
        }
    }

    @Test
    void coreLogsThroughSlf4jOnly() {
        noClasses()
                .that()
                .resideInAPackage("io.specrouter.core..")
                .should()
                .dependOnClassesThat()
                .resideInAnyPackage("ch.qos.logback..", "io.javalin..")
                .check(coreClasses);
    }

    @Test
    void modelPackageHasNoUpwardDependencies() {
        noClasses()
                .that()
                .resideInAPackage("io.specrouter.core.model..")
                .should()
                .dependOnClassesThat()
                .resideInAnyPackage(
                        "io.specrouter.core.engine..", "io.specrouter.core.route..", "io.specrouter.core.openapi..")
                .check(coreClasses);
    }
}
