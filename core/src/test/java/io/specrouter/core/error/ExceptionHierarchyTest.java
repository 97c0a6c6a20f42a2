package io.specrouter.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.specrouter.core.model.ValidationError;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: the two phases, common fields and concrete types. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void specRouterExceptionIsAbstractAndRoot() {
        assertThat(SpecRouterException.class).isAbstract();
        assertThat(SpecRouterException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void loadAndEvaluationBasesAreAbstract() {
        assertThat(ContractLoadException.class).isAbstract();
        assertThat(ContractLoadException.class.getSuperclass()).isEqualTo(SpecRouterException.class);
        assertThat(RequestEvaluationException.class).isAbstract();
        assertThat(RequestEvaluationException.class.getSuperclass()).isEqualTo(SpecRouterException.class);
    }

    @Test
    void validationFamiliesAreAbstract() {
        assertThat(OpenApiValidationException.class).isAbstract();
        assertThat(OpenApiValidationException.class.getSuperclass()).isEqualTo(ContractLoadException.class);
        assertThat(StandardsViolationException.class).isAbstract();
        assertThat(StandardsViolationException.class.getSuperclass()).isEqualTo(OpenApiValidationException.class);
    }

    // --- Load-time exceptions ---

    @Test
    void standardsViolationCarriesSourceAndLoadPhase() {
        var ex = new WrongContentTypeException("Response content type must be application/json", "/c/A.json");

        assertThat(ex).isInstanceOf(StandardsViolationException.class).isInstanceOf(OpenApiValidationException.class);
        assertThat(ex.source()).isEqualTo("/c/A.json");
        assertThat(ex.phase()).isEqualTo(SpecRouterException.Phase.LOAD);
        assertThat(ex.detail()).isEqualTo("Response content type must be application/json");
    }

    @Test
    void companionFileExceptionIsStandardsViolation() {
        var ex = new CompanionFileException(
                "Missing companion", "/c/A.json", "/c/A.md", CompanionFileException.Reason.MISSING);

        assertThat(ex).isInstanceOf(StandardsViolationException.class);
        assertThat(ex.companion()).isEqualTo("/c/A.md");
        assertThat(ex.reason()).isEqualTo(CompanionFileException.Reason.MISSING);
    }

    @Test
    void modelGenerationExceptionNamesComponent() {
        var cause = new IllegalStateException("boom");
        var ex = new ModelGenerationException("Malformed schema component 'X': boom", cause, "X", "/c/A.json");

        assertThat(ex).isInstanceOf(ContractLoadException.class).isNotInstanceOf(OpenApiValidationException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.component()).isEqualTo("X");
        assertThat(ex.phase()).isEqualTo(SpecRouterException.Phase.LOAD);
    }

    @Test
    void unknownValidatorExceptionNamesValidator() {
        var ex = new UnknownValidatorException("nope");

        assertThat(ex).isInstanceOf(ContractLoadException.class);
        assertThat(ex.getMessage()).isEqualTo("Failed to load validator: nope");
        assertThat(ex.validatorName()).isEqualTo("nope");
    }

    @Test
    void unknownRouteExceptionNamesRoute() {
        var ex = new UnknownRouteException("/A/B", "POST", "router");

        assertThat(ex.getMessage()).isEqualTo("No POST operation declared for path '/A/B'");
        assertThat(ex.path()).isEqualTo("/A/B");
        assertThat(ex.method()).isEqualTo("POST");
    }

    @Test
    void unsupportedMethodIsLoadPhase() {
        var ex = new UnsupportedMethodException("PATCH");

        assertThat(ex.getMessage()).isEqualTo("Unsupported HTTP method: PATCH");
        assertThat(ex.phase()).isEqualTo(SpecRouterException.Phase.LOAD);
    }

    // --- Evaluation-time exceptions ---

    @Test
    void modelValidationExceptionIs422() {
        var ex = new ModelValidationException(
                "Person", List.of(new ValidationError("missing", List.of("name"), "Field required", null)));

        assertThat(ex).isInstanceOf(RequestEvaluationException.class);
        assertThat(ex.status()).isEqualTo(422);
        assertThat(ex.phase()).isEqualTo(SpecRouterException.Phase.EVALUATION);
        assertThat(ex.getMessage())
                .startsWith("1 validation error for Person")
                .contains("name: Field required [type=missing]");
    }

    @Test
    void prefixedKeepsModelAndShiftsLocations() {
        var ex = new ModelValidationException(
                        "Person", List.of(new ValidationError("missing", List.of("name"), "Field required", null)))
                .prefixed("body");

        assertThat(ex.model()).isEqualTo("Person");
        assertThat(ex.errors()).singleElement().satisfies(e -> assertThat(e.locationString()).isEqualTo("body.name"));
    }

    @Test
    void routeAbortExceptionCarriesStatus() {
        var ex = new RouteAbortException(403, "Forbidden");

        assertThat(ex).isInstanceOf(RequestEvaluationException.class);
        assertThat(ex.status()).isEqualTo(403);
        assertThat(ex.detail()).isEqualTo("Forbidden");
    }
}
