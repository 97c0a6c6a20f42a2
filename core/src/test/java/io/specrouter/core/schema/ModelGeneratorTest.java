package io.specrouter.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.specrouter.core.error.InvalidJsonException;
import io.specrouter.core.error.ModelGenerationException;
import io.specrouter.core.model.ContractDocument;
import io.specrouter.core.testkit.TestContracts;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModelGeneratorTest {

    @TempDir
    Path tempDir;

    private final ModelGenerator generator = new ModelGenerator();

    private static String contractWith(String schemas) {
        return """
                {"openapi": "3.0.2", "info": {"title": "t", "version": "1"}, "paths": {},
                 "components": {"schemas": %s}}
                """.formatted(schemas);
    }

    @Test
    void generatesOneModelPerComponentPlusErrorShapes() {
        GeneratedModelModule module = generator.generate(
                ContractDocument.load(TestContracts.COMPANY), "/Company/BasicInfo", GeneratorOptions.defaults());

        assertThat(module.models()).containsKeys(
                "BasicCompanyInfoRequest",
                "BasicCompanyInfoResponse",
                "NotFoundError",
                "HTTPValidationError",
                "ValidationError");
        assertThat(module.id()).startsWith("oas_models_").hasSize("oas_models_".length() + 32);
        assertThat(module.name()).isEqualTo("/Company/BasicInfo");
        assertThat(module.mode()).isEqualTo(ValidationMode.LAX);
    }

    @Test
    void errorShapesValidateTheTransportEnvelope() {
        GeneratedModelModule module = generator.generate(contractWith("{}"), "shapes", GeneratorOptions.defaults());

        ModelType envelope = module.requireModel("HTTPValidationError");

        assertThat(envelope.accepts(TestContracts.parse(
                        "{\"detail\": [{\"loc\": [\"body\", \"f\", 0], \"msg\": \"Field required\", \"type\": \"missing\"}]}")))
                .isTrue();
        assertThat(envelope.accepts(TestContracts.parse("{\"detail\": [{\"loc\": [\"body\"]}]}"))).isFalse();
    }

    @Test
    void contractDefinedErrorShapeIsKept() {
        GeneratedModelModule module = generator.generate(
                contractWith("{\"ValidationError\": {\"type\": \"object\", \"properties\": {\"code\": {\"type\": \"integer\"}}}}"),
                "custom",
                GeneratorOptions.defaults());

        assertThat(module.schemas().path("ValidationError").path("properties").has("code")).isTrue();
    }

    @Test
    void artifactDeletedByDefault() throws IOException {
        generator.generate(
                ContractDocument.load(TestContracts.WEATHER),
                "/Weather/Current/Metric",
                GeneratorOptions.builder().artifactDir(tempDir).build());

        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void artifactRetainedOnRequest() throws IOException {
        GeneratedModelModule module = generator.generate(
                ContractDocument.load(TestContracts.WEATHER),
                "/Weather/Current/Metric",
                GeneratorOptions.builder().artifactDir(tempDir).retainArtifact(true).build());

        Path artifact = module.artifact().orElseThrow();
        assertThat(artifact.getParent()).isEqualTo(tempDir);
        assertThat(artifact.getFileName().toString()).isEqualTo("Weather_Current_Metric_" + module.id() + ".json");
        String text = Files.readString(artifact);
        assertThat(text).contains("\"$defs\"").contains("CurrentWeatherMetricRequest").contains("\n");
    }

    @Test
    void compactArtifactWhenFormattingDisabled() throws IOException {
        GeneratedModelModule module = generator.generate(
                contractWith("{\"A\": {\"type\": \"object\"}}"),
                "compact",
                GeneratorOptions.builder().artifactDir(tempDir).retainArtifact(true).formatCode(false).build());

        assertThat(Files.readString(module.artifact().orElseThrow())).doesNotContain("\n");
    }

    @Test
    void unresolvedReferenceNamesTheComponent() {
        String contract = contractWith(
                "{\"Order\": {\"type\": \"object\", \"properties\": {\"item\": {\"$ref\": \"#/components/schemas/Item\"}}}}");

        assertThatThrownBy(() -> generator.generate(contract, "orders", GeneratorOptions.defaults()))
                .isInstanceOfSatisfying(ModelGenerationException.class, e -> {
                    assertThat(e.component()).isEqualTo("Order");
                    assertThat(e.getMessage()).contains("#/components/schemas/Item");
                });
    }

    @Test
    void externalReferenceRejected() {
        String contract = contractWith("{\"Order\": {\"$ref\": \"common.json#/Order\"}}");

        assertThatThrownBy(() -> generator.generate(contract, "orders", GeneratorOptions.defaults()))
                .isInstanceOf(ModelGenerationException.class)
                .hasMessageContaining("common.json#/Order");
    }

    @Test
    void unknownTypeRejected() {
        String contract = contractWith("{\"Weird\": {\"type\": \"file\"}}");

        assertThatThrownBy(() -> generator.generate(contract, "weird", GeneratorOptions.defaults()))
                .isInstanceOfSatisfying(ModelGenerationException.class, e -> {
                    assertThat(e.component()).isEqualTo("Weird");
                    assertThat(e.getMessage()).contains("unknown type 'file'");
                });
    }

    @Test
    void nonArrayRequiredRejected() {
        String contract = contractWith("{\"Bad\": {\"type\": \"object\", \"required\": \"name\"}}");

        assertThatThrownBy(() -> generator.generate(contract, "bad", GeneratorOptions.defaults()))
                .isInstanceOf(ModelGenerationException.class)
                .hasMessageContaining("Bad");
    }

    @Test
    void invalidJsonTextRejected() {
        assertThatThrownBy(() -> generator.generate("{not json", "broken", GeneratorOptions.defaults()))
                .isInstanceOf(InvalidJsonException.class);
    }

    @Test
    void unknownModelNameRejected() {
        GeneratedModelModule module = generator.generate(contractWith("{}"), "empty", GeneratorOptions.defaults());

        assertThat(module.model("Nope")).isEmpty();
        assertThatThrownBy(() -> module.requireModel("Nope"))
                .isInstanceOf(ModelGenerationException.class)
                .hasMessageContaining("Nope");
    }

    @Test
    void defaultsFilledForAbsentOptionalFields() {
        GeneratedModelModule module = generator.generate(
                ContractDocument.load(TestContracts.COFFEE), "/Appliance/CoffeeBrewer", GeneratorOptions.defaults());

        ModelInstance request = module.requireModel("CoffeeBrewingRequest")
                .validate(TestContracts.parse("{\"brewer\": \"kitchen-1\"}"));

        assertThat(request.text("strength")).isEqualTo("medium");
        assertThat(request.get("cups").intValue()).isEqualTo(1);
        assertThat(request.has("startAt")).isFalse();
    }

    private static String randomId() {
        return "oas_models_" + UUID.randomUUID().toString().replace("-", "");
    }

    @Test
    void moduleIdOfRetainedArtifactStaysReserved() {
        String id = randomId();
        ModelGenerator fixed = new ModelGenerator(() -> id);
        GeneratorOptions retained = GeneratorOptions.builder().artifactDir(tempDir).retainArtifact(true).build();
        fixed.generate(contractWith("{}"), "first", retained);

        assertThat(ModelGenerator.isReserved(id)).isTrue();
        assertThatThrownBy(() -> fixed.generate(contractWith("{}"), "second", retained))
                .isInstanceOf(ModelGenerationException.class)
                .hasMessageContaining(id);
    }

    @Test
    void moduleIdReleasedOnceArtifactDeleted() {
        String id = randomId();
        ModelGenerator fixed = new ModelGenerator(() -> id);
        GeneratorOptions transientArtifact = GeneratorOptions.builder().artifactDir(tempDir).build();

        GeneratedModelModule first = fixed.generate(contractWith("{}"), "first", transientArtifact);

        assertThat(ModelGenerator.isReserved(id)).isFalse();
        GeneratedModelModule second = fixed.generate(contractWith("{}"), "second", transientArtifact);
        assertThat(second.id()).isEqualTo(first.id());
        assertThat(ModelGenerator.isReserved(id)).isFalse();
    }

    @Test
    void moduleIdReleasedWhenGenerationFails() {
        String id = randomId();
        ModelGenerator fixed = new ModelGenerator(() -> id);

        assertThatThrownBy(() -> fixed.generate(
                        contractWith("{\"A\": {\"$ref\": \"#/components/schemas/Nope\"}}"),
                        "broken",
                        GeneratorOptions.builder().artifactDir(tempDir).retainArtifact(true).build()))
                .isInstanceOf(ModelGenerationException.class);

        assertThat(ModelGenerator.isReserved(id)).isFalse();
    }

    @Test
    void concurrentGenerationsNeverShareAnId() throws Exception {
        String contract = contractWith("{\"Same\": {\"type\": \"object\"}}");
        Set<String> ids = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> ids.add(generator
                        .generate(contract, "Same", GeneratorOptions.builder().artifactDir(tempDir).build())
                        .id())));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(ids).hasSize(16);
    }

    @Test
    void sanitizeTurnsPathsIntoFileNames() {
        assertThat(ModelGenerator.sanitize("/Company/BasicInfo")).isEqualTo("Company_BasicInfo");
        assertThat(ModelGenerator.sanitize("/")).isEqualTo("models");
        assertThat(ModelGenerator.sanitize("Test Validation")).isEqualTo("Test_Validation");
    }
}
