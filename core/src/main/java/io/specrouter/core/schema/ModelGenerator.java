package io.specrouter.core.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.specrouter.core.error.ContractReadException;
import io.specrouter.core.error.InvalidJsonException;
import io.specrouter.core.error.ModelGenerationException;
import io.specrouter.core.model.ContractDocument;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes one validating {@link ModelType} per entry of a contract's
 * {@code components/schemas}, plus the {@code HTTPValidationError} and {@code ValidationError}
 * types that describe the transport's own 422 responses.
 *
 * <p>Generation normalizes the components into a JSON Schema 2020-12 bundle, emits the bundle to
 * a transient file named after the module id, and loads the models back from that file. The file
 * is deleted by the same call unless {@link GeneratorOptions#retainArtifact()} is set. Every
 * module gets a random, process-unique id, so concurrent generations for contracts with clashing
 * schema names never share an id or a file. An id stays reserved while its artifact exists: for the
 * duration of the call, and afterwards only for retained artifacts.
 *
 * <p>Thread-safe.
 */
public final class ModelGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ModelGenerator.class);

    static final String MODULE_PREFIX = "oas_models_";
    static final String HTTP_VALIDATION_ERROR = "HTTPValidationError";
    static final String VALIDATION_ERROR = "ValidationError";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> RESERVED_IDS = ConcurrentHashMap.newKeySet();

    private final Supplier<String> idSource;

    public ModelGenerator() {
        this(() -> MODULE_PREFIX + UUID.randomUUID().toString().replace("-", ""));
    }

    /** Visible for testing id collisions. */
    ModelGenerator(Supplier<String> idSource) {
        this.idSource = Objects.requireNonNull(idSource, "idSource must not be null");
    }

    /** Generates the models of an already loaded contract. */
    public GeneratedModelModule generate(ContractDocument document, String name, GeneratorOptions options) {
        return generate(document.root(), name, document.source().toString(), options);
    }

    /**
     * Generates the models of a contract given as raw text.
     *
     * @param contractText the contract JSON
     * @param name         target name, conventionally the owning path
     * @throws InvalidJsonException     if the text is not JSON
     * @throws ModelGenerationException for unresolved references, malformed schemas or an id
     *                                  collision
     */
    public GeneratedModelModule generate(String contractText, String name, GeneratorOptions options) {
        ContractDocument document = ContractDocument.parse(Path.of(sanitize(name) + ".json"), contractText);
        return generate(document.root(), name, name, options);
    }

    private GeneratedModelModule generate(JsonNode contract, String name, String source, GeneratorOptions options) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(options, "options must not be null");

        String moduleId = idSource.get();
        if (!RESERVED_IDS.add(moduleId)) {
            throw new ModelGenerationException("Duplicate generated module id: " + moduleId, null, source);
        }
        boolean keepReservation = false;
        try {
            GeneratedModelModule module = generateModule(contract, name, source, options, moduleId);
            keepReservation = options.retainArtifact();
            return module;
        } finally {
            if (!keepReservation) {
                RESERVED_IDS.remove(moduleId);
            }
        }
    }

    private GeneratedModelModule generateModule(
            JsonNode contract, String name, String source, GeneratorOptions options, String moduleId) {
        JsonNode components = contract.path("components").path("schemas");
        if (!components.isMissingNode() && !components.isObject()) {
            throw new ModelGenerationException("'components/schemas' must be an object", null, source);
        }
        Set<String> names = new HashSet<>();
        components.fieldNames().forEachRemaining(names::add);
        names.add(HTTP_VALIDATION_ERROR);
        names.add(VALIDATION_ERROR);

        ObjectNode defs = new SchemaNormalizer(source, names).normalize(components);
        addErrorShapes(defs);

        Path artifact = emit(defs, moduleId, name, source, options);
        JsonNode loaded;
        try {
            loaded = MAPPER.readTree(Files.readString(artifact, StandardCharsets.UTF_8)).get("$defs");
        } catch (IOException e) {
            throw new ContractReadException("Failed to load generated module " + artifact, e, source);
        } finally {
            if (!options.retainArtifact()) {
                deleteQuietly(artifact);
            }
        }

        Map<String, TypeDescriptor> descriptors = new TypeCompiler(loaded, source).compileAll();
        ValueCoercer coercer = new ValueCoercer(options.mode(), ref -> {
            TypeDescriptor type = descriptors.get(ref);
            if (type == null) {
                throw new IllegalStateException("Unresolved model reference at validation time: " + ref);
            }
            return type;
        });

        Map<String, ModelType> models = new LinkedHashMap<>();
        for (Map.Entry<String, TypeDescriptor> entry : descriptors.entrySet()) {
            String model = entry.getKey();
            models.put(
                    model,
                    new ModelType(
                            model,
                            entry.getValue(),
                            loaded.get(model),
                            coercer,
                            ConstraintChecker.compile(model, loaded, source)));
        }

        if (options.retainArtifact()) {
            LOG.info("Generated module {}: {}", moduleId, artifact);
        } else {
            LOG.debug("Generated module {} for '{}' with {} model(s)", moduleId, name, models.size());
        }
        return new GeneratedModelModule(
                moduleId, name, source, options.mode(), models, loaded, options.retainArtifact() ? artifact : null);
    }

    /** Adds the error-shape types unless the contract already defines them. */
    private static void addErrorShapes(ObjectNode defs) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        if (!defs.has(VALIDATION_ERROR)) {
            ObjectNode error = defs.putObject(VALIDATION_ERROR);
            error.put("title", VALIDATION_ERROR).put("type", "object");
            ObjectNode properties = error.putObject("properties");
            ObjectNode loc = properties.putObject("loc");
            loc.put("title", "Location").put("type", "array");
            loc.putObject("items")
                    .putArray("anyOf")
                    .add(nodes.objectNode().put("type", "string"))
                    .add(nodes.objectNode().put("type", "integer"));
            properties.putObject("msg").put("title", "Message").put("type", "string");
            properties.putObject("type").put("title", "Error Type").put("type", "string");
            error.putArray("required").add("loc").add("msg").add("type");
        }
        if (!defs.has(HTTP_VALIDATION_ERROR)) {
            ObjectNode envelope = defs.putObject(HTTP_VALIDATION_ERROR);
            envelope.put("title", HTTP_VALIDATION_ERROR).put("type", "object");
            ObjectNode detail = envelope.putObject("properties").putObject("detail");
            detail.put("title", "Detail").put("type", "array");
            detail.putObject("items").put("$ref", SchemaNormalizer.DEFS_PREFIX + VALIDATION_ERROR);
        }
    }

    private static Path emit(JsonNode defs, String moduleId, String name, String source, GeneratorOptions options) {
        ObjectNode bundle = JsonNodeFactory.instance.objectNode();
        bundle.put("$schema", ConstraintChecker.DRAFT_2020_12);
        bundle.put("$id", "urn:spec-router:" + moduleId);
        bundle.put("title", name);
        bundle.set("$defs", defs);
        try {
            Path dir = options.artifactDir() != null ? options.artifactDir() : Path.of(System.getProperty("java.io.tmpdir"));
            Files.createDirectories(dir);
            Path file = dir.resolve(sanitize(name) + "_" + moduleId + ".json");
            String text = options.formatCode()
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(bundle)
                    : MAPPER.writeValueAsString(bundle);
            return Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new ModelGenerationException("Failed to emit generated module " + moduleId, e, null, source);
        } catch (IOException e) {
            throw new ContractReadException("Failed to write generated module " + moduleId, e, source);
        }
    }

    private static void deleteQuietly(Path artifact) {
        try {
            Files.deleteIfExists(artifact);
        } catch (IOException e) {
            LOG.warn("Failed to delete generated module artifact {}: {}", artifact, e.getMessage());
        }
    }

    /** Visible for testing id reservation. */
    static boolean isReserved(String moduleId) {
        return RESERVED_IDS.contains(moduleId);
    }

    /** File-name-safe form of a module name, e.g. {@code /Company/BasicInfo} → {@code Company_BasicInfo}. */
    static String sanitize(String name) {
        String cleaned = name.replaceAll("[^A-Za-z0-9._-]+", "_").replaceAll("^_+|_+$", "");
        return cleaned.isEmpty() ? "models" : cleaned;
    }
}
