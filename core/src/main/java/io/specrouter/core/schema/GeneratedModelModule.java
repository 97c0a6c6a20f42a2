package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.specrouter.core.error.ModelGenerationException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The model types generated from one contract, keyed by component schema name. Owned by one
 * contract load; immutable and safe to share once built.
 */
public final class GeneratedModelModule {

    private final String id;
    private final String name;
    private final String source;
    private final ValidationMode mode;
    private final Map<String, ModelType> models;
    private final JsonNode defs;
    private final Path artifact;

    GeneratedModelModule(
            String id,
            String name,
            String source,
            ValidationMode mode,
            Map<String, ModelType> models,
            JsonNode defs,
            Path artifact) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.source = source;
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        this.defs = defs;
        this.artifact = artifact;
    }

    /** Process-unique module identifier, {@code oas_models_<uuid>}. */
    public String id() {
        return id;
    }

    /** The name the module was generated for, conventionally the owning path. */
    public String name() {
        return name;
    }

    public ValidationMode mode() {
        return mode;
    }

    /** All models in declaration order, the error-shape models last. */
    public Map<String, ModelType> models() {
        return models;
    }

    public Optional<ModelType> model(String modelName) {
        return Optional.ofNullable(models.get(modelName));
    }

    /**
     * Looks up a model by name.
     *
     * @throws ModelGenerationException if the module has no such model
     */
    public ModelType requireModel(String modelName) {
        ModelType model = models.get(modelName);
        if (model == null) {
            throw new ModelGenerationException(
                    "No model named '" + modelName + "' in module " + id + " (available: " + models.keySet() + ")",
                    modelName,
                    source);
        }
        return model;
    }

    /** The normalized schema bundle ({@code $defs}) the models were built from. */
    public JsonNode schemas() {
        return defs.deepCopy();
    }

    /** The emitted artifact, present only when it was retained. */
    public Optional<Path> artifact() {
        return Optional.ofNullable(artifact);
    }

    @Override
    public String toString() {
        return "GeneratedModelModule[" + id + ", " + name + ", " + models.keySet() + "]";
    }
}
