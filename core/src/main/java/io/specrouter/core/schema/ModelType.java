package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.specrouter.core.error.ModelValidationException;
import io.specrouter.core.model.ValidationError;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A generated, validating type for one component schema. Thread-safe.
 *
 * <p>{@link #validate(JsonNode)} first coerces the payload according to the module's
 * {@link ValidationMode}, collecting every type error; if that succeeds, the declared value
 * constraints are checked on the coerced payload.
 */
public final class ModelType {

    /** Name of the request model used when an operation declares no request body. */
    public static final String EMPTY_BODY = "EmptyBody";

    private static final ModelType EMPTY = new ModelType(EMPTY_BODY, null, null, null, null);

    private final String name;
    private final TypeDescriptor descriptor;
    private final JsonNode schema;
    private final ValueCoercer coercer;
    private final ConstraintChecker constraints;

    ModelType(
            String name,
            TypeDescriptor descriptor,
            JsonNode schema,
            ValueCoercer coercer,
            ConstraintChecker constraints) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.descriptor = descriptor;
        this.schema = schema;
        this.coercer = coercer;
        this.constraints = constraints;
    }

    /** The model for operations without a request body: accepts no body, {@code null}, or any object. */
    public static ModelType emptyBody() {
        return EMPTY;
    }

    public String name() {
        return name;
    }

    public boolean isEmptyBody() {
        return this == EMPTY;
    }

    /** The compiled type, or {@code null} for the empty body. */
    public TypeDescriptor descriptor() {
        return descriptor;
    }

    /** Normalized JSON Schema of this model, with references into the module's {@code $defs}. */
    public JsonNode schema() {
        return schema != null ? schema.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    /**
     * Validates a decoded payload.
     *
     * @param payload the decoded JSON body; {@code null} or a missing node means no body was sent
     * @return the canonical payload
     * @throws ModelValidationException carrying every error found, locations relative to the payload
     */
    public ModelInstance validate(JsonNode payload) {
        boolean absent = payload == null || payload.isMissingNode();
        if (isEmptyBody()) {
            if (absent || payload.isNull()) {
                return new ModelInstance(name, JsonNodeFactory.instance.objectNode());
            }
            if (payload.isObject()) {
                return new ModelInstance(name, payload.deepCopy());
            }
            throw new ModelValidationException(
                    name,
                    List.of(new ValidationError(
                            "model_attributes_type",
                            List.of(),
                            "Input should be a valid dictionary or object to extract fields from",
                            payload)));
        }
        if (absent) {
            throw new ModelValidationException(
                    name, List.of(new ValidationError("missing", List.of(), "Field required", null)));
        }

        List<ValidationError> errors = new ArrayList<>();
        JsonNode canonical = coercer.coerce(descriptor, payload, List.of(), errors);
        if (errors.isEmpty() && canonical != null) {
            errors.addAll(constraints.check(canonical));
        }
        if (!errors.isEmpty()) {
            throw new ModelValidationException(name, errors);
        }
        return new ModelInstance(name, canonical);
    }

    /** {@code true} if the payload validates. */
    public boolean accepts(JsonNode payload) {
        try {
            validate(payload);
            return true;
        } catch (ModelValidationException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return "ModelType[" + name + "]";
    }
}
