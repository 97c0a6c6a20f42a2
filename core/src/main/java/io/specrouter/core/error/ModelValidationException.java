package io.specrouter.core.error;

import io.specrouter.core.model.ValidationError;
import java.util.List;

/**
 * Thrown when a payload does not satisfy a generated model. Carries every field-level error found,
 * in the shape the transport returns under {@code detail}.
 */
public final class ModelValidationException extends RequestEvaluationException {

    private static final long serialVersionUID = 1L;

    private final String model;
    private final transient List<ValidationError> errors;

    public ModelValidationException(String model, List<ValidationError> errors) {
        super(summarize(model, errors));
        this.model = model;
        this.errors = List.copyOf(errors);
    }

    /** Name of the model the payload was validated against. */
    public String model() {
        return model;
    }

    public List<ValidationError> errors() {
        return errors;
    }

    /** Returns a copy whose error locations start with the given segments. */
    public ModelValidationException prefixed(Object... prefix) {
        return new ModelValidationException(
                model, errors.stream().map(e -> e.withPrefix(prefix)).toList());
    }

    @Override
    public int status() {
        return 422;
    }

    private static String summarize(String model, List<ValidationError> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append(errors.size()).append(" validation error").append(errors.size() == 1 ? "" : "s");
        sb.append(" for ").append(model);
        for (ValidationError error : errors) {
            sb.append(System.lineSeparator())
                    .append(error.locationString())
                    .append(": ")
                    .append(error.msg())
                    .append(" [type=")
                    .append(error.type())
                    .append(']');
        }
        return sb.toString();
    }
}
