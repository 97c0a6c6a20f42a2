package io.specrouter.core.model;

import java.util.Objects;

/**
 * A declared operation parameter.
 *
 * @param name        parameter name as declared
 * @param location    where the parameter is carried
 * @param required    whether the caller must supply it (defaults to {@code false})
 * @param description free text, may be {@code null}
 */
public record Parameter(String name, ParameterLocation location, boolean required, String description) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }
}
