package io.specrouter.core.route;

import io.specrouter.core.schema.ModelType;

/**
 * A declared non-200 response of a route.
 *
 * @param description response description, may be {@code null}
 * @param model       body model, or {@code null} if the response declares none
 */
public record AdditionalResponse(String description, ModelType model) {}
