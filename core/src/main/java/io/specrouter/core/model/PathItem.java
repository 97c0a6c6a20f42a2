package io.specrouter.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The routable operations of one contract path.
 *
 * @param path        the path string as declared
 * @param description path-level description, may be {@code null}
 * @param operations  operations keyed by method; a method the path does not declare is absent
 */
public record PathItem(String path, String description, Map<HttpMethod, Operation> operations) {

    public PathItem {
        Objects.requireNonNull(path, "path must not be null");
        EnumMap<HttpMethod, Operation> copy = new EnumMap<>(HttpMethod.class);
        if (operations != null) {
            copy.putAll(operations);
        }
        operations = Collections.unmodifiableMap(copy);
    }

    public Optional<Operation> operation(HttpMethod method) {
        return Optional.ofNullable(operations.get(method));
    }
}
