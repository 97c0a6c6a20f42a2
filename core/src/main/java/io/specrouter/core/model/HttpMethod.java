package io.specrouter.core.model;

import io.specrouter.core.error.UnsupportedMethodException;
import java.util.Locale;

/** The HTTP methods that take part in routing. */
public enum HttpMethod {
    GET,
    POST;

    /**
     * Resolves a method name case-insensitively.
     *
     * @throws UnsupportedMethodException for anything but GET and POST
     */
    public static HttpMethod of(String name) {
        if (name == null) {
            throw new UnsupportedMethodException("null");
        }
        return switch (name.toUpperCase(Locale.ROOT)) {
            case "GET" -> GET;
            case "POST" -> POST;
            default -> throw new UnsupportedMethodException(name);
        };
    }

    /** The lower-case key used for this method in contract path items. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
