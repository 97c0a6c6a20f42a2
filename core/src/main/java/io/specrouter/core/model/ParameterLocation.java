package io.specrouter.core.model;

import java.util.Locale;

/** Value of a parameter's {@code in} field. */
public enum ParameterLocation {
    QUERY,
    HEADER,
    PATH,
    COOKIE;

    /**
     * Parses an {@code in} value.
     *
     * @return the location, or {@code null} if the value is not one of the four known locations
     */
    public static ParameterLocation fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ParameterLocation location : values()) {
            if (location.value().equals(value)) {
                return location;
            }
        }
        return null;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
