package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory description of a generated type, compiled from one normalized schema. Immutable.
 * References to other components stay symbolic ({@link Kind#REF}) and are resolved through the
 * owning module, so recursive schemas need no special handling.
 */
public final class TypeDescriptor {

    /** Shape of the described value. */
    public enum Kind {
        OBJECT,
        ARRAY,
        STRING,
        NUMBER,
        INTEGER,
        BOOLEAN,
        DATE,
        DATE_TIME,
        ENUM,
        NULL,
        UNION,
        REF,
        ANY
    }

    private final Kind kind;
    private final boolean nullable;
    private final Map<String, TypeDescriptor> properties;
    private final Set<String> required;
    private final Boolean additionalAllowed;
    private final TypeDescriptor additionalType;
    private final TypeDescriptor items;
    private final List<JsonNode> enumValues;
    private final List<TypeDescriptor> variants;
    private final String refName;
    private final JsonNode defaultValue;

    private TypeDescriptor(Builder b) {
        this.kind = b.kind;
        this.nullable = b.nullable;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
        this.required = Collections.unmodifiableSet(new LinkedHashSet<>(b.required));
        this.additionalAllowed = b.additionalAllowed;
        this.additionalType = b.additionalType;
        this.items = b.items;
        this.enumValues = List.copyOf(b.enumValues);
        this.variants = List.copyOf(b.variants);
        this.refName = b.refName;
        this.defaultValue = b.defaultValue;
    }

    public Kind kind() {
        return kind;
    }

    /** {@code true} if JSON {@code null} is an accepted value. */
    public boolean nullable() {
        return nullable;
    }

    /** Declared object properties in declaration order. */
    public Map<String, TypeDescriptor> properties() {
        return properties;
    }

    public Set<String> required() {
        return required;
    }

    /**
     * Explicit {@code additionalProperties} boolean, or {@code null} when the schema leaves it to
     * the validation mode.
     */
    public Boolean additionalAllowed() {
        return additionalAllowed;
    }

    /** Schema for additional properties, or {@code null}. */
    public TypeDescriptor additionalType() {
        return additionalType;
    }

    public TypeDescriptor items() {
        return items;
    }

    public List<JsonNode> enumValues() {
        return enumValues;
    }

    public List<TypeDescriptor> variants() {
        return variants;
    }

    /** Component name for {@link Kind#REF}. */
    public String refName() {
        return refName;
    }

    /** Schema {@code default}, or {@code null}. */
    public JsonNode defaultValue() {
        return defaultValue;
    }

    /** Copy of this descriptor with the nullable flag set. */
    TypeDescriptor asNullable() {
        if (nullable) {
            return this;
        }
        return toBuilder().nullable(true).build();
    }

    /** Copy of this descriptor carrying the given default. */
    TypeDescriptor withDefault(JsonNode value) {
        return toBuilder().defaultValue(value).build();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case REF -> "REF(" + refName + ")" + (nullable ? "?" : "");
            case ARRAY -> "ARRAY<" + items + ">" + (nullable ? "?" : "");
            case OBJECT -> "OBJECT" + properties.keySet() + (nullable ? "?" : "");
            default -> kind + (nullable ? "?" : "");
        };
    }

    static Builder builder(Kind kind) {
        return new Builder(kind);
    }

    Builder toBuilder() {
        Builder b = new Builder(kind);
        b.nullable = nullable;
        b.properties.putAll(properties);
        b.required.addAll(required);
        b.additionalAllowed = additionalAllowed;
        b.additionalType = additionalType;
        b.items = items;
        b.enumValues.addAll(enumValues);
        b.variants.addAll(variants);
        b.refName = refName;
        b.defaultValue = defaultValue;
        return b;
    }

    static final class Builder {

        private Kind kind;
        private boolean nullable;
        private final Map<String, TypeDescriptor> properties = new LinkedHashMap<>();
        private final Set<String> required = new LinkedHashSet<>();
        private Boolean additionalAllowed;
        private TypeDescriptor additionalType;
        private TypeDescriptor items;
        private final List<JsonNode> enumValues = new ArrayList<>();
        private final List<TypeDescriptor> variants = new ArrayList<>();
        private String refName;
        private JsonNode defaultValue;

        private Builder(Kind kind) {
            this.kind = kind;
        }

        Builder kind(Kind kind) {
            this.kind = kind;
            return this;
        }

        Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        Builder property(String name, TypeDescriptor type) {
            properties.put(name, type);
            return this;
        }

        Builder required(String name) {
            required.add(name);
            return this;
        }

        Builder additionalAllowed(Boolean allowed) {
            this.additionalAllowed = allowed;
            return this;
        }

        Builder additionalType(TypeDescriptor type) {
            this.additionalType = type;
            return this;
        }

        Builder items(TypeDescriptor items) {
            this.items = items;
            return this;
        }

        Builder enumValue(JsonNode value) {
            enumValues.add(value);
            return this;
        }

        Builder variant(TypeDescriptor variant) {
            variants.add(variant);
            return this;
        }

        Builder refName(String refName) {
            this.refName = refName;
            return this;
        }

        Builder defaultValue(JsonNode defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        TypeDescriptor build() {
            return new TypeDescriptor(this);
        }
    }
}
