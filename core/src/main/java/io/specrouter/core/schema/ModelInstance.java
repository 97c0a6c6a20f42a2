package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * A payload that passed validation against a generated model, in canonical form: declared fields
 * only (plus permitted extras), values coerced to their declared types, dates and date-times as
 * ISO text.
 *
 * @param model name of the model the payload was validated against
 * @param json  the canonical payload
 */
public record ModelInstance(String model, JsonNode json) {

    public ModelInstance {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(json, "json must not be null");
    }

    /** The field value, or {@code null} if absent. */
    public JsonNode get(String field) {
        return json.get(field);
    }

    public boolean has(String field) {
        return json.has(field) && !json.get(field).isNull();
    }

    /** The field as text, or {@code null} if absent or null. */
    public String text(String field) {
        JsonNode value = json.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    /** The field as a date, or {@code null} if absent or null. */
    public LocalDate date(String field) {
        String value = text(field);
        return value != null ? LocalDate.parse(value) : null;
    }

    /**
     * The field as an offset date-time, or {@code null} if absent or null. Naive values accepted in
     * lax mode have no offset and cannot be read this way.
     */
    public OffsetDateTime dateTime(String field) {
        String value = text(field);
        return value != null ? OffsetDateTime.parse(value) : null;
    }
}
