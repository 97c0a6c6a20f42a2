package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * RFC 3339 parsers for strict mode.
 *
 * <p>Each value goes through two stages. The pre-check rejects anything that is not a JSON string
 * and any string not matching the exact grammar: {@code YYYY-MM-DD} for dates and
 * {@code YYYY-MM-DDThh:mm:ss[.fraction](Z|±hh:mm)} for date-times, with upper-case {@code T} and
 * {@code Z} and no space. Only then does {@code java.time} check the calendar values.
 */
public final class StrictTemporalParsers {

    static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    static final Pattern DATE_TIME =
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(Z|[+-]\\d{2}:\\d{2})");

    private StrictTemporalParsers() {
        // utility class
    }

    /**
     * Parses a strict RFC 3339 {@code full-date}.
     *
     * @throws TemporalFormatException if the value is not a string, not of the form
     *                                 {@code YYYY-MM-DD}, or not a calendar date
     */
    public static LocalDate parseDate(JsonNode value) {
        if (value == null || !value.isTextual()) {
            throw new TemporalFormatException(
                    "date_type",
                    "Input should be a valid date in RFC 3339 'full-date' format, input is not a string",
                    value,
                    Map.of("error", "input not string"));
        }
        String text = value.asText();
        if (!DATE.matcher(text).matches()) {
            throw new TemporalFormatException(
                    "date_from_datetime_parsing",
                    "Input should be a valid date, in RFC 3339 'full-date' format",
                    value,
                    Map.of("error", "input is not of form YYYY-MM-DD"));
        }
        try {
            return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeException e) {
            throw new TemporalFormatException(
                    "date_from_datetime_parsing",
                    "Input should be a valid date or datetime, " + LaxTemporalParsers.reason(e),
                    value,
                    Map.of("error", LaxTemporalParsers.reason(e)));
        }
    }

    /**
     * Parses a strict RFC 3339 {@code date-time} with a mandatory offset.
     *
     * @throws TemporalFormatException if the value is not a string, does not follow RFC 3339, or
     *                                 holds out-of-range calendar or clock values
     */
    public static OffsetDateTime parseDateTime(JsonNode value) {
        if (value == null || !value.isTextual()) {
            throw new TemporalFormatException(
                    "datetime_type",
                    "Input should be a valid datetime in RFC 3339 format, input is not a string",
                    value,
                    Map.of("error", "input not string"));
        }
        String text = value.asText();
        if (!DATE_TIME.matcher(text).matches()) {
            throw new TemporalFormatException(
                    "datetime_from_date_parsing",
                    "Input should be a valid datetime, in RFC 3339 format",
                    value,
                    Map.of("error", "input does not follow RFC 3339"));
        }
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeException e) {
            throw new TemporalFormatException(
                    "datetime_from_date_parsing",
                    "Input should be a valid datetime, " + LaxTemporalParsers.reason(e),
                    value,
                    Map.of("error", LaxTemporalParsers.reason(e)));
        }
    }
}
