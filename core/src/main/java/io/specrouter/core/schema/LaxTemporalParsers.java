package io.specrouter.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.Temporal;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Permissive date and date-time parsing for lax mode.
 *
 * <p>Besides RFC 3339 text this accepts Unix timestamps (JSON numbers or numeric strings; values
 * above 2e10 are read as milliseconds), {@code t} or a space as date/time separator, a lower-case
 * {@code z}, values without offset, and date-only values for date-times. Dates accept timestamps
 * and date-times only when they fall exactly on midnight UTC.
 */
public final class LaxTemporalParsers {

    /** Timestamps above this magnitude are milliseconds. */
    static final BigDecimal MILLIS_THRESHOLD = new BigDecimal("2e10");

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final BigDecimal BILLION = BigDecimal.valueOf(1_000_000_000L);

    private static final Pattern NUMERIC = Pattern.compile("[+-]?\\d+(?:\\.\\d+)?");
    private static final Pattern DATE_ONLY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern DATE_TIME = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2})[Tt ](\\d{2}:\\d{2})(:\\d{2}(?:[.,]\\d{1,9})?)?\\s*([Zz]|[+-]\\d{2}(?::?\\d{2})?)?");

    private LaxTemporalParsers() {
        // utility class
    }

    /**
     * Parses a date.
     *
     * @throws TemporalFormatException if the value cannot be read as a date
     */
    public static LocalDate parseDate(JsonNode value) {
        if (value == null || value.isNull() || value.isBoolean() || value.isContainerNode()) {
            throw new TemporalFormatException("date_type", "Input should be a valid date", value, null);
        }
        if (value.isNumber()) {
            return dateFromInstant(instantFromTimestamp(value.decimalValue(), value), value);
        }
        String text = value.asText();
        if (NUMERIC.matcher(text).matches()) {
            return dateFromInstant(instantFromTimestamp(new BigDecimal(text), value), value);
        }
        if (DATE_ONLY.matcher(text).matches()) {
            try {
                return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
            } catch (DateTimeException e) {
                throw dateParsing(value, reason(e));
            }
        }
        if (text.length() < 10) {
            throw dateParsing(value, "input is too short");
        }
        Temporal dateTime;
        try {
            dateTime = parseDateTimeText(text);
        } catch (DateTimeException e) {
            throw dateParsing(value, reason(e));
        }
        LocalDateTime local = dateTime instanceof OffsetDateTime odt ? odt.toLocalDateTime() : (LocalDateTime) dateTime;
        if (!local.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            throw inexact(value);
        }
        return local.toLocalDate();
    }

    /**
     * Parses a date-time.
     *
     * @return an {@link OffsetDateTime} for values with an offset or from a timestamp, a
     *         {@link LocalDateTime} for naive values
     * @throws TemporalFormatException if the value cannot be read as a date-time
     */
    public static Temporal parseDateTime(JsonNode value) {
        if (value == null || value.isNull() || value.isBoolean() || value.isContainerNode()) {
            throw new TemporalFormatException("datetime_type", "Input should be a valid datetime", value, null);
        }
        if (value.isNumber()) {
            return instantFromTimestamp(value.decimalValue(), value).atOffset(ZoneOffset.UTC);
        }
        String text = value.asText();
        if (NUMERIC.matcher(text).matches()) {
            return instantFromTimestamp(new BigDecimal(text), value).atOffset(ZoneOffset.UTC);
        }
        try {
            if (DATE_ONLY.matcher(text).matches()) {
                return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
            }
            return parseDateTimeText(text);
        } catch (DateTimeException e) {
            throw new TemporalFormatException(
                    "datetime_from_date_parsing",
                    "Input should be a valid datetime or date, " + reason(e),
                    value,
                    Map.of("error", reason(e)));
        }
    }

    /** Reads the relaxed textual form. Throws {@link DateTimeException} when it does not match. */
    private static Temporal parseDateTimeText(String text) {
        Matcher m = DATE_TIME.matcher(text);
        if (!m.matches()) {
            throw new DateTimeException("invalid character in datetime");
        }
        String seconds = m.group(3) != null ? m.group(3).replace(',', '.') : ":00";
        String iso = m.group(1) + "T" + m.group(2) + seconds;
        String offset = m.group(4);
        if (offset == null) {
            return LocalDateTime.parse(iso, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        return OffsetDateTime.parse(iso + normalizeOffset(offset), DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    private static String normalizeOffset(String offset) {
        if (offset.equalsIgnoreCase("z")) {
            return "Z";
        }
        String digits = offset.substring(1).replace(":", "");
        String hours = digits.substring(0, 2);
        String minutes = digits.length() > 2 ? digits.substring(2) : "00";
        return offset.charAt(0) + hours + ":" + minutes;
    }

    private static Instant instantFromTimestamp(BigDecimal timestamp, JsonNode value) {
        BigDecimal seconds = timestamp.abs().compareTo(MILLIS_THRESHOLD) > 0
                ? timestamp.divide(THOUSAND)
                : timestamp;
        BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
        long nanos = seconds.subtract(whole).multiply(BILLION).setScale(0, RoundingMode.HALF_EVEN).longValue();
        try {
            return Instant.ofEpochSecond(whole.longValueExact(), nanos);
        } catch (ArithmeticException | DateTimeException e) {
            throw new TemporalFormatException(
                    "datetime_parsing",
                    "Input should be a valid datetime, timestamp is out of range",
                    value,
                    Map.of("error", "timestamp out of range"));
        }
    }

    private static LocalDate dateFromInstant(Instant instant, JsonNode value) {
        LocalDateTime utc = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        if (!utc.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            throw inexact(value);
        }
        return utc.toLocalDate();
    }

    private static TemporalFormatException inexact(JsonNode value) {
        return new TemporalFormatException(
                "date_from_datetime_inexact",
                "Datetimes provided to dates should have zero time - e.g. be exact dates",
                value,
                null);
    }

    private static TemporalFormatException dateParsing(JsonNode value, String reason) {
        return new TemporalFormatException(
                "date_from_datetime_parsing",
                "Input should be a valid date or datetime, " + reason,
                value,
                Map.of("error", reason));
    }

    /** Short reason for a {@code java.time} failure, without the echoed input text. */
    static String reason(DateTimeException e) {
        Throwable cause = e.getCause() instanceof DateTimeException ? e.getCause() : e;
        String message = cause.getMessage();
        return message != null ? message : "invalid value";
    }
}
