package io.specrouter.core.schema;

/**
 * How generated models coerce incoming values.
 *
 * <ul>
 *   <li>{@link #LAX}: numeric strings become numbers, 0/1 and yes/no become booleans, dates and
 *       date-times accept Unix timestamps and relaxed separators, unknown fields are dropped.
 *   <li>{@link #STRICT}: values must already have the declared JSON type, dates and date-times
 *       must be exact RFC 3339 strings, unknown fields are rejected.
 * </ul>
 */
public enum ValidationMode {
    LAX,
    STRICT
}
