package io.specrouter.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Case-insensitive, immutable request header collection handed to route dependencies and
 * handlers. Header names are normalized to lowercase.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    private final TreeMap<String, List<String>> store;

    private HttpHeaders(TreeMap<String, List<String>> store) {
        this.store = store;
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        List<String> values = store.get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /** All values for a header name (case-insensitive); empty if absent. */
    public List<String> all(String name) {
        List<String> values = store.get(name);
        return values != null ? Collections.unmodifiableList(values) : List.of();
    }

    public boolean contains(String name) {
        return store.containsKey(name);
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** First-value-per-name view with lowercase keys. */
    public Map<String, String> toSingleValueMap() {
        Map<String, String> result = new TreeMap<>();
        store.forEach((key, values) -> {
            if (!values.isEmpty()) {
                result.put(key, values.get(0));
            }
        });
        return Collections.unmodifiableMap(result);
    }

    // ── Factory methods ──

    /** Creates headers from a single-value map. Keys are normalized to lowercase. */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        singleValue.forEach((key, value) -> map.put(key.toLowerCase(), List.of(value)));
        return new HttpHeaders(map);
    }

    /** Creates headers from a multi-value map. Keys are normalized to lowercase. */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        multiValue.forEach((key, values) -> map.put(key.toLowerCase(), List.copyOf(values)));
        return new HttpHeaders(map);
    }

    public static HttpHeaders empty() {
        return EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + store.keySet();
    }
}
