package com.dashboard.domain.catalog;

import com.dashboard.domain.exception.QueryValidationException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loosely typed request parameters (query string or JSON body) awaiting binding to a typed query.
 */
public final class QueryParameters {

    private final Map<String, Object> values;

    private QueryParameters(Map<String, Object> values) {
        this.values = values;
    }

    public static QueryParameters of(Map<String, ?> values) {
        return new QueryParameters(values == null ? Collections.emptyMap() : new LinkedHashMap<>(values));
    }

    public static QueryParameters empty() {
        return new QueryParameters(Collections.emptyMap());
    }

    public void rejectUnknown(Set<String> declared) {
        List<String> unknown = values.keySet().stream()
                .filter(name -> !declared.contains(name))
                .sorted()
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new QueryValidationException("Unknown parameters: " + String.join(", ", unknown));
        }
    }

    public int getInt(String name, int defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                return Math.toIntExact(((Number) value).longValue());
            }
            if (value instanceof Number) {
                return new BigDecimal(value.toString()).intValueExact();
            }
            if (value instanceof String) {
                String text = ((String) value).trim();
                return text.isEmpty() ? defaultValue : Integer.parseInt(text);
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new QueryValidationException(name + " must be an integer");
        }
        throw new QueryValidationException(name + " must be an integer");
    }

    /**
     * Returns the parameter as a string, or {@code null} when absent or blank.
     */
    public String getString(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new QueryValidationException(name + " must be a string");
        }
        String text = ((String) value).trim();
        return text.isEmpty() ? null : text;
    }
}
