package com.dashboard.infrastructure.persistence;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts JDBC column values into the small set of types that survive a JSON round trip unchanged.
 * 
 * integral numbers (including scale-0 decimals) → Long, fractional numbers → BigDecimal,
 * dates and timestamps → ISO-8601 strings, anything else → String.
 */
final class RowNormalizer {

    private RowNormalizer() {
    }

    static List<Map<String, Object>> normalize(List<Map<String, Object>> rows) {
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (Map.Entry<String, Object> column : row.entrySet()) {
                normalized.put(column.getKey(), normalizeValue(column.getValue()));
            }
            result.add(normalized);
        }
        return result;
    }

    static Object normalizeValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Long) {
            return value;
        }
        if (value instanceof BigDecimal) {
            return normalizeDecimal((BigDecimal) value);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger) {
            return normalizeDecimal(new BigDecimal((BigInteger) value));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant().toString();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().toString();
        }
        if (value instanceof Time) {
            return ((Time) value).toLocalTime().toString();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return value.toString();
    }

    // A scale-0 decimal is written as a JSON integer, which reads back as Long
    private static Object normalizeDecimal(BigDecimal decimal) {
        if (decimal.scale() > 0) {
            return decimal;
        }
        BigInteger integral = decimal.toBigIntegerExact();
        return integral.bitLength() < Long.SIZE ? (Object) integral.longValue() : new BigDecimal(integral).setScale(1);
    }
}
