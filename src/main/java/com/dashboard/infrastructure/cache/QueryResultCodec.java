package com.dashboard.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * JSON form of cached result rows.
 * 
 * Decimals are read back as BigDecimal and integers as Long, so numeric values
 * survive the round trip without passing through binary floating point.
 */
@Component
public class QueryResultCodec {

    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public QueryResultCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.USE_LONG_FOR_INTS);
    }

    public String encode(List<Map<String, Object>> rows) throws JsonProcessingException {
        return objectMapper.writeValueAsString(rows);
    }

    public List<Map<String, Object>> decode(String payload) throws JsonProcessingException {
        List<Map<String, Object>> rows = objectMapper.readValue(payload, ROWS);
        if (rows == null) {
            throw new IllegalArgumentException("Cached payload is not a row list");
        }
        return rows;
    }
}
