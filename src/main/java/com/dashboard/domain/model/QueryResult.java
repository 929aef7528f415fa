package com.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Result of one analytical operation.
 * 
 * Rows keep the column order of the query. Values are plain JSON-friendly
 * types (Long, BigDecimal, String, Boolean, null) so a result rebuilt from the
 * cache equals the one computed fresh.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {

    private String operation;
    private List<Map<String, Object>> rows;
    private boolean cached;
    private long queryTimeMs;

    public int getRowCount() {
        return rows == null ? 0 : rows.size();
    }
}
