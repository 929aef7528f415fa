package com.dashboard.domain.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule-based customer segments over recency/frequency/monetary quintile scores (1-5).
 * 
 * Rules are evaluated in declaration order and the first match wins, so a
 * customer qualifying for several segments lands in the most valuable one.
 */
public enum RfmSegment {

    CHAMPIONS("Champions") {
        @Override
        boolean matches(int r, int f, int m) {
            return r >= 4 && f >= 4 && m >= 4;
        }
    },
    LOYAL_CUSTOMERS("Loyal Customers") {
        @Override
        boolean matches(int r, int f, int m) {
            return r >= 3 && f >= 3 && m >= 3;
        }
    },
    NEW_CUSTOMERS("New Customers") {
        @Override
        boolean matches(int r, int f, int m) {
            return r >= 4 && f <= 2;
        }
    },
    AT_RISK("At Risk") {
        @Override
        boolean matches(int r, int f, int m) {
            return r <= 2 && f >= 3;
        }
    },
    CANNOT_LOSE_THEM("Cannot Lose Them") {
        @Override
        boolean matches(int r, int f, int m) {
            return r <= 2 && f <= 2 && m >= 3;
        }
    },
    OTHERS("Others") {
        @Override
        boolean matches(int r, int f, int m) {
            return true;
        }
    };

    private final String label;

    RfmSegment(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    abstract boolean matches(int r, int f, int m);

    public static RfmSegment classify(int r, int f, int m) {
        checkScore("r_score", r);
        checkScore("f_score", f);
        checkScore("m_score", m);
        for (RfmSegment segment : values()) {
            if (segment.matches(r, f, m)) {
                return segment;
            }
        }
        return OTHERS;
    }

    /**
     * Adds {@code rfm_total} and {@code segment} columns to rows carrying quintile scores.
     */
    public static List<Map<String, Object>> annotate(List<Map<String, Object>> rows) {
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            int r = ((Number) row.get("r_score")).intValue();
            int f = ((Number) row.get("f_score")).intValue();
            int m = ((Number) row.get("m_score")).intValue();

            Map<String, Object> out = new LinkedHashMap<>(row);
            out.put("rfm_total", (long) (r + f + m));
            out.put("segment", classify(r, f, m).getLabel());
            result.add(out);
        }
        return result;
    }

    private static void checkScore(String name, int score) {
        if (score < 1 || score > 5) {
            throw new IllegalArgumentException(name + " must be a quintile between 1 and 5, was " + score);
        }
    }
}
