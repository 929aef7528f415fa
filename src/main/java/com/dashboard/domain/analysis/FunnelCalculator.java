package com.dashboard.domain.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives drop-off and step-over-step conversion for the purchase funnel.
 * 
 * Input rows carry {@code step_number}, {@code total_entries}, {@code progressed}
 * and {@code avg_time_minutes}. Steps with no observed events are absent from
 * the input and stay absent from the output.
 * 
 * Conversion of step n is progressed(n) / total_entries(n-1). When the previous
 * step has no entries (or was not observed at all) conversion is undefined and
 * reported as {@code null}, never as zero.
 */
public final class FunnelCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private FunnelCalculator() {
    }

    public static List<Map<String, Object>> calculate(List<Map<String, Object>> rows) {
        List<Map<String, Object>> steps = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (row.get("step_number") != null) {
                steps.add(row);
            }
        }
        steps.sort(Comparator.comparingLong(row -> asLong(row.get("step_number"))));

        Map<Long, Long> entriesByStep = new HashMap<>();
        for (Map<String, Object> row : steps) {
            entriesByStep.put(asLong(row.get("step_number")), asLong(row.get("total_entries")));
        }

        List<Map<String, Object>> result = new ArrayList<>(steps.size());
        for (Map<String, Object> row : steps) {
            long stepNumber = asLong(row.get("step_number"));
            long totalEntries = asLong(row.get("total_entries"));
            long progressed = asLong(row.get("progressed"));
            Long previousEntries = entriesByStep.get(stepNumber - 1);

            Map<String, Object> out = new LinkedHashMap<>();
            out.put("step_number", stepNumber);
            out.put("step_name", FunnelStep.labelOf(stepNumber));
            out.put("total_entries", totalEntries);
            out.put("progressed", progressed);
            out.put("avg_time_minutes", row.get("avg_time_minutes"));
            out.put("drop_off_pct", percentage(totalEntries - progressed, totalEntries));
            out.put("step_conversion_pct", previousEntries == null ? null : percentage(progressed, previousEntries));
            result.add(out);
        }
        return result;
    }

    /**
     * 100 * numerator / denominator rounded half-up to two decimals; {@code null} for a zero denominator.
     */
    static BigDecimal percentage(long numerator, long denominator) {
        if (denominator == 0) {
            return null;
        }
        return HUNDRED.multiply(BigDecimal.valueOf(numerator))
                .divide(BigDecimal.valueOf(denominator), 2, RoundingMode.HALF_UP);
    }

    private static long asLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }

    enum FunnelStep {
        PAGE_VIEW(1, "Page View"),
        ADD_TO_CART(2, "Add to Cart"),
        CHECKOUT_START(3, "Checkout Start"),
        PURCHASE_COMPLETE(4, "Purchase Complete");

        private final long number;
        private final String label;

        FunnelStep(long number, String label) {
            this.number = number;
            this.label = label;
        }

        static String labelOf(long number) {
            for (FunnelStep step : values()) {
                if (step.number == number) {
                    return step.label;
                }
            }
            return null;
        }
    }
}
