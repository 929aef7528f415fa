package com.dashboard.domain.analysis;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FunnelCalculatorTest {

    @Test
    void testFullFunnel_ConversionAgainstPreviousStep() {
        // Given
        List<Map<String, Object>> rows = List.of(
                step(1, 1000, 400),
                step(2, 400, 200),
                step(3, 200, 150),
                step(4, 150, 0));

        // When
        List<Map<String, Object>> result = FunnelCalculator.calculate(rows);

        // Then
        assertEquals(4, result.size());
        assertEquals("Page View", result.get(0).get("step_name"));
        assertEquals("Purchase Complete", result.get(3).get("step_name"));
        assertNull(result.get(0).get("step_conversion_pct"));
        assertEquals(new BigDecimal("20.00"), result.get(1).get("step_conversion_pct"));
        assertEquals(new BigDecimal("37.50"), result.get(2).get("step_conversion_pct"));
        assertEquals(new BigDecimal("60.00"), result.get(0).get("drop_off_pct"));
        assertEquals(new BigDecimal("100.00"), result.get(3).get("drop_off_pct"));
    }

    @Test
    void testNoProgressionPastFirstStep_LaterStepAbsent() {
        // Given: 100 page views, nobody added to cart
        List<Map<String, Object>> rows = List.of(step(1, 100, 0));

        // When
        List<Map<String, Object>> result = FunnelCalculator.calculate(rows);

        // Then
        assertEquals(1, result.size());
        assertEquals(new BigDecimal("100.00"), result.get(0).get("drop_off_pct"));
        assertNull(result.get(0).get("step_conversion_pct"));
    }

    @Test
    void testZeroEntriesInPreviousStep_ConversionUndefined() {
        // Given
        List<Map<String, Object>> rows = List.of(
                step(1, 0, 0),
                step(2, 5, 1));

        // When
        List<Map<String, Object>> result = FunnelCalculator.calculate(rows);

        // Then
        assertNull(result.get(1).get("step_conversion_pct"));
        assertNull(result.get(0).get("drop_off_pct"));
    }

    @Test
    void testMissingStep_NotFabricated() {
        // Given: nobody reached checkout
        List<Map<String, Object>> rows = List.of(
                step(1, 100, 10),
                step(2, 10, 0),
                step(4, 3, 0));

        // When
        List<Map<String, Object>> result = FunnelCalculator.calculate(rows);

        // Then
        assertEquals(3, result.size());
        assertEquals(4L, result.get(2).get("step_number"));
        assertNull(result.get(2).get("step_conversion_pct"));
    }

    @Test
    void testUnorderedInput_SortedByStep() {
        List<Map<String, Object>> result = FunnelCalculator.calculate(List.of(step(2, 10, 5), step(1, 20, 10)));

        assertEquals(1L, result.get(0).get("step_number"));
        assertEquals(new BigDecimal("25.00"), result.get(1).get("step_conversion_pct"));
    }

    @Test
    void testPercentage_RoundsHalfUp() {
        assertEquals(new BigDecimal("33.33"), FunnelCalculator.percentage(1, 3));
        assertEquals(new BigDecimal("66.67"), FunnelCalculator.percentage(2, 3));
        assertNull(FunnelCalculator.percentage(5, 0));
    }

    @Test
    void testEmptyInput() {
        assertTrue(FunnelCalculator.calculate(List.of()).isEmpty());
    }

    private static Map<String, Object> step(long number, long entries, long progressed) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("step_number", number);
        row.put("total_entries", entries);
        row.put("progressed", progressed);
        row.put("avg_time_minutes", null);
        return row;
    }
}
