package com.dashboard.domain.catalog;

import java.util.List;
import java.util.Map;

/**
 * Post-processing applied to raw rows before they are cached or returned.
 */
@FunctionalInterface
public interface ResultTransformer {

    ResultTransformer IDENTITY = rows -> rows;

    List<Map<String, Object>> apply(List<Map<String, Object>> rows);
}
