package com.quantops.core.progress;

import java.util.List;
import java.util.Map;

/**
 * Metric records appended since a cursor, plus the cursor to use next time.
 */
public record MetricsPage(List<Map<String, Object>> metrics, int cursor) {

    public MetricsPage {
        metrics = List.copyOf(metrics);
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }
}
