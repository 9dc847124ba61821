package com.quantops.core.checkpoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Down-samples long time series (equity curves, loss histories) before they
 * are stored in a checkpoint. Keeps every K-th point plus the final point,
 * in chronological order.
 */
public final class SeriesSampler {

    private SeriesSampler() {
    }

    /**
     * Keep indices 0, K, 2K, ... and always the last point.
     */
    public static <T> List<T> sampleEvery(List<T> series, int step) {
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive, got " + step);
        }
        if (series.size() <= 1 || step == 1) {
            return List.copyOf(series);
        }
        List<T> sampled = new ArrayList<>(series.size() / step + 2);
        for (int i = 0; i < series.size(); i += step) {
            sampled.add(series.get(i));
        }
        int last = series.size() - 1;
        if (last % step != 0) {
            sampled.add(series.get(last));
        }
        return sampled;
    }

    /**
     * Pick the smallest step that keeps the sample at or below {@code maxPoints}.
     */
    public static <T> List<T> sampleToLimit(List<T> series, int maxPoints) {
        if (maxPoints < 2) {
            throw new IllegalArgumentException("maxPoints must be at least 2, got " + maxPoints);
        }
        if (series.size() <= maxPoints) {
            return List.copyOf(series);
        }
        // ceil(n / (max - 1)) leaves room for the appended final point
        int step = (series.size() + maxPoints - 2) / (maxPoints - 1);
        return sampleEvery(series, step);
    }
}
