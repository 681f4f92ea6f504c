package com.framedenoiser.core.filter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Классификаторы аномалий пикселя по его истории в предыдущих кадрах:
 * размытие (провал яркости), засветка, шум, движение.
 * История короче двух значений ничего не классифицирует.
 */
public final class TemporalClassifiers {

    private final FilterThresholds thresholds;

    public TemporalClassifiers(FilterThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    /** Текущий пиксель резко темнее медианы истории и сам тёмный. */
    public boolean isBlur(int[] history, int current) {
        if (history == null || history.length < 2) return false;
        int median = PixelStats.median(history);
        return median - current > thresholds.blurDelta() && current < thresholds.blurCeiling();
    }

    /** Текущий пиксель резко ярче медианы истории и сам яркий. */
    public boolean isFlare(int[] history, int current) {
        if (history == null || history.length < 2) return false;
        int median = PixelStats.median(history);
        return current - median > thresholds.flareDelta() && current > thresholds.flareFloor();
    }

    /**
     * Шум: история стабильна (доля близких пар выше порога), а текущее значение далеко от её медианы.
     * По нестабильной истории шум не определяется.
     */
    public boolean isNoise(int[] history, int current) {
        if (history == null || history.length < 2) return false;
        double stability = PixelStats.stabilityRatio(history, thresholds.stabilityDelta());
        if (stability <= thresholds.stabilityRatio()) return false;
        return Math.abs(current - PixelStats.median(history)) > thresholds.temporalNoise();
    }

    public boolean hasMovement(int[] history) {
        if (history == null || history.length < 2) return false;
        return PixelStats.variance(history) > thresholds.movementVariance();
    }

    /** Среднее медианы и следующего за ней значения; если медиана - максимум, то сама медиана. */
    public static double blurCorrection(int[] history) {
        int[] sorted = sorted(history);
        int mid = sorted.length / 2;
        if (mid + 1 >= sorted.length) return sorted[mid];
        return (sorted[mid] + sorted[mid + 1]) / 2.0;
    }

    /** Среднее медианы и предыдущего перед ней значения; если медиана - минимум, то сама медиана. */
    public static double flareCorrection(int[] history) {
        int[] sorted = sorted(history);
        int mid = sorted.length / 2;
        if (mid == 0) return sorted[mid];
        return (sorted[mid] + sorted[mid - 1]) / 2.0;
    }

    /** Вес медианы истории в зависимости от её дисперсии. */
    public static double alphaFor(double variance) {
        if (variance < 10.0) return 0.6;
        if (variance < 25.0) return 0.4;
        return 0.2;
    }

    /** alpha·median(values) + (1 - alpha)·current; без истории возвращает current. */
    public static int adaptiveTemporalFilter(int[] values, int current, double variance) {
        if (values == null || values.length == 0) return current;
        return PixelStats.blend(alphaFor(variance), PixelStats.median(values), current);
    }

    private static int[] sorted(int[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("history is empty");
        }
        int[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }
}
