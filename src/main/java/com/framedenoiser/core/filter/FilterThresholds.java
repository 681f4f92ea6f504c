package com.framedenoiser.core.filter;

/**
 * Пороги классификаторов. Значения по умолчанию - текущая настройка,
 * переопределяются секцией denoise.thresholds в application.yaml.
 */
public record FilterThresholds(
        double spatialEdge,         // порог градиента для пространственного прохода
        int similarityDelta,        // |сосед - центр| <= delta считается «похожим»
        double similarityRatio,     // доля похожих соседей ниже порога -> шум
        double lowVariance,         // однородная область
        double midVariance,         // умеренная текстура
        double temporalEdge,        // порог градиента для временного прохода
        int stabilityDelta,         // пара значений истории считается близкой
        double stabilityRatio,      // история стабильна, если доля близких пар выше
        int temporalNoise,          // отклонение от медианы истории, считающееся шумом
        int blurDelta,
        int blurCeiling,
        int flareDelta,
        int flareFloor,
        double stableVariance,      // дисперсия истории для «спокойного» пикселя
        double movementVariance     // выше - считаем, что в пикселе есть движение
) {
    public static final double DEFAULT_SPATIAL_EDGE = 25.0;
    public static final int DEFAULT_SIMILARITY_DELTA = 15;
    public static final double DEFAULT_SIMILARITY_RATIO = 0.3;
    public static final double DEFAULT_LOW_VARIANCE = 50.0;
    public static final double DEFAULT_MID_VARIANCE = 200.0;
    public static final double DEFAULT_TEMPORAL_EDGE = 20.0;
    public static final int DEFAULT_STABILITY_DELTA = 5;
    public static final double DEFAULT_STABILITY_RATIO = 0.6;
    public static final int DEFAULT_TEMPORAL_NOISE = 10;
    public static final int DEFAULT_BLUR_DELTA = 40;
    public static final int DEFAULT_BLUR_CEILING = 60;
    public static final int DEFAULT_FLARE_DELTA = 50;
    public static final int DEFAULT_FLARE_FLOOR = 180;
    public static final double DEFAULT_STABLE_VARIANCE = 20.0;
    public static final double DEFAULT_MOVEMENT_VARIANCE = 30.0;

    public FilterThresholds {
        if (spatialEdge < 0 || temporalEdge < 0) {
            throw new IllegalArgumentException("Edge thresholds must be >= 0");
        }
        if (similarityRatio < 0 || similarityRatio > 1 || stabilityRatio < 0 || stabilityRatio > 1) {
            throw new IllegalArgumentException("Ratios must be within [0, 1]");
        }
        if (lowVariance > midVariance) {
            throw new IllegalArgumentException("lowVariance must not exceed midVariance");
        }
    }

    public static FilterThresholds defaults() {
        return new FilterThresholds(
                DEFAULT_SPATIAL_EDGE, DEFAULT_SIMILARITY_DELTA, DEFAULT_SIMILARITY_RATIO,
                DEFAULT_LOW_VARIANCE, DEFAULT_MID_VARIANCE,
                DEFAULT_TEMPORAL_EDGE, DEFAULT_STABILITY_DELTA, DEFAULT_STABILITY_RATIO, DEFAULT_TEMPORAL_NOISE,
                DEFAULT_BLUR_DELTA, DEFAULT_BLUR_CEILING, DEFAULT_FLARE_DELTA, DEFAULT_FLARE_FLOOR,
                DEFAULT_STABLE_VARIANCE, DEFAULT_MOVEMENT_VARIANCE);
    }
}
