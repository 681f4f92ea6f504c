package com.framedenoiser.core.filter;

import com.framedenoiser.core.frame.Frame;
import com.framedenoiser.core.frame.Neighborhood;
import com.framedenoiser.core.frame.Patch;
import com.framedenoiser.core.frame.PatchCommitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Пространственный адаптивный фильтр. Решение принимается по каждому пикселю независимо,
 * читается только кадр-источник, результат пишется в новый кадр.
 * Порядок проверок: граница, затем шум, затем уровень дисперсии соседей; срабатывает одна ветка.
 */
public final class SpatialFilter {

    public enum Decision { UNCHANGED, EDGE, NOISE, FLAT, MODERATE, TEXTURE }

    // пары весов (опорное значение, текущий пиксель)
    private static final double EDGE_MEDIAN_WEIGHT = 0.1;
    private static final double EDGE_CURRENT_WEIGHT = 0.9;
    private static final double FLAT_MEAN_WEIGHT = 0.7;
    private static final double FLAT_CURRENT_WEIGHT = 0.3;
    private static final double MODERATE_MEDIAN_WEIGHT = 0.3;
    private static final double MODERATE_CURRENT_WEIGHT = 0.7;
    private static final double TEXTURE_MEDIAN_WEIGHT = 0.05;
    private static final double TEXTURE_CURRENT_WEIGHT = 0.95;

    private final int radius;
    private final FilterThresholds thresholds;
    private final EdgeDetector edgeDetector;

    public SpatialFilter(int radius, FilterThresholds thresholds) {
        if (radius < 0) {
            throw new IllegalArgumentException("Spatial radius must be >= 0: " + radius);
        }
        this.radius = radius;
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.edgeDetector = new EdgeDetector(thresholds.spatialEdge());
    }

    public int radius() {
        return radius;
    }

    /** Новый кадр того же размера; source не изменяется. */
    public Frame apply(Frame source) {
        Objects.requireNonNull(source, "source");
        Frame out = new Frame(source.rows(), source.cols());
        for (int row = 0; row < source.rows(); row++) {
            PatchCommitter.commit(out, linePatches(source, row));
        }
        return out;
    }

    /** Новые значения строки row в координатах кадра; source не изменяется. */
    public List<Patch> linePatches(Frame source, int row) {
        List<Patch> patches = new ArrayList<>(source.cols());
        for (int col = 0; col < source.cols(); col++) {
            Neighborhood n = Neighborhood.extract(source, row, col, radius);
            patches.add(n.toPatch(filterPixel(n)));
        }
        return patches;
    }

    public int filterPixel(Neighborhood n) {
        int current = n.center();
        int[] neighbors = n.neighbors();
        return switch (classify(n, neighbors)) {
            case UNCHANGED -> current;
            case EDGE -> PixelStats.blend(EDGE_MEDIAN_WEIGHT, PixelStats.median(neighbors), EDGE_CURRENT_WEIGHT, current);
            case NOISE -> PixelStats.median(neighbors);
            case FLAT -> PixelStats.blend(FLAT_MEAN_WEIGHT, PixelStats.mean(neighbors), FLAT_CURRENT_WEIGHT, current);
            case MODERATE -> PixelStats.blend(MODERATE_MEDIAN_WEIGHT, PixelStats.median(neighbors), MODERATE_CURRENT_WEIGHT, current);
            case TEXTURE -> PixelStats.blend(TEXTURE_MEDIAN_WEIGHT, PixelStats.median(neighbors), TEXTURE_CURRENT_WEIGHT, current);
        };
    }

    public Decision classify(Neighborhood n) {
        return classify(n, n.neighbors());
    }

    private Decision classify(Neighborhood n, int[] neighbors) {
        // блок 1×1: соседей нет, значение остаётся как есть
        if (neighbors.length == 0) return Decision.UNCHANGED;
        if (edgeDetector.isEdge(n)) return Decision.EDGE;
        if (isNoise(n.center(), neighbors)) return Decision.NOISE;
        double variance = PixelStats.variance(neighbors);
        if (variance < thresholds.lowVariance()) return Decision.FLAT;
        if (variance < thresholds.midVariance()) return Decision.MODERATE;
        return Decision.TEXTURE;
    }

    /** Шум: доля соседей, близких к центру, ниже порога. */
    public boolean isNoise(Neighborhood n) {
        return isNoise(n.center(), n.neighbors());
    }

    private boolean isNoise(int center, int[] neighbors) {
        if (neighbors.length == 0) return false;
        return PixelStats.similarityRatio(neighbors, center, thresholds.similarityDelta())
                < thresholds.similarityRatio();
    }
}
