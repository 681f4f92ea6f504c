package com.framedenoiser.core.filter;

import com.framedenoiser.core.frame.Frame;
import com.framedenoiser.core.frame.Neighborhood;
import com.framedenoiser.core.frame.Patch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Временной адаптивный фильтр: для пикселя кадра t строит историю по кадрам [t - previousFrames, t)
 * и выбирает коррекцию. Ветки проверяются по порядку, срабатывает первая.
 * Кадры 0..2 и кадры, для которых окно истории не помещается, проходят без изменений.
 */
public final class TemporalFilter {

    public enum Decision { EDGE, BLUR, FLARE, NOISE, STABLE, MOTION }

    /** Первый кадр, для которого истории достаточно. */
    public static final int MIN_FRAME_INDEX = 3;

    private static final int EDGE_RADIUS = 1;
    private static final double ANOMALY_CORRECTION_WEIGHT = 0.8;
    private static final double ANOMALY_CURRENT_WEIGHT = 0.2;
    private static final double NOISE_MEDIAN_WEIGHT = 0.7;
    private static final double NOISE_CURRENT_WEIGHT = 0.3;

    private final int previousFrames;
    private final FilterThresholds thresholds;
    private final EdgeDetector edgeDetector;
    private final TemporalClassifiers classifiers;

    public TemporalFilter(int previousFrames, FilterThresholds thresholds) {
        if (previousFrames < 1) {
            throw new IllegalArgumentException("previousFrames must be >= 1: " + previousFrames);
        }
        this.previousFrames = previousFrames;
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.edgeDetector = new EdgeDetector(thresholds.temporalEdge());
        this.classifiers = new TemporalClassifiers(thresholds);
    }

    public int previousFrames() {
        return previousFrames;
    }

    public TemporalClassifiers classifiers() {
        return classifiers;
    }

    /** Кадр t обрабатывается, только если t > 2 и окно истории целиком лежит в последовательности. */
    public boolean canProcess(int frameIndex) {
        return frameIndex >= MIN_FRAME_INDEX && frameIndex >= previousFrames;
    }

    /**
     * Новая строка line кадра t. История берётся из frames как есть: вызывающий отвечает за то,
     * чтобы кадры до t были окончательными.
     */
    public int[] processLine(List<Frame> frames, int frameIndex, int line) {
        List<Patch> patches = linePatches(frames, frameIndex, line);
        int[] out = new int[patches.size()];
        for (Patch p : patches) {
            out[p.col()] = p.value();
        }
        return out;
    }

    /**
     * То же, что processLine, но в виде записей для кадра назначения.
     * Для кадра без полного окна истории записи повторяют исходную строку.
     */
    public List<Patch> linePatches(List<Frame> frames, int frameIndex, int line) {
        Objects.requireNonNull(frames, "frames");
        if (frameIndex < 0 || frameIndex >= frames.size()) {
            throw new IllegalArgumentException("Frame index " + frameIndex + " outside sequence of " + frames.size());
        }
        Frame current = frames.get(frameIndex);
        if (line < 0 || line >= current.rows()) {
            throw new IllegalArgumentException("Line " + line + " outside frame " + current);
        }
        boolean process = canProcess(frameIndex);
        List<Patch> patches = new ArrayList<>(current.cols());
        for (int col = 0; col < current.cols(); col++) {
            Neighborhood n = Neighborhood.extract(current, line, col, EDGE_RADIUS);
            int value = process ? filterPixel(frames, frameIndex, n) : n.center();
            patches.add(n.toPatch(value));
        }
        return patches;
    }

    public int filterPixel(List<Frame> frames, int frameIndex, int line, int col) {
        return filterPixel(frames, frameIndex, Neighborhood.extract(frames.get(frameIndex), line, col, EDGE_RADIUS));
    }

    private int filterPixel(List<Frame> frames, int frameIndex, Neighborhood n) {
        if (edgeDetector.isEdge(n)) {
            return n.center();
        }
        return correct(history(frames, frameIndex, n.originRow(), n.originCol()), n.center());
    }

    /** Значения пикселя (line, col) в кадрах [t - previousFrames, t). */
    public int[] history(List<Frame> frames, int frameIndex, int line, int col) {
        int start = frameIndex - previousFrames;
        if (start < 0) {
            throw new IllegalArgumentException("History window [" + start + ", " + frameIndex + ") outside sequence");
        }
        int[] h = new int[previousFrames];
        for (int i = 0; i < previousFrames; i++) {
            Frame f = frames.get(start + i);
            if (!f.contains(line, col)) {
                throw new IllegalArgumentException("Frame " + (start + i) + " " + f
                        + " does not contain (" + line + ", " + col + ")");
            }
            h[i] = f.get(line, col);
        }
        return h;
    }

    /** Решение для пикселя, не являющегося границей. */
    public Decision classify(int[] history, int current) {
        if (classifiers.isBlur(history, current)) return Decision.BLUR;
        if (classifiers.isFlare(history, current)) return Decision.FLARE;
        if (classifiers.isNoise(history, current)) return Decision.NOISE;
        double variance = PixelStats.variance(history);
        if (variance < thresholds.stableVariance() && !classifiers.hasMovement(history)) return Decision.STABLE;
        return Decision.MOTION;
    }

    public int correct(int[] history, int current) {
        return switch (classify(history, current)) {
            case BLUR -> PixelStats.blend(ANOMALY_CORRECTION_WEIGHT, TemporalClassifiers.blurCorrection(history),
                    ANOMALY_CURRENT_WEIGHT, current);
            case FLARE -> PixelStats.blend(ANOMALY_CORRECTION_WEIGHT, TemporalClassifiers.flareCorrection(history),
                    ANOMALY_CURRENT_WEIGHT, current);
            case NOISE -> PixelStats.blend(NOISE_MEDIAN_WEIGHT, PixelStats.median(history), NOISE_CURRENT_WEIGHT, current);
            case STABLE -> TemporalClassifiers.adaptiveTemporalFilter(history, current, PixelStats.variance(history));
            // настоящее движение сохраняем
            case MOTION, EDGE -> current;
        };
    }
}
