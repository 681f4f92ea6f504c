package com.framedenoiser.core.filter;

import com.framedenoiser.core.frame.Neighborhood;

/**
 * Детектор границ по модулю градиента из центральных разностей 4-соседей.
 */
public final class EdgeDetector {
    private final double threshold;

    public EdgeDetector(double threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Edge threshold must be >= 0: " + threshold);
        }
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    public boolean isEdge(Neighborhood n) {
        // мало данных, чтобы опровергнуть границу
        if (n.height() < 3 || n.width() < 3 || n.centerOnBoundary()) {
            return true;
        }
        return gradient(n) > threshold;
    }

    /** Модуль градиента в центре; центр не должен лежать на границе блока. */
    static double gradient(Neighborhood n) {
        int cr = n.centerRow();
        int cc = n.centerCol();
        double top = n.get(cr - 1, cc);
        double bottom = n.get(cr + 1, cc);
        double left = n.get(cr, cc - 1);
        double right = n.get(cr, cc + 1);
        double gx = (right - left) / 2.0;
        double gy = (bottom - top) / 2.0;
        return Math.sqrt(gx * gx + gy * gy);
    }
}
