package com.framedenoiser.core.filter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PixelStatsTest {

    @Test
    void medianOddEvenAndUnsorted() {
        assertEquals(5, PixelStats.median(new int[]{1, 3, 5, 7, 9}));
        assertEquals(6, PixelStats.median(new int[]{2, 4, 6, 8}));   // верхний из средних
        assertEquals(42, PixelStats.median(new int[]{42}));
        assertEquals(5, PixelStats.median(new int[]{9, 1, 5, 3, 7}));
        assertEquals(2, PixelStats.median(new int[]{1, 1, 2, 2, 3}));
    }

    @Test
    void medianDoesNotModifyInput() {
        int[] values = {9, 1, 5, 3, 7};
        PixelStats.median(values);
        assertArrayEquals(new int[]{9, 1, 5, 3, 7}, values);
    }

    @Test
    void medianOfEmptySetIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PixelStats.median(new int[0]));
    }

    @Test
    void varianceIsPopulationVariance() {
        assertEquals(0.0, PixelStats.variance(new int[0]));
        assertEquals(0.0, PixelStats.variance(new int[]{100}));
        assertEquals(0.0, PixelStats.variance(new int[]{100, 100, 100, 100}));
        assertEquals(2.0, PixelStats.variance(new int[]{1, 2, 3, 4, 5}), 1e-9);
        assertEquals(16256.25, PixelStats.variance(new int[]{0, 255, 0, 255}), 1e-9);
        assertEquals(16055.5556, PixelStats.variance(new int[]{0, 255, 0, 255, 0, 255, 0, 255, 0}), 1e-3);
    }

    @Test
    void varianceIgnoresOrder() {
        double a = PixelStats.variance(new int[]{12, 200, 37, 99, 3});
        double b = PixelStats.variance(new int[]{3, 99, 37, 200, 12});
        assertEquals(a, b, 1e-9);
    }

    @Test
    void meanIsNotTruncated() {
        assertEquals(1.5, PixelStats.mean(new int[]{1, 2}));
    }

    @Test
    void similarityRatioCountsNeighborsWithinDelta() {
        int[] neighbors = {100, 100, 100, 100, 100, 100, 100, 100};
        assertEquals(0.0, PixelStats.similarityRatio(neighbors, 255, 15));
        assertEquals(1.0, PixelStats.similarityRatio(neighbors, 115, 15));
        assertEquals(0.5, PixelStats.similarityRatio(new int[]{0, 10, 50, 60}, 5, 5));
        assertEquals(0.0, PixelStats.similarityRatio(new int[0], 5, 5));
    }

    @Test
    void stabilityRatioCountsUnorderedPairs() {
        int[] history = {100, 102, 98, 101, 99};
        assertEquals(1.0, PixelStats.stabilityRatio(history, 5));
        assertEquals(0.9, PixelStats.stabilityRatio(history, 3), 1e-9);
        assertEquals(0.1, PixelStats.stabilityRatio(new int[]{50, 150, 75, 125, 80}, 5), 1e-9);
        assertEquals(0.0, PixelStats.stabilityRatio(new int[]{7}, 5));
    }

    @Test
    void blendAlwaysStaysInPixelRange() {
        double[] weights = {0.05, 0.1, 0.2, 0.3, 0.4, 0.6, 0.7, 0.8, 1.5, -0.5};
        for (double w : weights) {
            for (int current = 0; current <= 255; current += 5) {
                for (int ref = 0; ref <= 255; ref += 15) {
                    int v = PixelStats.blend(w, ref, current);
                    assertTrue(v >= 0 && v <= 255, "blend(" + w + ", " + ref + ", " + current + ") = " + v);
                }
            }
        }
    }

    @Test
    void blendTruncates() {
        assertEquals(120, PixelStats.blend(0.6, 100, 150));
        assertEquals(6, PixelStats.blend(0.6, 11, 0));   // 6.6 -> 6
        assertEquals(128, PixelStats.blend(0.8, 100, 0.2, 240));
        assertEquals(127, PixelStats.blend(0.8, 100, 240));   // 1.0 - 0.8 < 0.2 в double
    }
}
