package com.framedenoiser.core.filter;

import com.framedenoiser.core.frame.Frame;
import com.framedenoiser.core.frame.Neighborhood;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EdgeDetectorTest {

    private final EdgeDetector detector = new EdgeDetector(20.0);

    // горизонтальная граница: строки 0, 50, 100, 150, 255
    private static Frame rampFrame() {
        int[] rowValues = {0, 50, 100, 150, 255};
        int[][] v = new int[5][5];
        for (int r = 0; r < 5; r++) {
            for (int c = 0; c < 5; c++) v[r][c] = rowValues[r];
        }
        return Frame.of(v);
    }

    @Test
    void smallBlockIsAlwaysEdge() {
        assertTrue(detector.isEdge(Neighborhood.of(new int[][]{{100, 100}, {100, 100}}, 0, 0)));
        assertTrue(detector.isEdge(Neighborhood.of(new int[][]{{100}}, 0, 0)));
        assertTrue(detector.isEdge(Neighborhood.of(new int[][]{{1, 1, 1}, {1, 1, 1}}, 1, 1)));
    }

    @Test
    void centerOnBlockBoundaryIsEdge() {
        Frame f = Frame.filled(5, 5, 100);
        assertTrue(detector.isEdge(Neighborhood.extract(f, 0, 2, 1)));
        assertTrue(detector.isEdge(Neighborhood.extract(f, 2, 0, 1)));
        assertTrue(detector.isEdge(Neighborhood.extract(f, 2, 4, 1)));
        assertTrue(detector.isEdge(Neighborhood.extract(f, 4, 2, 1)));
    }

    @Test
    void uniformInteriorIsNotEdge() {
        assertFalse(detector.isEdge(Neighborhood.extract(Frame.filled(5, 5, 100), 2, 2, 1)));
    }

    @Test
    void strongVerticalGradientIsEdge() {
        Neighborhood n = Neighborhood.extract(rampFrame(), 2, 2, 1);
        assertEquals(50.0, EdgeDetector.gradient(n), 1e-9);
        assertTrue(detector.isEdge(n));
    }

    @Test
    void gradientEqualToThresholdIsNotEdge() {
        Neighborhood n = Neighborhood.of(new int[][]{
                {10, 10, 10},
                {0, 10, 50},
                {10, 10, 10}}, 1, 1);
        // gx = 25, gy = 0
        assertFalse(new EdgeDetector(25.0).isEdge(n));
        assertTrue(new EdgeDetector(24.9).isEdge(n));
    }

    @Test
    void negativeThresholdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EdgeDetector(-1));
    }
}
