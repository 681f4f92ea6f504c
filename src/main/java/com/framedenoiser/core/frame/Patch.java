package com.framedenoiser.core.frame;

/**
 * Вычисленное значение пикселя для записи в кадр назначения.
 */
public record Patch(int row, int col, int value) {

    public Patch {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Invalid patch position: (" + row + ", " + col + ")");
        }
    }
}
