package com.framedenoiser.core.frame;

import java.util.Arrays;

/**
 * Кадр в оттенках серого: прямоугольная сетка интенсивностей 0..255, адресация (row, col).
 * Пустой кадр (0 строк или 0 столбцов) не допускается.
 */
public final class Frame {
    public static final int MIN_VALUE = 0;
    public static final int MAX_VALUE = 255;

    private final int rows;
    private final int cols;
    private final int[][] pixels;

    public Frame(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Invalid frame dimensions: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.pixels = new int[rows][cols];
    }

    /** Копирует переданную сетку; строки должны быть одной длины, значения в 0..255. */
    public static Frame of(int[][] values) {
        if (values == null || values.length == 0 || values[0] == null || values[0].length == 0) {
            throw new IllegalArgumentException("Invalid frame dimensions: empty grid");
        }
        Frame f = new Frame(values.length, values[0].length);
        for (int r = 0; r < f.rows; r++) {
            if (values[r] == null || values[r].length != f.cols) {
                throw new IllegalArgumentException("Row " + r + " has length "
                        + (values[r] == null ? 0 : values[r].length) + ", expected " + f.cols);
            }
            for (int c = 0; c < f.cols; c++) {
                f.set(r, c, values[r][c]);
            }
        }
        return f;
    }

    public static Frame filled(int rows, int cols, int value) {
        Frame f = new Frame(rows, cols);
        checkValue(value);
        for (int[] row : f.pixels) {
            Arrays.fill(row, value);
        }
        return f;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    public int get(int row, int col) {
        checkBounds(row, col);
        return pixels[row][col];
    }

    public void set(int row, int col, int value) {
        checkBounds(row, col);
        checkValue(value);
        pixels[row][col] = value;
    }

    /** Копия строки; исходный кадр не меняется. */
    public int[] row(int row) {
        checkBounds(row, 0);
        return pixels[row].clone();
    }

    /** Заменяет строку целиком. Используется воркерами временного прохода, каждый пишет только свою строку. */
    public void setRow(int row, int[] values) {
        checkBounds(row, 0);
        if (values == null || values.length != cols) {
            throw new IllegalArgumentException("Line " + row + " must have " + cols + " values");
        }
        for (int v : values) {
            checkValue(v);
        }
        System.arraycopy(values, 0, pixels[row], 0, cols);
    }

    public Frame copy() {
        Frame f = new Frame(rows, cols);
        for (int r = 0; r < rows; r++) {
            System.arraycopy(pixels[r], 0, f.pixels[r], 0, cols);
        }
        return f;
    }

    public boolean sameSize(Frame other) {
        return other != null && other.rows == rows && other.cols == cols;
    }

    /** Приводит значение к диапазону интенсивности с усечением к нулю (не округлением). */
    public static int clampToPixel(double value) {
        if (Double.isNaN(value) || value <= MIN_VALUE) return MIN_VALUE;
        if (value >= MAX_VALUE) return MAX_VALUE;
        return (int) value;
    }

    private void checkBounds(int row, int col) {
        if (!contains(row, col)) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + rows + "x" + cols);
        }
    }

    private static void checkValue(int value) {
        if (value < MIN_VALUE || value > MAX_VALUE) {
            throw new IllegalArgumentException("Pixel value out of range: " + value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Frame other)) return false;
        return rows == other.rows && cols == other.cols && Arrays.deepEquals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.deepHashCode(pixels);
    }

    @Override
    public String toString() {
        return "Frame[" + rows + "x" + cols + "]";
    }
}
