package com.framedenoiser.core.frame;

/**
 * Окрестность пикселя: прямоугольный блок, вырезанный из кадра вокруг центра
 * и обрезанный по границам кадра. У края кадра блок меньше (2r+1)² и несимметричен.
 * Блок - снимок: изменения исходного кадра на него не влияют.
 */
public final class Neighborhood {
    private final int[][] block;
    private final int centerRow;    // смещение центра внутри блока
    private final int centerCol;
    private final int originRow;    // координаты центра в кадре
    private final int originCol;
    private final int rowMin, rowMax, colMin, colMax;

    private Neighborhood(int[][] block, int centerRow, int centerCol, int originRow, int originCol,
                         int rowMin, int rowMax, int colMin, int colMax) {
        this.block = block;
        this.centerRow = centerRow;
        this.centerCol = centerCol;
        this.originRow = originRow;
        this.originCol = originCol;
        this.rowMin = rowMin;
        this.rowMax = rowMax;
        this.colMin = colMin;
        this.colMax = colMax;
    }

    public static Neighborhood extract(Frame frame, int row, int col, int radius) {
        if (frame == null) {
            throw new IllegalArgumentException("Invalid dimensions: frame is null");
        }
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be >= 0: " + radius);
        }
        if (!frame.contains(row, col)) {
            throw new IllegalArgumentException("Center (" + row + ", " + col + ") outside frame "
                    + frame.rows() + "x" + frame.cols());
        }
        int rMin = Math.max(0, row - radius);
        int rMax = Math.min(frame.rows() - 1, row + radius);
        int cMin = Math.max(0, col - radius);
        int cMax = Math.min(frame.cols() - 1, col + radius);

        int[][] block = new int[rMax - rMin + 1][cMax - cMin + 1];
        for (int r = rMin; r <= rMax; r++) {
            for (int c = cMin; c <= cMax; c++) {
                block[r - rMin][c - cMin] = frame.get(r, c);
            }
        }
        return new Neighborhood(block, row - rMin, col - cMin, row, col, rMin, rMax, cMin, cMax);
    }

    /** Блок, заданный напрямую (без кадра-источника); центр задаётся смещением внутри блока. */
    public static Neighborhood of(int[][] values, int centerRow, int centerCol) {
        if (values == null || values.length == 0 || values[0] == null || values[0].length == 0) {
            throw new IllegalArgumentException("Invalid dimensions: empty neighborhood block");
        }
        int w = values[0].length;
        int[][] block = new int[values.length][];
        for (int r = 0; r < values.length; r++) {
            if (values[r] == null || values[r].length != w) {
                throw new IllegalArgumentException("Neighborhood block must be rectangular");
            }
            block[r] = values[r].clone();
        }
        if (centerRow < 0 || centerRow >= block.length || centerCol < 0 || centerCol >= w) {
            throw new IllegalArgumentException("Center offset (" + centerRow + ", " + centerCol + ") outside block");
        }
        return new Neighborhood(block, centerRow, centerCol, centerRow, centerCol,
                0, block.length - 1, 0, w - 1);
    }

    public int height() {
        return block.length;
    }

    public int width() {
        return block[0].length;
    }

    public int get(int row, int col) {
        return block[row][col];
    }

    public int center() {
        return block[centerRow][centerCol];
    }

    public int centerRow() {
        return centerRow;
    }

    public int centerCol() {
        return centerCol;
    }

    public int originRow() {
        return originRow;
    }

    public int originCol() {
        return originCol;
    }

    public int rowMin() {
        return rowMin;
    }

    public int rowMax() {
        return rowMax;
    }

    public int colMin() {
        return colMin;
    }

    public int colMax() {
        return colMax;
    }

    /** Центр касается границы блока: полной 4-связной окрестности нет. */
    public boolean centerOnBoundary() {
        return centerRow == 0 || centerRow == height() - 1
                || centerCol == 0 || centerCol == width() - 1;
    }

    /** Все значения блока, кроме центра. Для блока 1×1 - пустой массив. */
    public int[] neighbors() {
        int[] out = new int[height() * width() - 1];
        int i = 0;
        for (int r = 0; r < height(); r++) {
            for (int c = 0; c < width(); c++) {
                if (r == centerRow && c == centerCol) continue;
                out[i++] = block[r][c];
            }
        }
        return out;
    }

    /** Результат фильтра для центра, готовый к записи в кадр назначения. */
    public Patch toPatch(int value) {
        return new Patch(originRow, originCol, value);
    }
}
