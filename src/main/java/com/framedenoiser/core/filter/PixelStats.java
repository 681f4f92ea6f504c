package com.framedenoiser.core.filter;

import com.framedenoiser.core.frame.Frame;

import java.util.Arrays;

/**
 * Статистики по набору интенсивностей: дисперсия, медиана, среднее, доли похожих значений.
 * Все функции чистые, входной массив не изменяется.
 */
public final class PixelStats {

    private PixelStats() {
    }

    /** Дисперсия генеральной совокупности E[V²] - E[V]²; 0 для пустого и одноэлементного набора. */
    public static double variance(int[] values) {
        if (values == null || values.length < 2) return 0.0;
        double sum = 0.0;
        double sumSq = 0.0;
        for (int v : values) {
            sum += v;
            sumSq += (double) v * v;
        }
        double mean = sum / values.length;
        double var = sumSq / values.length - mean * mean;
        // погрешность double не должна давать отрицательную дисперсию
        return var < 0.0 ? 0.0 : var;
    }

    /** Медиана без интерполяции: элемент len/2 отсортированной копии (для чётной длины - верхний из средних). */
    public static int median(int[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("median of empty set");
        }
        int[] sorted = values.clone();
        Arrays.sort(sorted);
        return sorted[sorted.length / 2];
    }

    public static double mean(int[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("mean of empty set");
        }
        double sum = 0.0;
        for (int v : values) sum += v;
        return sum / values.length;
    }

    /** Доля значений, отличающихся от center не более чем на delta. Пустой набор -> 0. */
    public static double similarityRatio(int[] values, int center, int delta) {
        if (values == null || values.length == 0) return 0.0;
        int similar = 0;
        for (int v : values) {
            if (Math.abs(v - center) <= delta) similar++;
        }
        return similar / (double) values.length;
    }

    /** Доля неупорядоченных пар (i, j), различающихся не более чем на delta. Меньше двух значений -> 0. */
    public static double stabilityRatio(int[] values, int delta) {
        if (values == null || values.length < 2) return 0.0;
        int n = values.length;
        long similarPairs = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (Math.abs(values[i] - values[j]) <= delta) similarPairs++;
            }
        }
        long totalPairs = (long) n * (n - 1) / 2;
        return similarPairs / (double) totalPairs;
    }

    /** Взвешенное среднее alpha·reference + (1 - alpha)·current, приведённое к пикселю усечением. */
    public static int blend(double alpha, double reference, int current) {
        return blend(alpha, reference, 1.0 - alpha, current);
    }

    /**
     * Взвешенная сумма с явными весами. Веса берутся как есть, без вычисления дополнения:
     * 1.0 - 0.8 в double не равно 0.2, и после усечения результат может отличаться на единицу.
     */
    public static int blend(double referenceWeight, double reference, double currentWeight, int current) {
        return Frame.clampToPixel(referenceWeight * reference + currentWeight * current);
    }
}
