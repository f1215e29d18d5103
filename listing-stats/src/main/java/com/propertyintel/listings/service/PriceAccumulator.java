package com.propertyintel.listings.service;

import java.util.Arrays;

/**
 * Collects the price-per-m² values of one group. All values are kept
 * because an exact median needs the whole distribution.
 */
final class PriceAccumulator {

    private double[] values = new double[16];
    private int count;
    private double sum;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    void add(double value) {
        if (count == values.length) {
            values = Arrays.copyOf(values, count * 2);
        }
        values[count++] = value;
        sum += value;
        min = Math.min(min, value);
        max = Math.max(max, value);
    }

    long count() {
        return count;
    }

    double mean() {
        return sum / count;
    }

    double min() {
        return min;
    }

    double max() {
        return max;
    }

    double median() {
        double[] sorted = Arrays.copyOf(values, count);
        Arrays.sort(sorted);
        int mid = count / 2;
        return count % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
