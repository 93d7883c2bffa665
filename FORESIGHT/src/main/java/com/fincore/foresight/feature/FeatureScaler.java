package com.fincore.foresight.feature;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Per-column standardisation: {@code (x - mean) / std}, with the population standard
 * deviation. Constant columns are scaled by 1 so they map to zero.
 */
public final class FeatureScaler {

    private final double[] means;
    private final double[] scales;

    private FeatureScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    /**
     * Learn column statistics from the given rows.
     */
    public static FeatureScaler fit(double[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on zero rows");
        }
        int width = rows[0].length;
        double[] means = new double[width];
        double[] scales = new double[width];
        Mean mean = new Mean();
        StandardDeviation std = new StandardDeviation(false);

        double[] column = new double[rows.length];
        for (int c = 0; c < width; c++) {
            for (int r = 0; r < rows.length; r++) {
                column[r] = rows[r][c];
            }
            means[c] = mean.evaluate(column);
            double sd = std.evaluate(column);
            scales[c] = sd > 0.0 ? sd : 1.0;
        }
        return new FeatureScaler(means, scales);
    }

    public int width() {
        return means.length;
    }

    public double[] transform(double[] row) {
        if (row.length != means.length) {
            throw new IllegalArgumentException("Expected " + means.length
                    + " features but got " + row.length);
        }
        double[] scaled = new double[row.length];
        for (int c = 0; c < row.length; c++) {
            scaled[c] = (row[c] - means[c]) / scales[c];
        }
        return scaled;
    }

    public double[][] transform(double[][] rows) {
        double[][] scaled = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            scaled[r] = transform(rows[r]);
        }
        return scaled;
    }
}
