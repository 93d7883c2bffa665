package com.fincore.foresight.feature;

import lombok.Getter;

/**
 * Feature rows with their regression targets, index-aligned.
 */
@Getter
public class TrainingSet {

    private final double[][] features;
    private final double[] targets;

    public TrainingSet(double[][] features, double[] targets) {
        if (features.length != targets.length) {
            throw new IllegalArgumentException("Feature rows (" + features.length
                    + ") and targets (" + targets.length + ") differ in length");
        }
        this.features = features;
        this.targets = targets;
    }

    public int size() {
        return targets.length;
    }

    public boolean isEmpty() {
        return targets.length == 0;
    }

    /**
     * Rows selected by index, in the given order.
     */
    public TrainingSet select(int[] indices) {
        double[][] x = new double[indices.length][];
        double[] y = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            x[i] = features[indices[i]];
            y[i] = targets[indices[i]];
        }
        return new TrainingSet(x, y);
    }
}
