package com.fincore.foresight.ml;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Linear regression with an L2 penalty on the coefficients, solved in closed form:
 * {@code beta = (Xc'Xc + alpha*I)^-1 Xc'(y - mean(y))} on column-centred inputs.
 * The intercept is not penalised.
 */
public final class RidgeRegression {

    private final double[] coefficients;
    private final double intercept;

    private RidgeRegression(double[] coefficients, double intercept) {
        this.coefficients = coefficients;
        this.intercept = intercept;
    }

    public static RidgeRegression fit(double[][] x, double[] y, double alpha) {
        if (x.length == 0 || x.length != y.length) {
            throw new IllegalArgumentException("Need a non-empty design matrix matching the targets");
        }
        int rows = x.length;
        int cols = x[0].length;

        double[] columnMeans = new double[cols];
        for (double[] row : x) {
            for (int c = 0; c < cols; c++) {
                columnMeans[c] += row[c] / rows;
            }
        }
        double targetMean = 0.0;
        for (double target : y) {
            targetMean += target / rows;
        }

        double[][] centred = new double[rows][cols];
        double[] centredTargets = new double[rows];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                centred[r][c] = x[r][c] - columnMeans[c];
            }
            centredTargets[r] = y[r] - targetMean;
        }

        RealMatrix design = MatrixUtils.createRealMatrix(centred);
        RealMatrix gram = design.transpose().multiply(design);
        for (int c = 0; c < cols; c++) {
            gram.addToEntry(c, c, alpha);
        }
        RealVector rhs = design.transpose().operate(new ArrayRealVector(centredTargets, false));
        double[] beta = new LUDecomposition(gram).getSolver().solve(rhs).toArray();

        double intercept = targetMean;
        for (int c = 0; c < cols; c++) {
            intercept -= columnMeans[c] * beta[c];
        }
        return new RidgeRegression(beta, intercept);
    }

    public double predict(double[] row) {
        if (row.length != coefficients.length) {
            throw new IllegalArgumentException("Expected " + coefficients.length
                    + " features but got " + row.length);
        }
        double value = intercept;
        for (int c = 0; c < row.length; c++) {
            value += coefficients[c] * row[c];
        }
        return value;
    }

    public double[] predict(double[][] rows) {
        double[] values = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            values[r] = predict(rows[r]);
        }
        return values;
    }
}
