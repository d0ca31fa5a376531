package com.di.taskpilot.tracker;

/**
 * Ordinary least squares of values against their index.
 */
final class LinearFit {

    final double slope;
    final double intercept;
    final double rSquared;

    private LinearFit(double slope, double intercept, double rSquared) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
    }

    static LinearFit of(double[] y) {
        int n = y.length;
        if (n < 2) {
            return new LinearFit(0.0, n == 1 ? y[0] : 0.0, 0.0);
        }
        double xMean = (n - 1) / 2.0;
        double yMean = 0.0;
        for (double v : y) yMean += v;
        yMean /= n;

        double sxy = 0.0;
        double sxx = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            sxy += dx * (y[i] - yMean);
            sxx += dx * dx;
        }
        double slope = sxx == 0.0 ? 0.0 : sxy / sxx;
        double intercept = yMean - slope * xMean;

        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < n; i++) {
            double predicted = slope * i + intercept;
            ssRes += (y[i] - predicted) * (y[i] - predicted);
            ssTot += (y[i] - yMean) * (y[i] - yMean);
        }
        double r2 = ssTot == 0.0 ? 0.0 : 1.0 - ssRes / ssTot;
        return new LinearFit(slope, intercept, Math.max(0.0, Math.min(1.0, r2)));
    }
}
