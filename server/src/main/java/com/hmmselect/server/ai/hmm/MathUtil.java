package com.hmmselect.server.ai.hmm;

import com.hmmselect.server.ai.FlattenedSequences;

public class MathUtil {

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    /**
     * Computes log(sum(exp(x_i))) using the "max trick" for numerical stability:
     * logSumExp(x) = max(x) + log(sum(exp(x_i - max(x))))
     * Returns negative infinity if every entry is negative infinity.
     */
    public static double logSumExp(double[] x) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : x) {
            if (v > max)
                max = v;
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return Double.NEGATIVE_INFINITY;
        }

        double sum = 0.0;
        for (double v : x) {
            sum += Math.exp(v - max);
        }
        return max + Math.log(sum);
    }

    /**
     * Log density of a diagonal-covariance Gaussian at frame {@code row} of {@code data}.
     */
    public static double logGaussianDiag(FlattenedSequences data, int row, double[] mean, double[] var) {
        double logP = 0.0;
        for (int d = 0; d < mean.length; d++) {
            double diff = data.get(row, d) - mean[d];
            logP -= 0.5 * (LOG_2PI + Math.log(var[d]) + diff * diff / var[d]);
        }
        return logP;
    }

    /**
     * Natural log that maps 0 to negative infinity instead of producing NaN for tiny negatives.
     */
    public static double safeLog(double p) {
        return p > 0.0 ? Math.log(p) : Double.NEGATIVE_INFINITY;
    }

    /**
     * Squared Euclidean distance between frame {@code row} of {@code data} and {@code centre}.
     */
    public static double squaredDistance(FlattenedSequences data, int row, double[] centre) {
        if (data.dimension() != centre.length) {
            throw new IllegalArgumentException("Arrays must have same length");
        }
        double sum = 0.0;
        for (int i = 0; i < centre.length; i++) {
            double delta = data.get(row, i) - centre[i];
            sum += delta * delta;
        }
        return sum;
    }
}
