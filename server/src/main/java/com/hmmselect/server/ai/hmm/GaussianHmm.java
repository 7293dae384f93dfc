package com.hmmselect.server.ai.hmm;

import com.hmmselect.server.ai.FlattenedSequences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Hidden Markov model with one diagonal-covariance Gaussian emission per state.
 * Parameters are updated in place by {@link #emStep}; scoring uses the log-space forward pass.
 */
public class GaussianHmm implements CandidateModel {
    private static final Logger logger = LoggerFactory.getLogger(GaussianHmm.class);
    private static final double MIN_OCCUPANCY = 1e-10;

    private final int numStates;
    private final int dimension;

    // [state]
    private final double[] startProbs;
    // [prevState][nextState]
    private final double[][] transProbs;
    // [state][feature]
    private final double[][] means;
    // [state][feature]
    private final double[][] variances;

    private int iterations;
    private boolean converged;
    private double trainingLogLikelihood = Double.NaN;

    public GaussianHmm(double[] startProbs, double[][] transProbs, double[][] means, double[][] variances) {
        this.numStates = startProbs.length;
        if (transProbs.length != numStates || means.length != numStates || variances.length != numStates) {
            throw new IllegalArgumentException("All parameter arrays must have one entry per state");
        }
        this.dimension = means[0].length;
        this.startProbs = Arrays.copyOf(startProbs, numStates);
        this.transProbs = deepCopy(transProbs);
        this.means = deepCopy(means);
        this.variances = deepCopy(variances);
    }

    private static double[][] deepCopy(double[][] src) {
        double[][] dst = new double[src.length][];
        for (int i = 0; i < src.length; i++) {
            dst[i] = Arrays.copyOf(src[i], src[i].length);
        }
        return dst;
    }

    @Override
    public int getNumStates() {
        return numStates;
    }

    public int getDimension() {
        return dimension;
    }

    public double[] getStartProbs() {
        return Arrays.copyOf(startProbs, numStates);
    }

    public double[][] getTransProbs() {
        return deepCopy(transProbs);
    }

    public double[][] getMeans() {
        return deepCopy(means);
    }

    public double[][] getVariances() {
        return deepCopy(variances);
    }

    public int getIterations() {
        return iterations;
    }

    public boolean isConverged() {
        return converged;
    }

    public double getTrainingLogLikelihood() {
        return trainingLogLikelihood;
    }

    void recordTraining(int iterations, boolean converged, double logLikelihood) {
        this.iterations = iterations;
        this.converged = converged;
        this.trainingLogLikelihood = logLikelihood;
    }

    @Override
    public double score(FlattenedSequences data) throws ModelFitException {
        if (data.dimension() != dimension) {
            throw new ModelFitException(numStates,
                    "Data has " + data.dimension() + " features, model expects " + dimension);
        }
        double[] logStart = logOf(startProbs);
        double[][] logTrans = logOf(transProbs);

        double total = 0.0;
        int offset = 0;
        for (int s = 0; s < data.numSequences(); s++) {
            int len = data.length(s);
            double[][] logB = emissionLogProbs(data, offset, len);
            total += forward(logB, logStart, logTrans, new double[len][numStates]);
            offset += len;
        }

        if (!Double.isFinite(total)) {
            throw new ModelFitException(numStates, "Log-likelihood is not finite: " + total);
        }
        return total;
    }

    /**
     * One Baum-Welch iteration: computes posteriors under the current parameters, then
     * re-estimates them.
     *
     * @return log-likelihood of {@code data} under the parameters before the update
     */
    double emStep(FlattenedSequences data, double minCovar) {
        double[] logStart = logOf(startProbs);
        double[][] logTrans = logOf(transProbs);

        double[] startAcc = new double[numStates];
        double[][] transAcc = new double[numStates][numStates];
        double[] occupancy = new double[numStates];
        double[][] meanAcc = new double[numStates][dimension];
        double[][] sqAcc = new double[numStates][dimension];

        double total = 0.0;
        int offset = 0;
        for (int s = 0; s < data.numSequences(); s++) {
            int len = data.length(s);
            double[][] logB = emissionLogProbs(data, offset, len);
            double[][] logAlpha = new double[len][numStates];
            double logL = forward(logB, logStart, logTrans, logAlpha);
            if (!Double.isFinite(logL)) {
                return logL;
            }
            double[][] logBeta = backward(logB, logTrans);

            for (int t = 0; t < len; t++) {
                for (int i = 0; i < numStates; i++) {
                    double gamma = Math.exp(logAlpha[t][i] + logBeta[t][i] - logL);
                    if (t == 0) {
                        startAcc[i] += gamma;
                    }
                    occupancy[i] += gamma;
                    for (int d = 0; d < dimension; d++) {
                        double x = data.get(offset + t, d);
                        meanAcc[i][d] += gamma * x;
                        sqAcc[i][d] += gamma * x * x;
                    }
                }
            }

            for (int t = 0; t < len - 1; t++) {
                for (int i = 0; i < numStates; i++) {
                    for (int j = 0; j < numStates; j++) {
                        transAcc[i][j] += Math.exp(logAlpha[t][i] + logTrans[i][j] + logB[t + 1][j]
                                + logBeta[t + 1][j] - logL);
                    }
                }
            }

            total += logL;
            offset += len;
        }

        double startSum = 0.0;
        for (double v : startAcc) {
            startSum += v;
        }
        for (int i = 0; i < numStates; i++) {
            startProbs[i] = startAcc[i] / startSum;
        }

        for (int i = 0; i < numStates; i++) {
            double rowSum = 0.0;
            for (int j = 0; j < numStates; j++) {
                rowSum += transAcc[i][j];
            }
            // rows of states never left keep their previous distribution
            if (rowSum > 0.0) {
                for (int j = 0; j < numStates; j++) {
                    transProbs[i][j] = transAcc[i][j] / rowSum;
                }
            }
        }

        for (int i = 0; i < numStates; i++) {
            if (occupancy[i] < MIN_OCCUPANCY) {
                logger.trace("State {} has no occupancy, keeping its emission parameters", i);
                continue;
            }
            for (int d = 0; d < dimension; d++) {
                double mean = meanAcc[i][d] / occupancy[i];
                double var = sqAcc[i][d] / occupancy[i] - mean * mean;
                means[i][d] = mean;
                variances[i][d] = Math.max(var, 0.0) + minCovar;
            }
        }
        return total;
    }

    private double[][] emissionLogProbs(FlattenedSequences data, int offset, int len) {
        double[][] logB = new double[len][numStates];
        for (int t = 0; t < len; t++) {
            for (int i = 0; i < numStates; i++) {
                logB[t][i] = MathUtil.logGaussianDiag(data, offset + t, means[i], variances[i]);
            }
        }
        return logB;
    }

    private double forward(double[][] logB, double[] logStart, double[][] logTrans, double[][] logAlpha) {
        int len = logB.length;
        for (int i = 0; i < numStates; i++) {
            logAlpha[0][i] = logStart[i] + logB[0][i];
        }
        double[] work = new double[numStates];
        for (int t = 1; t < len; t++) {
            for (int j = 0; j < numStates; j++) {
                for (int i = 0; i < numStates; i++) {
                    work[i] = logAlpha[t - 1][i] + logTrans[i][j];
                }
                logAlpha[t][j] = MathUtil.logSumExp(work) + logB[t][j];
            }
        }
        return MathUtil.logSumExp(logAlpha[len - 1]);
    }

    private double[][] backward(double[][] logB, double[][] logTrans) {
        int len = logB.length;
        double[][] logBeta = new double[len][numStates];
        double[] work = new double[numStates];
        for (int t = len - 2; t >= 0; t--) {
            for (int i = 0; i < numStates; i++) {
                for (int j = 0; j < numStates; j++) {
                    work[j] = logTrans[i][j] + logB[t + 1][j] + logBeta[t + 1][j];
                }
                logBeta[t][i] = MathUtil.logSumExp(work);
            }
        }
        return logBeta;
    }

    private static double[] logOf(double[] p) {
        double[] out = new double[p.length];
        for (int i = 0; i < p.length; i++) {
            out[i] = MathUtil.safeLog(p[i]);
        }
        return out;
    }

    private static double[][] logOf(double[][] p) {
        double[][] out = new double[p.length][];
        for (int i = 0; i < p.length; i++) {
            out[i] = logOf(p[i]);
        }
        return out;
    }
}
