package com.hmmselect.server.ai.hmm;

import com.hmmselect.server.ai.FlattenedSequences;
import com.hmmselect.server.ai.SelectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Random;

/**
 * Fits {@link GaussianHmm}s with Baum-Welch. State means are seeded by k-means on the
 * frames, variances start at the global per-feature variance, start and transition
 * probabilities start uniform.
 */
public class GaussianHmmFitter implements ModelFitter {
    private static final Logger logger = LoggerFactory.getLogger(GaussianHmmFitter.class);
    private static final int KMEANS_ITERATIONS = 20;

    private final int maxIterations;
    private final double tolerance;
    private final double minCovar;
    private final boolean requireConvergence;

    public GaussianHmmFitter(int maxIterations, double tolerance, double minCovar, boolean requireConvergence) {
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.minCovar = minCovar;
        this.requireConvergence = requireConvergence;
    }

    public GaussianHmmFitter(SelectorConfig config) {
        this(config.maxIterations, config.tolerance, config.minCovar, false);
    }

    @Override
    public GaussianHmm fit(FlattenedSequences data, int numStates, long seed) throws ModelFitException {
        if (numStates < 1) {
            throw new ModelFitException(numStates, "Number of states must be positive");
        }
        if (data.totalFrames() < numStates) {
            throw new ModelFitException(numStates,
                    "Need at least " + numStates + " frames to seed " + numStates + " states, got "
                            + data.totalFrames());
        }

        Random rng = new Random(seed);
        int dim = data.dimension();

        double[] start = new double[numStates];
        Arrays.fill(start, 1.0 / numStates);
        double[][] trans = new double[numStates][numStates];
        for (double[] row : trans) {
            Arrays.fill(row, 1.0 / numStates);
        }
        double[][] means = kMeans(data, numStates, rng);
        double[] globalVar = globalVariance(data);
        double[][] vars = new double[numStates][];
        for (int i = 0; i < numStates; i++) {
            vars[i] = Arrays.copyOf(globalVar, dim);
        }

        GaussianHmm hmm = new GaussianHmm(start, trans, means, vars);

        double prevLogL = Double.NEGATIVE_INFINITY;
        double logL = Double.NEGATIVE_INFINITY;
        boolean converged = false;
        int iter = 0;
        while (iter < maxIterations) {
            logL = hmm.emStep(data, minCovar);
            iter++;
            if (!Double.isFinite(logL)) {
                throw new ModelFitException(numStates, "Log-likelihood became " + logL + " at iteration " + iter);
            }
            logger.trace("n={} iteration {} logL={}", numStates, iter, logL);
            if (iter > 1 && logL - prevLogL < tolerance) {
                converged = true;
                break;
            }
            prevLogL = logL;
        }

        if (!converged) {
            if (requireConvergence) {
                throw new ModelFitException(numStates,
                        "Did not converge within " + maxIterations + " iterations");
            }
            logger.debug("n={} stopped after {} iterations without converging (logL={})", numStates, iter, logL);
        }
        hmm.recordTraining(iter, converged, logL);
        logger.debug("n={} fitted on {} frames: iterations={}, converged={}, logL={}", numStates,
                data.totalFrames(), hmm.getIterations(), hmm.isConverged(), hmm.getTrainingLogLikelihood());
        return hmm;
    }

    /**
     * k-means++ seeding followed by Lloyd iterations. Empty clusters keep their centre.
     */
    private static double[][] kMeans(FlattenedSequences data, int k, Random rng) {
        int n = data.totalFrames();
        double[][] centres = new double[k][];
        centres[0] = data.getRow(rng.nextInt(n));

        double[] dist = new double[n];
        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (int r = 0; r < n; r++) {
                double best = Double.MAX_VALUE;
                for (int j = 0; j < c; j++) {
                    best = Math.min(best, MathUtil.squaredDistance(data, r, centres[j]));
                }
                dist[r] = best;
                total += best;
            }
            int pick;
            if (total <= 0.0) {
                // all frames coincide with existing centres
                pick = rng.nextInt(n);
            } else {
                double target = rng.nextDouble() * total;
                pick = n - 1;
                double cum = 0.0;
                for (int r = 0; r < n; r++) {
                    cum += dist[r];
                    if (cum >= target) {
                        pick = r;
                        break;
                    }
                }
            }
            centres[c] = data.getRow(pick);
        }

        int dim = data.dimension();
        int[] assignment = new int[n];
        for (int iter = 0; iter < KMEANS_ITERATIONS; iter++) {
            boolean changed = false;
            for (int r = 0; r < n; r++) {
                int best = 0;
                double bestDist = Double.MAX_VALUE;
                for (int c = 0; c < k; c++) {
                    double d = MathUtil.squaredDistance(data, r, centres[c]);
                    if (d < bestDist) {
                        bestDist = d;
                        best = c;
                    }
                }
                if (iter == 0 || assignment[r] != best) {
                    changed = true;
                }
                assignment[r] = best;
            }
            if (!changed) {
                break;
            }

            double[][] sums = new double[k][dim];
            int[] counts = new int[k];
            for (int r = 0; r < n; r++) {
                counts[assignment[r]]++;
                for (int d = 0; d < dim; d++) {
                    sums[assignment[r]][d] += data.get(r, d);
                }
            }
            for (int c = 0; c < k; c++) {
                if (counts[c] == 0) {
                    continue;
                }
                for (int d = 0; d < dim; d++) {
                    centres[c][d] = sums[c][d] / counts[c];
                }
            }
        }
        return centres;
    }

    private double[] globalVariance(FlattenedSequences data) {
        int n = data.totalFrames();
        int dim = data.dimension();
        double[] mean = new double[dim];
        double[] sq = new double[dim];
        for (int r = 0; r < n; r++) {
            for (int d = 0; d < dim; d++) {
                double x = data.get(r, d);
                mean[d] += x;
                sq[d] += x * x;
            }
        }
        double[] var = new double[dim];
        for (int d = 0; d < dim; d++) {
            mean[d] /= n;
            var[d] = Math.max(sq[d] / n - mean[d] * mean[d], 0.0) + minCovar;
        }
        return var;
    }
}
