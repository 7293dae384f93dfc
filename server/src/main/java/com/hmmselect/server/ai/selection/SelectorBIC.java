package com.hmmselect.server.ai.selection;

import com.hmmselect.server.ai.SelectorConfig;
import com.hmmselect.server.ai.SequenceCorpus;
import com.hmmselect.server.ai.hmm.CandidateModel;
import com.hmmselect.server.ai.hmm.ModelFitter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Selects the model with the lowest Bayesian Information Criterion:
 * BIC = -2 * logL + p * log(N), where N is the number of frames and
 * p = n*(n-1) + 2*D*n counts transition, mean and variance parameters.
 */
public class SelectorBIC extends ModelSelector {

    public SelectorBIC(SequenceCorpus corpus, String word, SelectorConfig config, ModelFitter fitter) {
        super(corpus, word, config, fitter);
    }

    @Override
    public String getName() {
        return "bic";
    }

    public static int freeParameters(int numStates, int dimension) {
        return numStates * (numStates - 1) + 2 * dimension * numStates;
    }

    public static double bic(double logL, int numStates, int dimension, int numFrames) {
        return -2.0 * logL + freeParameters(numStates, dimension) * Math.log(numFrames);
    }

    @Override
    public SelectionResult selectWithDetails() {
        Map<Integer, Double> scores = new LinkedHashMap<>();
        Map<Integer, FitOutcome.FailureKind> failures = new LinkedHashMap<>();
        CandidateModel best = null;
        double bestScore = Double.POSITIVE_INFINITY;

        for (int n = config.minComponents; n <= config.maxComponents; n++) {
            FitOutcome outcome = baseModel(n);
            if (!outcome.isSuccess()) {
                failures.put(n, outcome.getFailureKind());
                continue;
            }
            OptionalDouble logL = score(outcome.getModel(), data, word);
            if (logL.isEmpty()) {
                failures.put(n, FitOutcome.FailureKind.FIT_FAILURE);
                continue;
            }

            double bic = bic(logL.getAsDouble(), n, data.dimension(), data.totalFrames());
            scores.put(n, bic);
            // strict comparison keeps the smaller model on ties
            if (bic < bestScore) {
                bestScore = bic;
                best = outcome.getModel();
            }
        }

        if (best == null) {
            return fallback(scores, failures);
        }
        return done(best, bestScore, scores, failures);
    }
}
