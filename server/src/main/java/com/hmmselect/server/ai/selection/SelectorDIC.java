package com.hmmselect.server.ai.selection;

import com.hmmselect.server.ai.SelectorConfig;
import com.hmmselect.server.ai.SequenceCorpus;
import com.hmmselect.server.ai.hmm.CandidateModel;
import com.hmmselect.server.ai.hmm.ModelFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Selects the model with the highest Discriminative Information Criterion
 * (Biem, "A model selection criterion for classification: Application to HMM topology
 * optimization", ICDAR 2003):
 * DIC = log P(X(i)) - 1/(M-1) * SUM log P(X(all but i))
 * Each other word is fitted at the same state count and scored on its own data; words
 * whose fit or score fails are left out of both the sum and M.
 */
public class SelectorDIC extends ModelSelector {

    private static final Logger logger = LoggerFactory.getLogger(SelectorDIC.class);

    public SelectorDIC(SequenceCorpus corpus, String word, SelectorConfig config, ModelFitter fitter) {
        super(corpus, word, config, fitter);
    }

    @Override
    public String getName() {
        return "dic";
    }

    /**
     * @param otherCount number of other words that contributed to {@code otherSum}, i.e. M-1
     */
    public static double dic(double ownLogL, double otherSum, int otherCount) {
        if (otherCount < 1) {
            throw new IllegalArgumentException("At least one other word is required, got " + otherCount);
        }
        return ownLogL - otherSum / otherCount;
    }

    @Override
    public SelectionResult selectWithDetails() {
        Map<Integer, Double> scores = new LinkedHashMap<>();
        Map<Integer, FitOutcome.FailureKind> failures = new LinkedHashMap<>();
        CandidateModel best = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (int n = config.minComponents; n <= config.maxComponents; n++) {
            FitOutcome own = baseModel(n);
            if (!own.isSuccess()) {
                failures.put(n, own.getFailureKind());
                continue;
            }
            OptionalDouble ownLogL = score(own.getModel(), data, word);
            if (ownLogL.isEmpty()) {
                failures.put(n, FitOutcome.FailureKind.FIT_FAILURE);
                continue;
            }

            double otherSum = 0.0;
            int otherCount = 0;
            for (String other : corpus.getWords()) {
                if (other.equals(word)) {
                    continue;
                }
                FitOutcome otherFit = fitModel(corpus.getFlattened(other), other, n);
                if (!otherFit.isSuccess()) {
                    continue;
                }
                OptionalDouble otherLogL = score(otherFit.getModel(), corpus.getFlattened(other), other);
                if (otherLogL.isPresent()) {
                    otherSum += otherLogL.getAsDouble();
                    otherCount++;
                }
            }

            if (otherCount < 1) {
                logger.debug("Skipping n={} for '{}': no other word could be scored", n, word);
                // a corpus without other words can never score, unlike one whose other fits failed
                failures.put(n, corpus.size() < 2
                        ? FitOutcome.FailureKind.INSUFFICIENT_DATA
                        : FitOutcome.FailureKind.FIT_FAILURE);
                continue;
            }

            double dic = dic(ownLogL.getAsDouble(), otherSum, otherCount);
            scores.put(n, dic);
            if (dic > bestScore) {
                bestScore = dic;
                best = own.getModel();
            }
        }

        if (best == null) {
            return fallback(scores, failures);
        }
        return done(best, bestScore, scores, failures);
    }
}
