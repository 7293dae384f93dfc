package com.hmmselect.server.ai.selection;

import com.hmmselect.server.ai.FlattenedSequences;
import com.hmmselect.server.ai.InsufficientDataException;
import com.hmmselect.server.ai.KFoldSplitter;
import com.hmmselect.server.ai.SelectorConfig;
import com.hmmselect.server.ai.SequenceCombiner;
import com.hmmselect.server.ai.SequenceCorpus;
import com.hmmselect.server.ai.hmm.ModelFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Selects the state count with the best average held-out log-likelihood over k folds of
 * the word's sequences, then refits that count on all of them.
 */
public class SelectorCV extends ModelSelector {

    private static final Logger logger = LoggerFactory.getLogger(SelectorCV.class);

    private final KFoldSplitter splitter;

    public SelectorCV(SequenceCorpus corpus, String word, SelectorConfig config, ModelFitter fitter) {
        super(corpus, word, config, fitter);
        this.splitter = new KFoldSplitter(config.cvFolds);
    }

    @Override
    public String getName() {
        return "cv";
    }

    @Override
    public SelectionResult selectWithDetails() {
        Map<Integer, Double> scores = new LinkedHashMap<>();
        Map<Integer, FitOutcome.FailureKind> failures = new LinkedHashMap<>();
        int bestStates = -1;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (int n = config.minComponents; n <= config.maxComponents; n++) {
            List<KFoldSplitter.Fold> folds;
            try {
                folds = splitter.split(sequences.size());
            } catch (InsufficientDataException e) {
                FitOutcome failure = FitOutcome.failure(n, FitOutcome.FailureKind.INSUFFICIENT_DATA,
                        e.getMessage());
                logFit("skipping {} for '{}'", failure, word);
                failures.put(n, failure.getFailureKind());
                continue;
            }

            OptionalDouble avg = crossValidate(folds, n);
            if (avg.isEmpty()) {
                logger.debug("No fold produced a score for '{}' with {} states", word, n);
                failures.put(n, FitOutcome.FailureKind.FIT_FAILURE);
                continue;
            }

            scores.put(n, avg.getAsDouble());
            if (avg.getAsDouble() > bestScore) {
                bestScore = avg.getAsDouble();
                bestStates = n;
            }
        }

        if (bestStates < 0) {
            return fallback(scores, failures);
        }

        FitOutcome refit = baseModel(bestStates);
        if (!refit.isSuccess()) {
            logger.warn("Refit of '{}' with {} states on all sequences failed: {}", word, bestStates,
                    refit.getMessage());
            failures.put(bestStates, refit.getFailureKind());
            return fallback(scores, failures);
        }
        return done(refit.getModel(), bestScore, scores, failures);
    }

    /**
     * Mean held-out log-likelihood over the folds that could be fitted and scored.
     */
    private OptionalDouble crossValidate(List<KFoldSplitter.Fold> folds, int numStates) {
        double sum = 0.0;
        int count = 0;
        for (KFoldSplitter.Fold fold : folds) {
            FlattenedSequences train = SequenceCombiner.combine(fold.getTrainIndices(), sequences);
            FlattenedSequences test = SequenceCombiner.combine(fold.getTestIndices(), sequences);

            FitOutcome outcome = fitModel(train, word, numStates);
            if (!outcome.isSuccess()) {
                continue;
            }
            OptionalDouble logL = score(outcome.getModel(), test, word);
            if (logL.isPresent()) {
                sum += logL.getAsDouble();
                count++;
            }
        }
        return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / count);
    }
}
