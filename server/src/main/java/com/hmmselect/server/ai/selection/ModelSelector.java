package com.hmmselect.server.ai.selection;

import com.hmmselect.server.ai.FeatureSequence;
import com.hmmselect.server.ai.FlattenedSequences;
import com.hmmselect.server.ai.SelectorConfig;
import com.hmmselect.server.ai.SequenceCorpus;
import com.hmmselect.server.ai.hmm.CandidateModel;
import com.hmmselect.server.ai.hmm.ModelFitException;
import com.hmmselect.server.ai.hmm.ModelFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Chooses the hidden-state count for one word. Subclasses sweep
 * {@code [minComponents, maxComponents]} with their own scoring rule and fall back to
 * {@code nConstant} states when no candidate scores.
 */
public abstract class ModelSelector {

    private static final Logger logger = LoggerFactory.getLogger(ModelSelector.class);

    protected final SequenceCorpus corpus;
    protected final String word;
    protected final List<FeatureSequence> sequences;
    protected final FlattenedSequences data;
    protected final SelectorConfig config;
    private final ModelFitter fitter;

    protected ModelSelector(SequenceCorpus corpus, String word, SelectorConfig config, ModelFitter fitter) {
        if (!corpus.contains(word)) {
            throw new IllegalArgumentException("Word '" + word + "' is not in the corpus");
        }
        config.validate();
        this.corpus = corpus;
        this.word = word;
        this.sequences = corpus.getSequences(word);
        this.data = corpus.getFlattened(word);
        this.config = config.copy();
        this.fitter = fitter;
    }

    public abstract String getName();

    /**
     * Runs the sweep and reports the winning model with the scores that led to it.
     *
     * @throws NoValidCandidateException if even the constant fallback cannot be fitted
     */
    public abstract SelectionResult selectWithDetails();

    /**
     * @return the selected model, never null
     */
    public CandidateModel select() {
        return selectWithDetails().getModel();
    }

    public String getWord() {
        return word;
    }

    /**
     * Fits this word's own data with {@code numStates} states.
     */
    public FitOutcome baseModel(int numStates) {
        return fitModel(data, word, numStates);
    }

    /**
     * The single entry point into the fitter. Failures come back as outcomes.
     */
    protected FitOutcome fitModel(FlattenedSequences trainingData, String label, int numStates) {
        try {
            CandidateModel model = fitter.fit(trainingData, numStates, config.randomSeed);
            logFit("model created for {} with {} states", label, numStates);
            return FitOutcome.success(model);
        } catch (ModelFitException e) {
            logFit("failure on {} with {} states: {}", label, numStates, e.getMessage());
            return FitOutcome.failure(numStates, FitOutcome.FailureKind.FIT_FAILURE, e.getMessage());
        }
    }

    /**
     * Log-likelihood of {@code scoredData}, or empty if the model cannot score it.
     */
    protected OptionalDouble score(CandidateModel model, FlattenedSequences scoredData, String label) {
        try {
            return OptionalDouble.of(model.score(scoredData));
        } catch (ModelFitException e) {
            logFit("scoring failed on {} with {} states: {}", label, model.getNumStates(), e.getMessage());
            return OptionalDouble.empty();
        }
    }

    /**
     * Falls back to the constant state count.
     *
     * @throws NoValidCandidateException if that fit fails as well
     */
    protected SelectionResult fallback(Map<Integer, Double> candidateScores,
            Map<Integer, FitOutcome.FailureKind> candidateFailures) {
        logger.info("No candidate in [{}, {}] scored for '{}' using {}, falling back to {} states",
                config.minComponents, config.maxComponents, word, getName(), config.nConstant);
        FitOutcome outcome = baseModel(config.nConstant);
        if (!outcome.isSuccess()) {
            throw new NoValidCandidateException(word, outcome);
        }
        return new SelectionResult(word, getName(), outcome.getModel(), Double.NaN, true, candidateScores,
                candidateFailures);
    }

    protected SelectionResult done(CandidateModel best, double bestScore, Map<Integer, Double> candidateScores,
            Map<Integer, FitOutcome.FailureKind> candidateFailures) {
        logger.debug("Selected {} states for '{}' using {} (score={})", best.getNumStates(), word, getName(),
                bestScore);
        return new SelectionResult(word, getName(), best, bestScore, false, candidateScores,
                candidateFailures);
    }

    protected void logFit(String format, Object... args) {
        if (config.verbose) {
            logger.info(format, args);
        } else {
            logger.debug(format, args);
        }
    }
}
