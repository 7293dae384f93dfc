package com.hmmselect.server.ai.selection;

import com.hmmselect.server.ai.hmm.CandidateModel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class SelectionResult {
    private final String word;
    private final String selectorName;
    private final CandidateModel model;
    private final double score;
    private final boolean fallback;
    // state count -> score, only for candidates that produced one
    private final Map<Integer, Double> candidateScores;
    // state count -> why the candidate produced no score
    private final Map<Integer, FitOutcome.FailureKind> candidateFailures;

    public SelectionResult(String word, String selectorName, CandidateModel model, double score, boolean fallback,
            Map<Integer, Double> candidateScores, Map<Integer, FitOutcome.FailureKind> candidateFailures) {
        this.word = word;
        this.selectorName = selectorName;
        this.model = model;
        this.score = score;
        this.fallback = fallback;
        this.candidateScores = Collections.unmodifiableMap(new LinkedHashMap<>(candidateScores));
        this.candidateFailures = Collections.unmodifiableMap(new LinkedHashMap<>(candidateFailures));
    }

    public String getWord() {
        return word;
    }

    public String getSelectorName() {
        return selectorName;
    }

    public CandidateModel getModel() {
        return model;
    }

    public int getNumStates() {
        return model.getNumStates();
    }

    /**
     * Score of the winning candidate, NaN for the constant selector and for fallbacks.
     */
    public double getScore() {
        return score;
    }

    public boolean isFallback() {
        return fallback;
    }

    public Map<Integer, Double> getCandidateScores() {
        return candidateScores;
    }

    public Map<Integer, FitOutcome.FailureKind> getCandidateFailures() {
        return candidateFailures;
    }

    @Override
    public String toString() {
        return "SelectionResult{" +
                "word='" + word + '\'' +
                ", selector=" + selectorName +
                ", states=" + model.getNumStates() +
                ", score=" + (Double.isNaN(score) ? "N/A" : String.format("%.4f", score)) +
                ", fallback=" + fallback +
                ", failures=" + candidateFailures +
                '}';
    }
}
