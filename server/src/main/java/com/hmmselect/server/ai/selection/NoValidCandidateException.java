package com.hmmselect.server.ai.selection;

/**
 * No candidate state count produced a model, including the constant fallback.
 */
public class NoValidCandidateException extends RuntimeException {
    private final String word;

    public NoValidCandidateException(String word, FitOutcome fallbackOutcome) {
        super("No valid model for '" + word + "': fallback with " + fallbackOutcome.getNumStates()
                + " states failed (" + fallbackOutcome.getFailureKind() + ": " + fallbackOutcome.getMessage() + ")");
        this.word = word;
    }

    public String getWord() {
        return word;
    }
}
