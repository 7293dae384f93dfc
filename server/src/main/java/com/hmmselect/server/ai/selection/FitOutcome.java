package com.hmmselect.server.ai.selection;

import com.hmmselect.server.ai.hmm.CandidateModel;

/**
 * Result of one fitting attempt: either a model or a typed failure.
 */
public final class FitOutcome {

    public enum FailureKind {
        FIT_FAILURE,
        INSUFFICIENT_DATA
    }

    private final int numStates;
    private final CandidateModel model;
    private final FailureKind failureKind;
    private final String message;

    private FitOutcome(int numStates, CandidateModel model, FailureKind failureKind, String message) {
        this.numStates = numStates;
        this.model = model;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static FitOutcome success(CandidateModel model) {
        return new FitOutcome(model.getNumStates(), model, null, null);
    }

    public static FitOutcome failure(int numStates, FailureKind kind, String message) {
        return new FitOutcome(numStates, null, kind, message);
    }

    public boolean isSuccess() {
        return model != null;
    }

    public int getNumStates() {
        return numStates;
    }

    /**
     * @throws IllegalStateException if this outcome is a failure
     */
    public CandidateModel getModel() {
        if (model == null) {
            throw new IllegalStateException("No model for " + numStates + " states: " + message);
        }
        return model;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "FitOutcome{success, states=" + numStates + '}'
                : "FitOutcome{" + failureKind + ", states=" + numStates + ", message='" + message + "'}";
    }
}
