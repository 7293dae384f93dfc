package com.hmmselect.server.ai.hmm;

/**
 * A model could not be fitted or could not score data.
 */
public class ModelFitException extends Exception {
    private final int numStates;

    public ModelFitException(int numStates, String message) {
        super(message);
        this.numStates = numStates;
    }

    public int getNumStates() {
        return numStates;
    }
}
