package com.hmmselect.server.ai;

/**
 * Thrown when a word has fewer sequences than the requested number of folds.
 */
public class InsufficientDataException extends Exception {
    private final int numSamples;
    private final int numFolds;

    public InsufficientDataException(int numSamples, int numFolds) {
        super("Cannot split " + numSamples + " sequences into " + numFolds + " folds");
        this.numSamples = numSamples;
        this.numFolds = numFolds;
    }

    public int getNumSamples() {
        return numSamples;
    }

    public int getNumFolds() {
        return numFolds;
    }
}
