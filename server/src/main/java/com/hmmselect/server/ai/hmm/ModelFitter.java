package com.hmmselect.server.ai.hmm;

import com.hmmselect.server.ai.FlattenedSequences;

public interface ModelFitter {
    /**
     * Fits a model with {@code numStates} hidden states. Must be deterministic for a given seed.
     *
     * @throws ModelFitException on non-convergence or numerical failure; no partial model is returned
     */
    CandidateModel fit(FlattenedSequences data, int numStates, long seed) throws ModelFitException;
}
