package com.hmmselect.server.ai.hmm;

import com.hmmselect.server.ai.FlattenedSequences;

/**
 * A fitted generative sequence model for one word at one hidden-state count.
 */
public interface CandidateModel {
    int getNumStates();

    /**
     * Total log-likelihood of the given sequences under this model.
     *
     * @throws ModelFitException if the likelihood cannot be computed
     */
    double score(FlattenedSequences data) throws ModelFitException;
}
