package com.hmmselect.server.ai.selection;

import com.hmmselect.server.ai.SelectorConfig;
import com.hmmselect.server.ai.SequenceCorpus;
import com.hmmselect.server.ai.hmm.ModelFitter;

import java.util.Collections;

/**
 * Always uses {@code nConstant} states. There is nothing beneath it to fall back to.
 */
public class SelectorConstant extends ModelSelector {

    public SelectorConstant(SequenceCorpus corpus, String word, SelectorConfig config, ModelFitter fitter) {
        super(corpus, word, config, fitter);
    }

    @Override
    public String getName() {
        return "constant";
    }

    @Override
    public SelectionResult selectWithDetails() {
        FitOutcome outcome = baseModel(config.nConstant);
        if (!outcome.isSuccess()) {
            throw new NoValidCandidateException(word, outcome);
        }
        return new SelectionResult(word, getName(), outcome.getModel(), Double.NaN, false,
                Collections.emptyMap(), Collections.emptyMap());
    }
}
