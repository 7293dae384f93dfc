package com.hmmselect.server.ai.selection;

import com.hmmselect.server.ai.SelectorConfig;
import com.hmmselect.server.ai.SequenceCorpus;
import com.hmmselect.server.ai.hmm.ModelFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ModelSelectorFactory {

    private static final Logger logger = LoggerFactory.getLogger(ModelSelectorFactory.class);
    private static final String DEFAULT_SELECTOR = "bic";

    public static ModelSelector create(SelectorConfig config, SequenceCorpus corpus, String word,
            ModelFitter fitter) {
        String selector = config.selector;

        // Default to BIC if missing or invalid
        if (selector == null || selector.trim().isEmpty()) {
            logger.warn("Selector not specified, defaulting to '{}'", DEFAULT_SELECTOR);
            selector = DEFAULT_SELECTOR;
        }

        switch (selector.trim().toLowerCase()) {
            case "constant":
                return new SelectorConstant(corpus, word, config, fitter);
            case "bic":
                return new SelectorBIC(corpus, word, config, fitter);
            case "dic":
                return new SelectorDIC(corpus, word, config, fitter);
            case "cv":
                return new SelectorCV(corpus, word, config, fitter);
            default:
                logger.warn("Unknown selector '{}', defaulting to '{}'", selector, DEFAULT_SELECTOR);
                return new SelectorBIC(corpus, word, config, fitter);
        }
    }

    public static ModelSelector create(String selector, SelectorConfig base, SequenceCorpus corpus, String word,
            ModelFitter fitter) {
        SelectorConfig cfg = base.copy();
        cfg.selector = selector;
        return create(cfg, corpus, word, fitter);
    }
}
