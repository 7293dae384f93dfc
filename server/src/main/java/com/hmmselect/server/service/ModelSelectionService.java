package com.hmmselect.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hmmselect.server.ai.SelectorConfig;
import com.hmmselect.server.ai.SequenceCorpus;
import com.hmmselect.server.ai.hmm.GaussianHmmFitter;
import com.hmmselect.server.ai.hmm.ModelFitter;
import com.hmmselect.server.ai.selection.ModelSelector;
import com.hmmselect.server.ai.selection.ModelSelectorFactory;
import com.hmmselect.server.ai.selection.SelectionResult;
import com.hmmselect.server.util.ConfigPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs model selection for the words of a corpus with the configured selector.
 */
@Service
public class ModelSelectionService {

    private static final Logger logger = LoggerFactory.getLogger(ModelSelectionService.class);

    private final SelectorConfig config;
    private final ModelFitter fitter;

    public ModelSelectionService() {
        this(loadConfigOrDefault());
    }

    public ModelSelectionService(SelectorConfig config) {
        this(config, new GaussianHmmFitter(config));
    }

    public ModelSelectionService(SelectorConfig config, ModelFitter fitter) {
        config.validate();
        this.config = config.copy();
        this.fitter = fitter;
        logger.info("Model selection configured: selector={}, states=[{}, {}], nConstant={}, seed={}",
                config.selector, config.minComponents, config.maxComponents, config.nConstant, config.randomSeed);
    }

    public static SelectorConfig loadConfigOrDefault() {
        try (InputStream is = ConfigPathResolver.openSelectorConfig()) {
            if (is != null) {
                SelectorConfig loaded = new ObjectMapper().readValue(is, SelectorConfig.class);
                loaded.validate();
                return loaded;
            }
            logger.info("No selector config found, using defaults");
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Failed to load selector config, using defaults", e);
        }
        return SelectorConfig.defaults();
    }

    public SelectorConfig getConfig() {
        return config.copy();
    }

    public SelectionResult selectWord(SequenceCorpus corpus, String word) {
        return selectWord(corpus, word, config.selector);
    }

    public SelectionResult selectWord(SequenceCorpus corpus, String word, String selector) {
        ModelSelector modelSelector = ModelSelectorFactory.create(selector, config, corpus, word, fitter);
        SelectionResult result = modelSelector.selectWithDetails();
        logger.debug("{}", result);
        return result;
    }

    public Map<String, SelectionResult> selectAll(SequenceCorpus corpus) {
        return selectAll(corpus, config.selector);
    }

    /**
     * Selects a model for every word, in corpus order.
     *
     * @throws com.hmmselect.server.ai.selection.NoValidCandidateException if some word cannot be
     *                                                                     fitted at all
     */
    public Map<String, SelectionResult> selectAll(SequenceCorpus corpus, String selector) {
        logger.info("Starting {} selection for {} words", selector, corpus.size());
        long startTime = System.currentTimeMillis();

        Map<String, SelectionResult> results = new LinkedHashMap<>();
        int fallbacks = 0;
        for (String word : corpus.getWords()) {
            SelectionResult result = selectWord(corpus, word, selector);
            if (result.isFallback()) {
                fallbacks++;
            }
            results.put(word, result);
        }

        long duration = System.currentTimeMillis() - startTime;
        logger.info("Selection complete in {} ms ({} words, {} fallbacks)", duration, results.size(), fallbacks);
        return results;
    }
}
