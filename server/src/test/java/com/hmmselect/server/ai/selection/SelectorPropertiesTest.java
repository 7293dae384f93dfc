package com.hmmselect.server.ai.selection;

import com.hmmselect.server.ai.FeatureSequence;
import com.hmmselect.server.ai.SelectorConfig;
import com.hmmselect.server.ai.SequenceCorpus;
import com.hmmselect.server.ai.hmm.GaussianHmmFitter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties every strategy shares, checked against the real Gaussian HMM fitter.
 */
class SelectorPropertiesTest {

    private static final String[] SELECTORS = { "constant", "bic", "dic", "cv" };

    private static SequenceCorpus syntheticCorpus() {
        Random rng = new Random(7);
        Map<String, List<FeatureSequence>> map = new LinkedHashMap<>();
        String[] words = { "CHICKEN", "ARRIVE", "LOVE" };
        for (int w = 0; w < words.length; w++) {
            List<FeatureSequence> list = new ArrayList<>();
            for (int s = 0; s < 4; s++) {
                double[][] frames = new double[8][2];
                for (int t = 0; t < frames.length; t++) {
                    // two regimes per word: first half low, second half high
                    double level = (t < 4 ? 0.0 : 5.0) + 3.0 * w;
                    frames[t][0] = level + rng.nextGaussian();
                    frames[t][1] = -level + rng.nextGaussian();
                }
                list.add(new FeatureSequence(frames));
            }
            map.put(words[w], list);
        }
        return SequenceCorpus.fromSequences(map);
    }

    private static SelectorConfig smallConfig() {
        SelectorConfig cfg = SelectorConfig.defaults();
        cfg.minComponents = 2;
        cfg.maxComponents = 3;
        cfg.nConstant = 3;
        cfg.maxIterations = 50;
        return cfg;
    }

    @Test
    void testSelectedStateCountWithinRangeOrConstant() {
        SequenceCorpus corpus = syntheticCorpus();
        SelectorConfig cfg = smallConfig();
        GaussianHmmFitter fitter = new GaussianHmmFitter(cfg);

        for (String selector : SELECTORS) {
            for (String word : corpus.getWords()) {
                int states = ModelSelectorFactory.create(selector, cfg, corpus, word, fitter).select()
                        .getNumStates();
                boolean inRange = states >= cfg.minComponents && states <= cfg.maxComponents;
                assertTrue(inRange || states == cfg.nConstant,
                        selector + " selected " + states + " states for " + word);
            }
        }
    }

    @Test
    void testRepeatedSelectionIsIdempotent() {
        SequenceCorpus corpus = syntheticCorpus();
        SelectorConfig cfg = smallConfig();

        for (String selector : SELECTORS) {
            SelectionResult first = ModelSelectorFactory
                    .create(selector, cfg, corpus, "ARRIVE", new GaussianHmmFitter(cfg)).selectWithDetails();
            SelectionResult second = ModelSelectorFactory
                    .create(selector, cfg, corpus, "ARRIVE", new GaussianHmmFitter(cfg)).selectWithDetails();

            assertEquals(first.getNumStates(), second.getNumStates(), selector);
            assertEquals(first.getCandidateScores(), second.getCandidateScores(), selector);
        }
    }

    @Test
    void testFallbackLawHoldsForEveryStrategy() {
        SequenceCorpus corpus = SelectorTestDoubles.corpus(3, "BOOK", "FISH");
        SelectorConfig cfg = SelectorTestDoubles.config(4, 6, 3);

        for (String selector : SELECTORS) {
            SelectorTestDoubles.StubFitter fitter =
                    new SelectorTestDoubles.StubFitter((fit, scored, n) -> -10.0).failFor(4, 5, 6);
            SelectionResult result = ModelSelectorFactory.create(selector, cfg, corpus, "BOOK", fitter)
                    .selectWithDetails();

            assertEquals(3, result.getNumStates(), selector);
        }
    }
}
