package com.hmmselect.server.ai.selection;

import com.hmmselect.server.ai.FeatureSequence;
import com.hmmselect.server.ai.FlattenedSequences;
import com.hmmselect.server.ai.SelectorConfig;
import com.hmmselect.server.ai.SequenceCorpus;
import com.hmmselect.server.ai.hmm.CandidateModel;
import com.hmmselect.server.ai.hmm.ModelFitException;
import com.hmmselect.server.ai.hmm.ModelFitter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic fitters and corpora for selector tests.
 */
final class SelectorTestDoubles {

    private SelectorTestDoubles() {
    }

    interface ScoreFunction {
        double score(FlattenedSequences fitData, FlattenedSequences scoredData, int numStates)
                throws ModelFitException;
    }

    static final class StubModel implements CandidateModel {
        private final int numStates;
        private final FlattenedSequences fitData;
        private final ScoreFunction scoreFunction;
        final List<FlattenedSequences> scored = new ArrayList<>();

        StubModel(int numStates, FlattenedSequences fitData, ScoreFunction scoreFunction) {
            this.numStates = numStates;
            this.fitData = fitData;
            this.scoreFunction = scoreFunction;
        }

        @Override
        public int getNumStates() {
            return numStates;
        }

        @Override
        public double score(FlattenedSequences data) throws ModelFitException {
            scored.add(data);
            return scoreFunction.score(fitData, data, numStates);
        }
    }

    /**
     * Records every request and fails for the configured state counts or training sets.
     */
    static final class StubFitter implements ModelFitter {
        final List<Integer> requestedStates = new ArrayList<>();
        final List<FlattenedSequences> fittedData = new ArrayList<>();
        final List<StubModel> models = new ArrayList<>();
        private final Set<Integer> failingStates = new HashSet<>();
        private final Set<FlattenedSequences> failingData = new HashSet<>();
        private final ScoreFunction scoreFunction;

        StubFitter(ScoreFunction scoreFunction) {
            this.scoreFunction = scoreFunction;
        }

        StubFitter failFor(int... states) {
            for (int s : states) {
                failingStates.add(s);
            }
            return this;
        }

        StubFitter failFor(FlattenedSequences data) {
            failingData.add(data);
            return this;
        }

        @Override
        public CandidateModel fit(FlattenedSequences data, int numStates, long seed) throws ModelFitException {
            requestedStates.add(numStates);
            fittedData.add(data);
            if (failingStates.contains(numStates) || failingData.contains(data)) {
                throw new ModelFitException(numStates, "stub failure");
            }
            StubModel model = new StubModel(numStates, data, scoreFunction);
            models.add(model);
            return model;
        }
    }

    static FeatureSequence constantSequence(int length, double value) {
        double[][] frames = new double[length][2];
        for (int t = 0; t < length; t++) {
            frames[t][0] = value;
            frames[t][1] = value + t;
        }
        return new FeatureSequence(frames);
    }

    /**
     * Each word gets {@code perWord} sequences of increasing length.
     */
    static SequenceCorpus corpus(int perWord, String... words) {
        Map<String, List<FeatureSequence>> map = new LinkedHashMap<>();
        for (int w = 0; w < words.length; w++) {
            List<FeatureSequence> list = new ArrayList<>();
            for (int i = 0; i < perWord; i++) {
                list.add(constantSequence(3 + i, w));
            }
            map.put(words[w], list);
        }
        return SequenceCorpus.fromSequences(map);
    }

    static SelectorConfig config(int min, int max, int nConstant) {
        SelectorConfig cfg = SelectorConfig.defaults();
        cfg.minComponents = min;
        cfg.maxComponents = max;
        cfg.nConstant = nConstant;
        return cfg;
    }
}
