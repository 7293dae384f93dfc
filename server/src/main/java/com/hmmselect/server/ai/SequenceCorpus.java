package com.hmmselect.server.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All training sequences of a vocabulary, keyed by word, in two shapes: the list of
 * individual sequences and the flattened (frames, lengths) pair. Read-only.
 */
public class SequenceCorpus {
    private static final Logger logger = LoggerFactory.getLogger(SequenceCorpus.class);

    private final Map<String, List<FeatureSequence>> sequences;
    private final Map<String, FlattenedSequences> flattened;

    public SequenceCorpus(Map<String, List<FeatureSequence>> sequences,
            Map<String, FlattenedSequences> flattened) {
        if (!sequences.keySet().equals(flattened.keySet())) {
            throw new IllegalArgumentException("Sequence and flattened maps must contain the same words");
        }
        Map<String, List<FeatureSequence>> seqCopy = new LinkedHashMap<>();
        for (Map.Entry<String, List<FeatureSequence>> e : sequences.entrySet()) {
            String word = e.getKey();
            List<FeatureSequence> list = e.getValue();
            FlattenedSequences flat = flattened.get(word);
            checkConsistent(word, list, flat);
            seqCopy.put(word, Collections.unmodifiableList(new ArrayList<>(list)));
        }
        this.sequences = Collections.unmodifiableMap(seqCopy);
        this.flattened = Collections.unmodifiableMap(new LinkedHashMap<>(flattened));
        logger.debug("Corpus created with {} words", this.sequences.size());
    }

    /**
     * Builds a corpus from per-word sequences, deriving the flattened shape.
     */
    public static SequenceCorpus fromSequences(Map<String, List<FeatureSequence>> sequences) {
        Map<String, FlattenedSequences> flattened = new LinkedHashMap<>();
        for (Map.Entry<String, List<FeatureSequence>> e : sequences.entrySet()) {
            flattened.put(e.getKey(), SequenceCombiner.combineAll(e.getValue()));
        }
        return new SequenceCorpus(sequences, flattened);
    }

    private static void checkConsistent(String word, List<FeatureSequence> list, FlattenedSequences flat) {
        if (list == null || list.isEmpty()) {
            throw new IllegalArgumentException("Word '" + word + "' has no sequences");
        }
        if (list.size() != flat.numSequences()) {
            throw new IllegalArgumentException("Word '" + word + "' has " + list.size()
                    + " sequences but flattened data lists " + flat.numSequences());
        }
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).length() != flat.length(i)) {
                throw new IllegalArgumentException("Word '" + word + "' sequence " + i + " length mismatch");
            }
            if (list.get(i).dimension() != flat.dimension()) {
                throw new IllegalArgumentException("Word '" + word + "' sequence " + i + " dimension mismatch");
            }
        }
    }

    public Set<String> getWords() {
        return sequences.keySet();
    }

    public boolean contains(String word) {
        return sequences.containsKey(word);
    }

    public List<FeatureSequence> getSequences(String word) {
        List<FeatureSequence> list = sequences.get(word);
        if (list == null) {
            throw new IllegalArgumentException("Unknown word: " + word);
        }
        return list;
    }

    public FlattenedSequences getFlattened(String word) {
        FlattenedSequences flat = flattened.get(word);
        if (flat == null) {
            throw new IllegalArgumentException("Unknown word: " + word);
        }
        return flat;
    }

    public int size() {
        return sequences.size();
    }
}
