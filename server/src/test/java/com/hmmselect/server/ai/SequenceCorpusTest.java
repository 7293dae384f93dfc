package com.hmmselect.server.ai;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SequenceCorpusTest {

    private static FeatureSequence seq(double... values) {
        double[][] frames = new double[values.length][1];
        for (int t = 0; t < values.length; t++) {
            frames[t][0] = values[t];
        }
        return new FeatureSequence(frames);
    }

    @Test
    void testCombineKeepsIndexOrder() {
        List<FeatureSequence> sequences = List.of(seq(1, 2), seq(3, 4, 5), seq(6));

        FlattenedSequences flat = SequenceCombiner.combine(new int[] { 2, 0 }, sequences);

        assertArrayEquals(new int[] { 1, 2 }, flat.getLengths());
        assertEquals(3, flat.totalFrames());
        assertEquals(6.0, flat.get(0, 0));
        assertEquals(1.0, flat.get(1, 0));
        assertEquals(2.0, flat.get(2, 0));
    }

    @Test
    void testFromSequencesDerivesFlattenedShape() {
        Map<String, List<FeatureSequence>> map = new LinkedHashMap<>();
        map.put("BOOK", List.of(seq(1, 2, 3), seq(4, 5)));
        map.put("FISH", List.of(seq(9)));

        SequenceCorpus corpus = SequenceCorpus.fromSequences(map);

        assertEquals(List.of("BOOK", "FISH"), List.copyOf(corpus.getWords()));
        FlattenedSequences book = corpus.getFlattened("BOOK");
        assertEquals(5, book.totalFrames());
        assertArrayEquals(new int[] { 3, 2 }, book.getLengths());
        assertEquals(1, book.dimension());
    }

    @Test
    void testInconsistentMapsRejected() {
        Map<String, List<FeatureSequence>> sequences = new LinkedHashMap<>();
        sequences.put("BOOK", List.of(seq(1, 2, 3)));
        Map<String, FlattenedSequences> flattened = new LinkedHashMap<>();
        flattened.put("BOOK", new FlattenedSequences(new double[][] { { 1 }, { 2 } }, new int[] { 2 }));

        assertThrows(IllegalArgumentException.class, () -> new SequenceCorpus(sequences, flattened));
    }

    @Test
    void testLengthsMustMatchFrames() {
        assertThrows(IllegalArgumentException.class,
                () -> new FlattenedSequences(new double[][] { { 1 }, { 2 } }, new int[] { 3 }));
    }

    @Test
    void testRaggedFramesRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new FeatureSequence(new double[][] { { 1, 2 }, { 3 } }));
    }

    @Test
    void testUnknownWord() {
        SequenceCorpus corpus = SequenceCorpus.fromSequences(Map.of("BOOK", List.of(seq(1))));
        assertFalse(corpus.contains("FISH"));
        assertThrows(IllegalArgumentException.class, () -> corpus.getSequences("FISH"));
    }

    @Test
    void testSequencesAreCopied() {
        double[][] frames = { { 1.0 }, { 2.0 } };
        FeatureSequence sequence = new FeatureSequence(frames);
        frames[0][0] = 99.0;
        assertEquals(1.0, sequence.getFrame(0)[0]);
    }
}
