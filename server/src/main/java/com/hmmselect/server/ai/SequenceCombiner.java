package com.hmmselect.server.ai;

import java.util.List;

public class SequenceCombiner {

    /**
     * Concatenates the selected sequences, in the order given by {@code indices}.
     *
     * @param indices   positions into {@code sequences}
     * @param sequences all sequences of one word
     * @return flattened frames and per-sequence lengths
     */
    public static FlattenedSequences combine(int[] indices, List<FeatureSequence> sequences) {
        if (indices == null || indices.length == 0) {
            throw new IllegalArgumentException("At least one sequence index is required");
        }
        int total = 0;
        int dim = -1;
        for (int idx : indices) {
            FeatureSequence seq = sequences.get(idx);
            if (dim >= 0 && seq.dimension() != dim) {
                throw new IllegalArgumentException("Sequence " + idx + " has dimension " + seq.dimension()
                        + ", expected " + dim);
            }
            dim = seq.dimension();
            total += seq.length();
        }

        double[][] observations = new double[total][];
        int[] lengths = new int[indices.length];
        int offset = 0;
        for (int i = 0; i < indices.length; i++) {
            FeatureSequence seq = sequences.get(indices[i]);
            seq.copyInto(observations, offset);
            lengths[i] = seq.length();
            offset += seq.length();
        }
        return new FlattenedSequences(observations, lengths);
    }

    public static FlattenedSequences combineAll(List<FeatureSequence> sequences) {
        int[] indices = new int[sequences.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        return combine(indices, sequences);
    }
}
