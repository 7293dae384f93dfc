package com.hmmselect.server.ai;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic k-fold splitter. Samples are not shuffled: fold i holds a contiguous
 * block, and the first {@code n % k} folds get one extra sample.
 */
public class KFoldSplitter {

    public static class Fold {
        private final int[] trainIndices;
        private final int[] testIndices;

        Fold(int[] trainIndices, int[] testIndices) {
            this.trainIndices = trainIndices;
            this.testIndices = testIndices;
        }

        public int[] getTrainIndices() {
            return trainIndices.clone();
        }

        public int[] getTestIndices() {
            return testIndices.clone();
        }
    }

    private final int numFolds;

    public KFoldSplitter(int numFolds) {
        if (numFolds < 2) {
            throw new IllegalArgumentException("Number of folds must be at least 2, got " + numFolds);
        }
        this.numFolds = numFolds;
    }

    public int getNumFolds() {
        return numFolds;
    }

    public List<Fold> split(int numSamples) throws InsufficientDataException {
        if (numSamples < numFolds) {
            throw new InsufficientDataException(numSamples, numFolds);
        }

        List<Fold> folds = new ArrayList<>(numFolds);
        int base = numSamples / numFolds;
        int extra = numSamples % numFolds;
        int start = 0;
        for (int f = 0; f < numFolds; f++) {
            int size = base + (f < extra ? 1 : 0);
            int[] test = new int[size];
            int[] train = new int[numSamples - size];
            int ti = 0;
            for (int i = 0; i < numSamples; i++) {
                if (i >= start && i < start + size) {
                    test[i - start] = i;
                } else {
                    train[ti++] = i;
                }
            }
            folds.add(new Fold(train, test));
            start += size;
        }
        return folds;
    }
}
