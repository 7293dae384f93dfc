package com.hmmselect.server.ai;

import java.util.Arrays;

/**
 * Concatenated observation frames of several sequences plus the length of each one,
 * in concatenation order. This is the shape model fitting and scoring work on.
 */
public final class FlattenedSequences {
    private final double[][] observations;
    private final int[] lengths;

    public FlattenedSequences(double[][] observations, int[] lengths) {
        if (observations == null || lengths == null) {
            throw new IllegalArgumentException("Observations and lengths are required");
        }
        long total = 0;
        for (int len : lengths) {
            if (len <= 0) {
                throw new IllegalArgumentException("Sequence lengths must be positive, got " + len);
            }
            total += len;
        }
        if (total != observations.length) {
            throw new IllegalArgumentException(
                    "Sum of lengths (" + total + ") does not match number of frames (" + observations.length + ")");
        }
        if (observations.length == 0) {
            throw new IllegalArgumentException("At least one frame is required");
        }
        int dim = observations[0].length;
        this.observations = new double[observations.length][];
        for (int r = 0; r < observations.length; r++) {
            if (observations[r].length != dim) {
                throw new IllegalArgumentException("Row " + r + " has dimension " + observations[r].length
                        + ", expected " + dim);
            }
            this.observations[r] = Arrays.copyOf(observations[r], dim);
        }
        this.lengths = Arrays.copyOf(lengths, lengths.length);
    }

    public int totalFrames() {
        return observations.length;
    }

    public int dimension() {
        return observations[0].length;
    }

    public int numSequences() {
        return lengths.length;
    }

    public int length(int sequence) {
        return lengths[sequence];
    }

    public int[] getLengths() {
        return Arrays.copyOf(lengths, lengths.length);
    }

    public double get(int row, int feature) {
        return observations[row][feature];
    }

    public double[] getRow(int row) {
        return Arrays.copyOf(observations[row], observations[row].length);
    }
}
