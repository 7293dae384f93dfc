package com.hmmselect.server.ai;

import java.util.Arrays;

/**
 * One recorded instance of a word: an ordered list of fixed-width feature frames.
 */
public final class FeatureSequence {
    // frames[t][d] is feature d of frame t
    private final double[][] frames;

    public FeatureSequence(double[][] frames) {
        if (frames == null || frames.length == 0) {
            throw new IllegalArgumentException("Sequence must contain at least one frame");
        }
        int dim = frames[0].length;
        if (dim == 0) {
            throw new IllegalArgumentException("Frames must have at least one feature");
        }
        this.frames = new double[frames.length][];
        for (int t = 0; t < frames.length; t++) {
            if (frames[t].length != dim) {
                throw new IllegalArgumentException(
                        "Frame " + t + " has " + frames[t].length + " features, expected " + dim);
            }
            this.frames[t] = Arrays.copyOf(frames[t], dim);
        }
    }

    public int length() {
        return frames.length;
    }

    public int dimension() {
        return frames[0].length;
    }

    public double[] getFrame(int t) {
        return Arrays.copyOf(frames[t], frames[t].length);
    }

    void copyInto(double[][] target, int offset) {
        for (int t = 0; t < frames.length; t++) {
            target[offset + t] = Arrays.copyOf(frames[t], frames[t].length);
        }
    }
}
