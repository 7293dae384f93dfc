package com.hmmselect.server.ai;

public class SelectorConfig {
    public String selector = "bic";
    public int minComponents = 2;
    public int maxComponents = 10;
    public int nConstant = 3;
    public long randomSeed = 14;
    public boolean verbose = false;
    public int cvFolds = 3;

    // Gaussian HMM fitting
    public int maxIterations = 1000;
    public double tolerance = 1.0e-2;
    public double minCovar = 1.0e-3;

    public SelectorConfig() {
    }

    public SelectorConfig(
            String selector,
            int minComponents,
            int maxComponents,
            int nConstant,
            long randomSeed,
            boolean verbose,
            int cvFolds,
            int maxIterations,
            double tolerance,
            double minCovar) {
        this.selector = selector;
        this.minComponents = minComponents;
        this.maxComponents = maxComponents;
        this.nConstant = nConstant;
        this.randomSeed = randomSeed;
        this.verbose = verbose;
        this.cvFolds = cvFolds;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.minCovar = minCovar;
    }

    public static SelectorConfig defaults() {
        return new SelectorConfig("bic", 2, 10, 3, 14, false, 3, 1000, 1.0e-2, 1.0e-3);
    }

    public SelectorConfig copy() {
        return new SelectorConfig(
                this.selector,
                this.minComponents,
                this.maxComponents,
                this.nConstant,
                this.randomSeed,
                this.verbose,
                this.cvFolds,
                this.maxIterations,
                this.tolerance,
                this.minCovar);
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public void validate() {
        if (minComponents < 1) {
            throw new IllegalArgumentException("minComponents must be at least 1, got " + minComponents);
        }
        if (minComponents > maxComponents) {
            throw new IllegalArgumentException(
                    "minComponents (" + minComponents + ") must not exceed maxComponents (" + maxComponents + ")");
        }
        if (nConstant < 1) {
            throw new IllegalArgumentException("nConstant must be at least 1, got " + nConstant);
        }
        if (cvFolds < 2) {
            throw new IllegalArgumentException("cvFolds must be at least 2, got " + cvFolds);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        if (tolerance < 0 || minCovar <= 0) {
            throw new IllegalArgumentException("tolerance must be >= 0 and minCovar > 0");
        }
    }
}
