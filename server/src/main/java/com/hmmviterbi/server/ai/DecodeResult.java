package com.hmmviterbi.server.ai;

import java.util.Arrays;

public class DecodeResult {
    private final int[] path;
    private final double logProbability;
    private final double[] prior;

    public DecodeResult(int[] path, double logProbability, double[] prior) {
        this.path = path;
        this.logProbability = logProbability;
        this.prior = prior;
    }

    /**
     * Most likely state sequence, one state per observation, in chronological order.
     */
    public int[] getPath() {
        return path.clone();
    }

    /**
     * Log of the joint probability of the path and the observations.
     */
    public double getLogProbability() {
        return logProbability;
    }

    /**
     * Linear-scale joint probability. Underflows to 0.0 for long sequences;
     * {@link #getLogProbability()} stays exact.
     */
    public double getProbability() {
        return Math.exp(logProbability);
    }

    public double[] getPrior() {
        return prior.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecodeResult)) {
            return false;
        }
        DecodeResult that = (DecodeResult) o;
        return Double.compare(logProbability, that.logProbability) == 0
                && Arrays.equals(path, that.path)
                && Arrays.equals(prior, that.prior);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(path);
        result = 31 * result + Double.hashCode(logProbability);
        result = 31 * result + Arrays.hashCode(prior);
        return result;
    }

    @Override
    public String toString() {
        return "DecodeResult{" +
                "path=" + Arrays.toString(path) +
                ", logProbability=" + String.format("%.6f", logProbability) +
                '}';
    }
}
