package com.hmmviterbi.server.ai;

import java.util.Locale;

/**
 * How the first trellis column is seeded when the caller supplies no explicit
 * initial-state distribution.
 */
public enum PriorPolicy {
    /** prior(j) = 1/n */
    UNIFORM,
    /** the stationary distribution of the transition matrix */
    STEADY_STATE;

    public double[] priorFor(HiddenMarkovModel model) {
        switch (this) {
            case STEADY_STATE:
                return model.steadyStateProbabilities();
            case UNIFORM:
            default:
                return model.uniformPrior();
        }
    }

    /**
     * Accepts "uniform", "steady_state", "steady-state" in any case.
     */
    public static PriorPolicy fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Prior policy name is empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return PriorPolicy.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown prior policy '" + name + "', expected uniform or steady_state",
                    e);
        }
    }
}
