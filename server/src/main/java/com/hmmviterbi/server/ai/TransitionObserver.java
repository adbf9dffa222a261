package com.hmmviterbi.server.ai;

/**
 * Receives the decoder's intermediate choices. Purely diagnostic: observers
 * must not influence the result.
 */
public interface TransitionObserver {

    TransitionObserver NONE = new TransitionObserver() {
        @Override
        public void onTransition(int timestep, int fromState, int toState, double logProbability) {
        }

        @Override
        public void onColumn(int timestep, double[] logProbabilities) {
        }
    };

    /**
     * Called for every state at timestep >= 1 with the predecessor chosen for it
     * and the resulting log-probability of the best path ending there.
     */
    void onTransition(int timestep, int fromState, int toState, double logProbability);

    /**
     * Called once per timestep, including 0, with the completed trellis column.
     * The array is a copy and may be kept.
     */
    void onColumn(int timestep, double[] logProbabilities);
}
