package com.hmmviterbi.server.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Reports transition choices and completed columns at DEBUG.
 */
public class LoggingTransitionObserver implements TransitionObserver {
    private static final Logger logger = LoggerFactory.getLogger(LoggingTransitionObserver.class);

    @Override
    public void onTransition(int timestep, int fromState, int toState, double logProbability) {
        logger.debug("t={}: Selected {} -> {} with log p={}", timestep, fromState, toState, logProbability);
    }

    @Override
    public void onColumn(int timestep, double[] logProbabilities) {
        if (logger.isDebugEnabled()) {
            logger.debug("Vector after symbol {}: {}", timestep + 1, Arrays.toString(logProbabilities));
        }
    }
}
