package com.hmmviterbi.server.ai;

import com.hmmviterbi.server.ai.inference.MathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Finds the most likely hidden-state path for an observation sequence.
 *
 * The trellis is kept in log space throughout, so long sequences do not
 * underflow and the argmax stays meaningful. Ties, both between predecessors
 * and between final states, go to the lowest state index.
 *
 * Instances hold only configuration; every {@link #decode} call allocates its
 * own trellis and backpointer tables and may run concurrently with others.
 */
public class ViterbiDecoder {
    private static final Logger logger = LoggerFactory.getLogger(ViterbiDecoder.class);

    private final PriorPolicy priorPolicy;
    private final TransitionObserver observer;
    private final double tolerance;

    public ViterbiDecoder() {
        this(PriorPolicy.UNIFORM, TransitionObserver.NONE);
    }

    public ViterbiDecoder(PriorPolicy priorPolicy, TransitionObserver observer) {
        this(priorPolicy, observer, HiddenMarkovModel.DEFAULT_TOLERANCE);
    }

    /**
     * @param tolerance row-sum tolerance applied to explicitly supplied priors
     */
    public ViterbiDecoder(PriorPolicy priorPolicy, TransitionObserver observer, double tolerance) {
        this.priorPolicy = priorPolicy != null ? priorPolicy : PriorPolicy.UNIFORM;
        this.observer = observer != null ? observer : TransitionObserver.NONE;
        this.tolerance = tolerance;
    }

    public PriorPolicy getPriorPolicy() {
        return priorPolicy;
    }

    public DecodeResult decode(HiddenMarkovModel model, int[] observations) {
        checkObservations(model, observations);
        return run(model, observations, priorPolicy.priorFor(model));
    }

    /**
     * Decodes with an explicit initial-state distribution instead of the
     * configured policy.
     *
     * @throws ModelValidationException if the prior is not a distribution over the model's states
     */
    public DecodeResult decode(HiddenMarkovModel model, int[] observations, double[] prior) {
        if (prior == null || prior.length != model.getNumStates()) {
            throw new ModelValidationException(ModelValidationException.Kind.SHAPE_MISMATCH, "prior",
                    ModelValidationException.NO_ROW,
                    "Prior must have one entry per state (" + model.getNumStates() + "), got "
                            + (prior == null ? "none" : String.valueOf(prior.length)));
        }
        HiddenMarkovModel.validateDistribution(prior, "prior", 0, tolerance);
        checkObservations(model, observations);
        return run(model, observations, prior.clone());
    }

    private static void checkObservations(HiddenMarkovModel model, int[] observations) {
        if (observations == null || observations.length == 0) {
            throw new InvalidObservationException(InvalidObservationException.Kind.EMPTY_SEQUENCE, -1,
                    "Cannot decode an empty sequence of observations");
        }
        int m = model.getNumSymbols();
        for (int t = 0; t < observations.length; t++) {
            int symbol = observations[t];
            if (symbol < 0 || symbol >= m) {
                throw new InvalidObservationException(InvalidObservationException.Kind.SYMBOL_OUT_OF_RANGE, t,
                        "Observation " + t + " is symbol " + symbol + ", but the model only emits symbols 0.."
                                + (m - 1));
            }
        }
    }

    private DecodeResult run(HiddenMarkovModel model, int[] observations, double[] prior) {
        int n = model.getNumStates();
        int length = observations.length;
        logger.debug("Decoding {} observations over {} states, prior={}", length, n, Arrays.toString(prior));

        double[][] trellis = new double[length][n];
        int[][] backpointers = new int[length][n];

        int first = observations[0];
        for (int j = 0; j < n; j++) {
            trellis[0][j] = MathUtil.safeLog(prior[j]) + model.logEmissionProbability(j, first);
        }
        observer.onColumn(0, trellis[0].clone());

        for (int t = 1; t < length; t++) {
            int symbol = observations[t];
            double[] previous = trellis[t - 1];

            for (int j = 0; j < n; j++) {
                // strict comparison keeps the lowest index on ties
                int bestParent = 0;
                double bestScore = previous[0] + model.logTransitionProbability(0, j);
                for (int i = 1; i < n; i++) {
                    double score = previous[i] + model.logTransitionProbability(i, j);
                    if (score > bestScore) {
                        bestScore = score;
                        bestParent = i;
                    }
                }

                trellis[t][j] = bestScore + model.logEmissionProbability(j, symbol);
                backpointers[t][j] = bestParent;
                observer.onTransition(t, bestParent, j, trellis[t][j]);
            }
            observer.onColumn(t, trellis[t].clone());
        }

        int lastState = MathUtil.argmax(trellis[length - 1]);
        double logProbability = trellis[length - 1][lastState];

        int[] path = new int[length];
        path[length - 1] = lastState;
        for (int t = length - 1; t > 0; t--) {
            path[t - 1] = backpointers[t][path[t]];
        }

        if (logProbability == Double.NEGATIVE_INFINITY) {
            logger.warn("Observation sequence has zero probability under the model; returning lowest-index path");
        }
        logger.debug("Most likely path ends in state {} with log p={}", lastState, logProbability);
        return new DecodeResult(path, logProbability, prior);
    }
}
