package com.hmmviterbi.server.ai;

import com.hmmviterbi.server.ai.inference.MathUtil;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Immutable discrete hidden Markov model: an n x n transition matrix and an
 * n x m emission matrix, both row-stochastic.
 *
 * T[i][j] is the probability of moving from state i to state j; E[i][k] is
 * the probability of emitting symbol k while in state i. Dimensions are
 * checked once here, so lookups do no bounds bookkeeping of their own.
 */
public final class HiddenMarkovModel {
    private static final Logger logger = LoggerFactory.getLogger(HiddenMarkovModel.class);

    public static final double DEFAULT_TOLERANCE = 1e-6;

    // stationary mass below this is round-off from the SVD
    private static final double ZERO_MASS_THRESHOLD = 1e-12;

    private final double[][] transition;
    private final double[][] emission;
    private final double[][] logTransition;
    private final double[][] logEmission;
    private final int numStates;
    private final int numSymbols;

    private HiddenMarkovModel(double[][] transition, double[][] emission) {
        this.transition = transition;
        this.emission = emission;
        this.logTransition = MathUtil.logMatrix(transition);
        this.logEmission = MathUtil.logMatrix(emission);
        this.numStates = transition.length;
        this.numSymbols = emission[0].length;
    }

    public static HiddenMarkovModel create(double[][] transition, double[][] emission) {
        return create(transition, emission, DEFAULT_TOLERANCE);
    }

    /**
     * Validates and copies the parameters.
     *
     * @param tolerance allowed absolute deviation of each row sum from 1.0
     * @throws ModelValidationException naming the matrix and row at fault
     */
    public static HiddenMarkovModel create(double[][] transition, double[][] emission, double tolerance) {
        checkShape(transition, emission);

        for (int i = 0; i < transition.length; i++) {
            validateDistribution(transition[i], "transition", i, tolerance);
        }
        for (int i = 0; i < emission.length; i++) {
            validateDistribution(emission[i], "emission", i, tolerance);
        }

        HiddenMarkovModel hmm = new HiddenMarkovModel(MathUtil.copy(transition), MathUtil.copy(emission));
        logger.debug("Created HMM with {} states and {} symbols", hmm.numStates, hmm.numSymbols);
        return hmm;
    }

    private static void checkShape(double[][] transition, double[][] emission) {
        checkRectangular(transition, "transition");
        checkRectangular(emission, "emission");

        int n = transition.length;
        if (transition[0].length != n) {
            throw new ModelValidationException(ModelValidationException.Kind.SHAPE_MISMATCH, "transition",
                    ModelValidationException.NO_ROW,
                    "Transition matrix is not square: " + n + " rows, " + transition[0].length + " columns");
        }
        if (emission.length != n) {
            throw new ModelValidationException(ModelValidationException.Kind.SHAPE_MISMATCH, "emission",
                    ModelValidationException.NO_ROW,
                    "Emission matrix has " + emission.length + " rows but the model has " + n + " states");
        }
    }

    private static void checkRectangular(double[][] matrix, String name) {
        if (matrix == null || matrix.length == 0) {
            throw new ModelValidationException(ModelValidationException.Kind.SHAPE_MISMATCH, name,
                    ModelValidationException.NO_ROW, "The " + name + " matrix is empty");
        }
        int width = -1;
        for (int i = 0; i < matrix.length; i++) {
            if (matrix[i] == null || matrix[i].length == 0) {
                throw new ModelValidationException(ModelValidationException.Kind.SHAPE_MISMATCH, name, i,
                        "Row " + i + " of the " + name + " matrix is empty");
            }
            if (width < 0) {
                width = matrix[i].length;
            } else if (matrix[i].length != width) {
                throw new ModelValidationException(ModelValidationException.Kind.SHAPE_MISMATCH, name, i,
                        "Row " + i + " of the " + name + " matrix has " + matrix[i].length
                                + " entries, expected " + width);
            }
        }
    }

    /**
     * Checks that a single row is a probability distribution: finite entries
     * in [0, 1] summing to 1 within the tolerance.
     */
    static void validateDistribution(double[] row, String name, int rowIndex, double tolerance) {
        for (int k = 0; k < row.length; k++) {
            double p = row[k];
            if (!Double.isFinite(p) || p < 0.0 || p > 1.0) {
                throw new ModelValidationException(ModelValidationException.Kind.OUT_OF_RANGE_VALUE, name, rowIndex,
                        "Entry " + k + " of " + name + " row " + rowIndex + " is not a probability: " + p);
            }
        }
        double sum = MathUtil.sum(row);
        if (Math.abs(sum - 1.0) > tolerance) {
            throw new ModelValidationException(ModelValidationException.Kind.NON_STOCHASTIC_ROW, name, rowIndex,
                    "Row " + rowIndex + " of the " + name + " matrix sums to " + sum + ", not 1.0");
        }
    }

    public int getNumStates() {
        return numStates;
    }

    public int getNumSymbols() {
        return numSymbols;
    }

    public double transitionProbability(int from, int to) {
        return transition[from][to];
    }

    public double emissionProbability(int state, int symbol) {
        return emission[state][symbol];
    }

    public double logTransitionProbability(int from, int to) {
        return logTransition[from][to];
    }

    public double logEmissionProbability(int state, int symbol) {
        return logEmission[state][symbol];
    }

    public double[][] getTransitionMatrix() {
        return MathUtil.copy(transition);
    }

    public double[][] getEmissionMatrix() {
        return MathUtil.copy(emission);
    }

    public double[] uniformPrior() {
        double[] prior = new double[numStates];
        Arrays.fill(prior, 1.0 / numStates);
        return prior;
    }

    /**
     * Computes the steady-state distribution w of the transition matrix, i.e.
     * wT = w with the entries of w summing to 1.
     *
     * w spans the null space of (T - I)^T, which is read off the right
     * singular vectors whose singular values vanish.
     *
     * @throws IllegalStateException if the eigenvalue 1 has geometric
     *                               multiplicity greater than one, so no
     *                               unique stationary distribution exists
     */
    public double[] steadyStateProbabilities() {
        RealMatrix kernel = MatrixUtils.createRealMatrix(generator()).transpose();

        SingularValueDecomposition svd = new SingularValueDecomposition(kernel);
        double[] singularValues = svd.getSingularValues();

        // same relative cutoff as a rank-revealing SVD: s_max * n * eps
        double cutoff = singularValues[0] * numStates * Math.ulp(1.0);
        int nullity = 0;
        for (double s : singularValues) {
            if (s <= cutoff) {
                nullity++;
            }
        }
        // a nullity of 0 only means round-off lifted the smallest singular value;
        // a stochastic matrix always has eigenvalue 1
        if (nullity > 1) {
            throw new IllegalStateException("HMM does not have a unique stationary distribution! "
                    + "Null space dimension for eigenvalue 1: " + nullity);
        }

        // singular values come back in decreasing order, so the null vector is the last column of V
        double[] w = svd.getV().getColumn(numStates - 1);
        double total = MathUtil.sum(w);
        for (int i = 0; i < w.length; i++) {
            w[i] /= total;
            // clamp round-off on states with zero stationary mass
            if (Math.abs(w[i]) < ZERO_MASS_THRESHOLD) {
                w[i] = 0.0;
            }
        }
        logger.debug("Steady-state distribution: {}", Arrays.toString(w));
        return w;
    }

    /**
     * T - I computed from T with every row rescaled to sum exactly to 1. The
     * diagonal is the negated off-diagonal row sum, so each row of the result
     * sums to zero without cancellation against the identity.
     */
    private double[][] generator() {
        double[][] q = new double[numStates][numStates];
        for (int i = 0; i < numStates; i++) {
            double rowSum = MathUtil.sum(transition[i]);
            double offDiagonal = 0.0;
            for (int j = 0; j < numStates; j++) {
                if (j != i) {
                    q[i][j] = transition[i][j] / rowSum;
                    offDiagonal += q[i][j];
                }
            }
            q[i][i] = -offDiagonal;
        }
        return q;
    }

    @Override
    public String toString() {
        return "HiddenMarkovModel{" +
                "states=" + numStates +
                ", symbols=" + numSymbols +
                '}';
    }
}
