package com.hmmviterbi.server.ai.inference;

public class MathUtil {

    /**
     * Natural log that maps 0 to negative infinity instead of relying on
     * callers to special-case impossible events.
     */
    public static double safeLog(double p) {
        if (p <= 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        return Math.log(p);
    }

    public static double[][] logMatrix(double[][] probs) {
        double[][] logs = new double[probs.length][];
        for (int i = 0; i < probs.length; i++) {
            logs[i] = new double[probs[i].length];
            for (int j = 0; j < probs[i].length; j++) {
                logs[i][j] = safeLog(probs[i][j]);
            }
        }
        return logs;
    }

    /**
     * Returns the index of the maximum value in the array.
     * Ties go to the lowest index; an array of all negative infinities yields 0.
     */
    public static int argmax(double[] x) {
        if (x.length == 0) {
            throw new IllegalArgumentException("Cannot take argmax of an empty array");
        }
        int bestIdx = 0;
        double bestVal = x[0];
        for (int i = 1; i < x.length; i++) {
            if (x[i] > bestVal) {
                bestVal = x[i];
                bestIdx = i;
            }
        }
        return bestIdx;
    }

    public static double sum(double[] x) {
        double s = 0.0;
        for (double v : x) {
            s += v;
        }
        return s;
    }

    public static double[][] copy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            out[i] = m[i].clone();
        }
        return out;
    }
}
