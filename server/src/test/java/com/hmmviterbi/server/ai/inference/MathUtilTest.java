package com.hmmviterbi.server.ai.inference;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MathUtilTest {

    @Test
    public void testArgmaxPrefersLowestIndexOnTies() {
        assertEquals(1, MathUtil.argmax(new double[] { 0.1, 0.7, 0.7, 0.2 }));
        assertEquals(0, MathUtil.argmax(new double[] { 3.0, 3.0 }));
    }

    @Test
    public void testArgmaxOfAllNegativeInfinity() {
        double[] x = { Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY };
        assertEquals(0, MathUtil.argmax(x));
    }

    @Test
    public void testArgmaxOfEmptyArray() {
        assertThrows(IllegalArgumentException.class, () -> MathUtil.argmax(new double[0]));
    }

    @Test
    public void testSafeLog() {
        assertEquals(Double.NEGATIVE_INFINITY, MathUtil.safeLog(0.0));
        assertEquals(0.0, MathUtil.safeLog(1.0), 0.0);
        assertEquals(Math.log(0.25), MathUtil.safeLog(0.25), 1e-15);
    }

    @Test
    public void testLogMatrixAndCopy() {
        double[][] m = { { 1.0, 0.0 }, { 0.5, 0.5 } };
        double[][] logs = MathUtil.logMatrix(m);
        assertEquals(0.0, logs[0][0], 0.0);
        assertEquals(Double.NEGATIVE_INFINITY, logs[0][1]);

        double[][] copy = MathUtil.copy(m);
        copy[1][0] = 0.9;
        assertEquals(0.5, m[1][0], 0.0);
        assertEquals(1.0, MathUtil.sum(m[1]), 1e-15);
    }
}
