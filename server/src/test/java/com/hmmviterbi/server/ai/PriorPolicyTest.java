package com.hmmviterbi.server.ai;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriorPolicyTest {

    @Test
    void testFromName() {
        assertEquals(PriorPolicy.UNIFORM, PriorPolicy.fromName("uniform"));
        assertEquals(PriorPolicy.STEADY_STATE, PriorPolicy.fromName("steady_state"));
        assertEquals(PriorPolicy.STEADY_STATE, PriorPolicy.fromName(" Steady-State "));
        assertThrows(IllegalArgumentException.class, () -> PriorPolicy.fromName("stationary"));
        assertThrows(IllegalArgumentException.class, () -> PriorPolicy.fromName(""));
        assertThrows(IllegalArgumentException.class, () -> PriorPolicy.fromName(null));
    }

    @Test
    void testPriorForModel() {
        HiddenMarkovModel hmm = HiddenMarkovModel.create(
                new double[][] { { 0.4, 0.4, 0.2 }, { 0.2, 0.4, 0.4 }, { 0.1, 0.3, 0.6 } },
                new double[][] { { 1.0 }, { 1.0 }, { 1.0 } });
        assertArrayEquals(new double[] { 1.0 / 3, 1.0 / 3, 1.0 / 3 }, PriorPolicy.UNIFORM.priorFor(hmm), 1e-15);
        assertArrayEquals(new double[] { 6.0 / 31, 11.0 / 31, 14.0 / 31 }, PriorPolicy.STEADY_STATE.priorFor(hmm),
                1e-9);
    }
}
