package com.hmmviterbi.server.util;

import com.hmmviterbi.server.ai.DecoderConfig;
import com.hmmviterbi.server.ai.PriorPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DecoderConfigResolverTest {

    @AfterEach
    public void clearProperties() {
        System.clearProperty(DecoderConfigResolver.PRIOR_POLICY_PROPERTY);
        System.clearProperty(DecoderConfigResolver.TOLERANCE_PROPERTY);
        System.clearProperty(DecoderConfigResolver.TRACE_PROPERTY);
    }

    @Test
    public void testLoadDefaultConfigFile() {
        DecoderConfig config = DecoderConfigResolver.resolve();
        assertEquals(PriorPolicy.UNIFORM, config.resolvePriorPolicy());
        assertEquals(1e-6, config.tolerance, 1e-15);
        assertFalse(config.traceTransitions);
    }

    @Test
    public void testLoadAlternateConfigFile() {
        DecoderConfig config = DecoderConfigResolver.resolve("/viterbi_config_steady.json");
        assertEquals(PriorPolicy.STEADY_STATE, config.resolvePriorPolicy());
        assertEquals(1e-4, config.tolerance, 1e-15);
        assertTrue(config.traceTransitions);
        assertEquals(PriorPolicy.STEADY_STATE, config.newDecoder().getPriorPolicy());
    }

    @Test
    public void testDefaultsForMissingResource() {
        DecoderConfig config = DecoderConfigResolver.resolve("/does_not_exist.json");
        assertEquals("uniform", config.priorPolicy);
        assertEquals(1e-6, config.tolerance, 1e-15);
    }

    @Test
    public void testSystemPropertiesOverrideFile() {
        System.setProperty(DecoderConfigResolver.PRIOR_POLICY_PROPERTY, "steady-state");
        System.setProperty(DecoderConfigResolver.TOLERANCE_PROPERTY, "0.001");
        System.setProperty(DecoderConfigResolver.TRACE_PROPERTY, "true");

        DecoderConfig config = DecoderConfigResolver.resolve();
        assertEquals(PriorPolicy.STEADY_STATE, config.resolvePriorPolicy());
        assertEquals(0.001, config.tolerance, 1e-15);
        assertTrue(config.traceTransitions);
    }

    @Test
    public void testInvalidSettingsFailFast() {
        assertThrows(IllegalArgumentException.class,
                () -> DecoderConfigResolver.resolve("/viterbi_config_bad_policy.json"));

        System.setProperty(DecoderConfigResolver.TOLERANCE_PROPERTY, "tiny");
        assertThrows(IllegalArgumentException.class, DecoderConfigResolver::resolve);

        System.setProperty(DecoderConfigResolver.TOLERANCE_PROPERTY, "-1");
        assertThrows(IllegalArgumentException.class, DecoderConfigResolver::resolve);
    }
}
