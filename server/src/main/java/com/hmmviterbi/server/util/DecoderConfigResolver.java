package com.hmmviterbi.server.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hmmviterbi.server.ai.DecoderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Resolves decoder settings: system properties override the JSON resource,
 * which overrides the built-in defaults.
 */
public class DecoderConfigResolver {
    private static final Logger logger = LoggerFactory.getLogger(DecoderConfigResolver.class);

    public static final String CONFIG_RESOURCE = "/viterbi_config.json";
    public static final String PRIOR_POLICY_PROPERTY = "viterbi.prior.policy";
    public static final String TOLERANCE_PROPERTY = "viterbi.tolerance";
    public static final String TRACE_PROPERTY = "viterbi.trace.transitions";

    public static DecoderConfig resolve() {
        return resolve(CONFIG_RESOURCE);
    }

    public static DecoderConfig resolve(String resourcePath) {
        DecoderConfig config = load(resourcePath);

        String policy = System.getProperty(PRIOR_POLICY_PROPERTY);
        if (policy != null && !policy.isEmpty()) {
            config.priorPolicy = policy;
        }
        String tolerance = System.getProperty(TOLERANCE_PROPERTY);
        if (tolerance != null && !tolerance.isEmpty()) {
            try {
                config.tolerance = Double.parseDouble(tolerance);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + TOLERANCE_PROPERTY + ": " + tolerance, e);
            }
        }
        String trace = System.getProperty(TRACE_PROPERTY);
        if (trace != null && !trace.isEmpty()) {
            config.traceTransitions = Boolean.parseBoolean(trace);
        }

        // fail fast on a misspelled policy rather than at the first decode
        config.resolvePriorPolicy();
        if (!(config.tolerance >= 0.0)) {
            throw new IllegalArgumentException("Tolerance must be non-negative, got " + config.tolerance);
        }
        logger.info("Decoder config: priorPolicy={}, tolerance={}, traceTransitions={}",
                config.priorPolicy, config.tolerance, config.traceTransitions);
        return config;
    }

    private static DecoderConfig load(String resourcePath) {
        try (InputStream is = DecoderConfigResolver.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("Config resource {} not found, using defaults", resourcePath);
                return DecoderConfig.defaults();
            }
            ObjectMapper mapper = new ObjectMapper();
            DecoderConfig config = mapper.readValue(is, DecoderConfig.class);
            return config != null ? config : DecoderConfig.defaults();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read decoder config from " + resourcePath, e);
        }
    }
}
