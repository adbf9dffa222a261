package com.hmmviterbi.server.service;

import com.hmmviterbi.server.ai.DecodeResult;
import com.hmmviterbi.server.ai.DecoderConfig;
import com.hmmviterbi.server.ai.HiddenMarkovModel;
import com.hmmviterbi.server.ai.LoggingTransitionObserver;
import com.hmmviterbi.server.ai.PriorPolicy;
import com.hmmviterbi.server.ai.TransitionObserver;
import com.hmmviterbi.server.ai.ViterbiDecoder;
import com.hmmviterbi.server.util.DecoderConfigResolver;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;

@Service
public class ViterbiDecodingService {

    private static final Logger logger = LoggerFactory.getLogger(ViterbiDecodingService.class);

    private DecoderConfig config = DecoderConfig.defaults();
    private ViterbiDecoder defaultDecoder = config.newDecoder();

    @PostConstruct
    public void init() {
        this.config = DecoderConfigResolver.resolve();
        this.defaultDecoder = config.newDecoder();
        logger.info("Viterbi decoding service ready (prior policy {})", defaultDecoder.getPriorPolicy());
    }

    public DecoderConfig getConfig() {
        return config.copy();
    }

    public HiddenMarkovModel buildModel(double[][] transition, double[][] emission) {
        return HiddenMarkovModel.create(transition, emission, config.tolerance);
    }

    /**
     * Builds the model and decodes one sequence.
     *
     * @param priorPolicyName overrides the configured policy when non-null
     * @param prior           explicit initial distribution; wins over any policy
     */
    public DecodeResult decode(double[][] transition, double[][] emission, int[] observations,
            String priorPolicyName, double[] prior) {
        HiddenMarkovModel model = buildModel(transition, emission);

        ViterbiDecoder decoder = defaultDecoder;
        if (priorPolicyName != null && !priorPolicyName.trim().isEmpty()) {
            PriorPolicy policy = PriorPolicy.fromName(priorPolicyName);
            TransitionObserver observer = config.traceTransitions ? new LoggingTransitionObserver()
                    : TransitionObserver.NONE;
            decoder = new ViterbiDecoder(policy, observer, config.tolerance);
        }

        DecodeResult result = prior != null
                ? decoder.decode(model, observations, prior)
                : decoder.decode(model, observations);

        logger.info("Decoded {} observations: path={}, log p={}", observations.length,
                Arrays.toString(result.getPath()), result.getLogProbability());
        return result;
    }

    public double[] steadyState(double[][] transition, double[][] emission) {
        return buildModel(transition, emission).steadyStateProbabilities();
    }
}
