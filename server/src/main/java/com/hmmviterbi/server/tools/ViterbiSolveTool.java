package com.hmmviterbi.server.tools;

import com.hmmviterbi.server.ai.DecodeResult;
import com.hmmviterbi.server.ai.DecoderConfig;
import com.hmmviterbi.server.ai.HiddenMarkovModel;
import com.hmmviterbi.server.ai.LoggingTransitionObserver;
import com.hmmviterbi.server.ai.PriorPolicy;
import com.hmmviterbi.server.ai.ViterbiDecoder;
import com.hmmviterbi.server.util.DecoderConfigResolver;
import com.hmmviterbi.util.MatrixArgumentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Offline tool that decodes one observation sequence from the command line.
 * Usage: ViterbiSolveTool <transition> <emission> <sequence> [--prior=uniform|steady_state]
 *
 * Example: ViterbiSolveTool "[[0.8,0.2],[0.5,0.5]]" "[[0.4,0.6],[0.7,0.3]]" "[0,0,1,0]"
 */
public class ViterbiSolveTool {

    private static final Logger logger = LoggerFactory.getLogger(ViterbiSolveTool.class);
    private static final String PRIOR_FLAG = "--prior=";

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        if (args.length < 3 || args.length > 4) {
            System.err.println(
                    "Usage: ViterbiSolveTool <transition> <emission> <sequence> [--prior=uniform|steady_state]");
            return 1;
        }

        try {
            DecoderConfig config = DecoderConfigResolver.resolve();
            PriorPolicy policy = config.resolvePriorPolicy();
            if (args.length == 4) {
                if (!args[3].startsWith(PRIOR_FLAG)) {
                    System.err.println("Unknown option: " + args[3]);
                    return 1;
                }
                policy = PriorPolicy.fromName(args[3].substring(PRIOR_FLAG.length()));
            }

            DecodeResult result = solve(args[0], args[1], args[2], policy, config.tolerance);
            logger.info("Most likely path: {}", Arrays.toString(result.getPath()));
            logger.info("Path probability: {} (log {})", result.getProbability(), result.getLogProbability());
            return 0;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error("Solve failed: {}", e.getMessage());
            return 1;
        }
    }

    public static DecodeResult solve(String transition, String emission, String sequence, PriorPolicy policy,
            double tolerance) {
        double[][] t = MatrixArgumentParser.parseMatrix(transition);
        double[][] e = MatrixArgumentParser.parseMatrix(emission);
        int[] observations = MatrixArgumentParser.parseIntList(sequence);

        HiddenMarkovModel hmm = HiddenMarkovModel.create(t, e, tolerance);
        logger.info("Solving {} with {} observations, prior {}", hmm, observations.length, policy);

        ViterbiDecoder decoder = new ViterbiDecoder(policy, new LoggingTransitionObserver(), tolerance);
        return decoder.decode(hmm, observations);
    }
}
