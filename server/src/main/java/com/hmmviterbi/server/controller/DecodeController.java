package com.hmmviterbi.server.controller;

import com.hmmviterbi.server.ai.DecodeResult;
import com.hmmviterbi.server.ai.PriorPolicy;
import com.hmmviterbi.server.service.ViterbiDecodingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;

@RestController
public class DecodeController {

    private static final Logger logger = LoggerFactory.getLogger(DecodeController.class);
    private final ViterbiDecodingService decodingService;

    public DecodeController(ViterbiDecodingService decodingService) {
        this.decodingService = decodingService;
    }

    public static class DecodeRequest {
        public double[][] transition;
        public double[][] emission;
        public int[] observations;
        // Optional: explicit initial distribution, or a policy name ("uniform", "steady_state")
        public double[] prior;
        public String priorPolicy;
    }

    public static class ModelRequest {
        public double[][] transition;
        public double[][] emission;
    }

    public static class DecodeResponse {
        public int[] path;
        public double probability;
        public double logProbability;
        public double[] prior;
        public String priorPolicy;

        public DecodeResponse(DecodeResult result, String priorPolicy) {
            this.path = result.getPath();
            this.probability = result.getProbability();
            this.logProbability = result.getLogProbability();
            this.prior = result.getPrior();
            this.priorPolicy = priorPolicy;
        }
    }

    public static class SteadyStateResponse {
        public double[] probabilities;

        public SteadyStateResponse(double[] probabilities) {
            this.probabilities = probabilities;
        }
    }

    @PostMapping("/decode")
    public ResponseEntity<?> decode(@RequestBody DecodeRequest request) {
        if (request == null || request.transition == null || request.emission == null
                || request.observations == null) {
            return ResponseEntity.badRequest().body("transition, emission and observations are required.");
        }

        logger.info("Received decode request for {} observations.", request.observations.length);

        try {
            DecodeResult result = decodingService.decode(request.transition, request.emission,
                    request.observations, request.priorPolicy, request.prior);
            return ResponseEntity.ok(new DecodeResponse(result, describePrior(request)));
        } catch (IllegalArgumentException e) {
            logger.info("Rejected decode request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (IllegalStateException e) {
            logger.info("Cannot decode with requested prior: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(e.getMessage());
        }
    }

    @PostMapping("/steady-state")
    public ResponseEntity<?> steadyState(@RequestBody ModelRequest request) {
        if (request == null || request.transition == null || request.emission == null) {
            return ResponseEntity.badRequest().body("transition and emission are required.");
        }

        try {
            double[] w = decodingService.steadyState(request.transition, request.emission);
            return ResponseEntity.ok(new SteadyStateResponse(w));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(e.getMessage());
        }
    }

    private String describePrior(DecodeRequest request) {
        if (request.prior != null) {
            return "explicit";
        }
        if (request.priorPolicy != null && !request.priorPolicy.trim().isEmpty()) {
            return PriorPolicy.fromName(request.priorPolicy).name().toLowerCase(Locale.ROOT);
        }
        return decodingService.getConfig().resolvePriorPolicy().name().toLowerCase(Locale.ROOT);
    }
}
