package com.hmmviterbi.server.ai;

public class DecoderConfig {
    public double tolerance = HiddenMarkovModel.DEFAULT_TOLERANCE;
    public String priorPolicy = "uniform";
    public boolean traceTransitions = false;

    public DecoderConfig() {
    }

    public DecoderConfig(double tolerance, String priorPolicy, boolean traceTransitions) {
        this.tolerance = tolerance;
        this.priorPolicy = priorPolicy;
        this.traceTransitions = traceTransitions;
    }

    public static DecoderConfig defaults() {
        return new DecoderConfig(HiddenMarkovModel.DEFAULT_TOLERANCE, "uniform", false);
    }

    public PriorPolicy resolvePriorPolicy() {
        return PriorPolicy.fromName(priorPolicy);
    }

    public ViterbiDecoder newDecoder() {
        TransitionObserver observer = traceTransitions ? new LoggingTransitionObserver() : TransitionObserver.NONE;
        return new ViterbiDecoder(resolvePriorPolicy(), observer, tolerance);
    }

    public DecoderConfig copy() {
        return new DecoderConfig(this.tolerance, this.priorPolicy, this.traceTransitions);
    }
}
