package com.hmmviterbi.server.ai;

public class InvalidObservationException extends IllegalArgumentException {

    public enum Kind {
        EMPTY_SEQUENCE,
        SYMBOL_OUT_OF_RANGE
    }

    private final Kind kind;
    private final int position;

    public InvalidObservationException(Kind kind, int position, String message) {
        super(message);
        this.kind = kind;
        this.position = position;
    }

    public Kind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }
}
