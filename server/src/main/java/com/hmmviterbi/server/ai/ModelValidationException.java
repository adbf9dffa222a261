package com.hmmviterbi.server.ai;

/**
 * Thrown when transition, emission or prior parameters do not describe a
 * valid discrete HMM.
 */
public class ModelValidationException extends IllegalArgumentException {

    public enum Kind {
        SHAPE_MISMATCH,
        NON_STOCHASTIC_ROW,
        OUT_OF_RANGE_VALUE
    }

    public static final int NO_ROW = -1;

    private final Kind kind;
    private final String matrixName;
    private final int row;

    public ModelValidationException(Kind kind, String matrixName, int row, String message) {
        super(message);
        this.kind = kind;
        this.matrixName = matrixName;
        this.row = row;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * "transition", "emission" or "prior".
     */
    public String getMatrixName() {
        return matrixName;
    }

    /**
     * Offending row, or {@link #NO_ROW} when the failure concerns the whole matrix.
     */
    public int getRow() {
        return row;
    }
}
