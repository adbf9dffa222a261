package com.hmmviterbi.util;

public class ArgumentParseException extends IllegalArgumentException {

    public ArgumentParseException(String message) {
        super(message);
    }

    public ArgumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
