package com.proxyhub.aggregator.probe;

/**
 * Raised by a prober's raw connectivity test when the candidate cannot be reached.
 */
public class ProbeException extends Exception {
    private final String errorType;

    public ProbeException(String errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ProbeException(String errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public String errorType() {
        return errorType;
    }
}
