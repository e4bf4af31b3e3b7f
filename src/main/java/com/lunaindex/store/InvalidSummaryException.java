package com.lunaindex.store;

public class InvalidSummaryException extends Exception {
    private static final long serialVersionUID = 1L;

    public InvalidSummaryException(String message) {
        super(message);
    }

    public InvalidSummaryException(String message, Throwable cause) {
        super(message, cause);
    }
}
