package com.limetext.sampling;

public class PredictionContractException extends RuntimeException {
    private final int expected;
    private final int actual;

    public PredictionContractException(String message, int expected, int actual) {
        super(message + ": 期望 " + expected + ", 实际 " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public PredictionContractException(String message) {
        super(message);
        this.expected = -1;
        this.actual = -1;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
