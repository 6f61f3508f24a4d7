package com.stocksignal.strategy;

/**
 * Raised when an instrument/date has fewer bars than scoring requires. Only that unit of work
 * fails; batch drivers count it as skipped and move on.
 */
public final class InsufficientHistoryException extends IllegalStateException {
    private final String code;
    private final int required;
    private final int actual;

    public InsufficientHistoryException(String code, int required, int actual) {
        super("insufficient history code=" + (code == null ? "" : code) + " required=" + required + " actual=" + actual);
        this.code = code == null ? "" : code;
        this.required = required;
        this.actual = actual;
    }

    public String code() {
        return code;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }
}
