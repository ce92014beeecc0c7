package com.querywatch.service.core.model;

/** Lifecycle phase of a logged query event, as stored in the {@code type} column. */
public enum QueryPhase {
    QUERY_START("QueryStart"),
    QUERY_FINISH("QueryFinish"),
    EXCEPTION_BEFORE_START("ExceptionBeforeStart"),
    EXCEPTION_WHILE_PROCESSING("ExceptionWhileProcessing");

    private final String wireValue;

    QueryPhase(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /** Failed means a non-zero exception code, or an event rejected before it started. */
    public static boolean isFailed(String type, long exceptionCode) {
        return exceptionCode != 0 || EXCEPTION_BEFORE_START.wireValue.equals(type);
    }
}
