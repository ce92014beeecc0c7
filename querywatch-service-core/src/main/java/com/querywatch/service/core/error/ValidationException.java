package com.querywatch.service.core.error;

/**
 * Caller supplied filter or column input that cannot be used. Raised before any store call.
 */
public class ValidationException extends IllegalArgumentException {

    public static final String INVALID_PARAMETERS = "invalid_parameters";
    public static final String INVALID_COLUMNS = "invalid_columns";
    public static final String MISSING_COLUMNS = "missing_columns";
    public static final String MISSING_PARAMETER = "missing_parameter";

    private final String kind;

    public ValidationException(String kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ValidationException(String kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /** Machine-readable error kind, e.g. {@code invalid_columns}. */
    public String kind() {
        return kind;
    }
}
