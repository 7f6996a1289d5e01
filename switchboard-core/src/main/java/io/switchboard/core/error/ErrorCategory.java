package io.switchboard.core.error;

public enum ErrorCategory {
    INVALID_REQUEST(400, "invalid_request_error"),
    UNAUTHORIZED(401, "authentication_error"),
    NOT_FOUND(404, "not_found_error"),
    RATE_LIMITED(429, "rate_limit_error"),
    CONFIGURATION(500, "api_error"),
    UPSTREAM(502, "api_error");

    private final int httpStatus;
    private final String errorType;

    ErrorCategory(int httpStatus, String errorType) {
        this.httpStatus = httpStatus;
        this.errorType = errorType;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String errorType() {
        return errorType;
    }
}
