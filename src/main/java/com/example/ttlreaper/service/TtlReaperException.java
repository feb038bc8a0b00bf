package com.example.ttlreaper.service;

import lombok.Getter;

public class TtlReaperException extends RuntimeException {

    public enum Code {
        MISSING_REQUIRED_FIELD,
        INVALID_API_VERSION,
        INVALID_LABEL_SELECTOR,
        INVALID_TTL_VALUE,
        TRANSIENT_LIST_ERROR,
        UNKNOWN
    }

    @Getter
    private final Code code;

    private TtlReaperException(Code code, String message) {
        super(message);
        this.code = code;
    }

    private TtlReaperException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Errors that only a policy edit can clear.
     */
    public boolean isConfigError() {
        return code == Code.MISSING_REQUIRED_FIELD
                || code == Code.INVALID_API_VERSION
                || code == Code.INVALID_LABEL_SELECTOR;
    }

    public static TtlReaperException missingRequiredField(String detail) {
        return new TtlReaperException(Code.MISSING_REQUIRED_FIELD,
                "Required field missing or invalid: " + detail);
    }

    public static TtlReaperException invalidApiVersion(String apiVersion) {
        return new TtlReaperException(Code.INVALID_API_VERSION,
                "API version '" + apiVersion + "' is not of the form group/version or version");
    }

    public static TtlReaperException invalidLabelSelector(String detail) {
        return new TtlReaperException(Code.INVALID_LABEL_SELECTOR,
                "Label selector is invalid: " + detail);
    }

    public static TtlReaperException invalidTtlValue(String fieldPath, Object value) {
        return new TtlReaperException(Code.INVALID_TTL_VALUE,
                "TTL value at " + fieldPath + " is not a non-negative integer: " + value);
    }

    public static TtlReaperException transientList(String what, Throwable cause) {
        return new TtlReaperException(Code.TRANSIENT_LIST_ERROR,
                "Failed to list " + what + ": " + cause.getMessage(), cause);
    }
}
