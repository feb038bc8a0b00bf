package com.example.ttlreaper.access;

import io.kubernetes.client.openapi.ApiException;
import java.net.HttpURLConnection;
import lombok.Getter;

/**
 * Failure reported by the cluster API. A status code of 0 means the call never produced an
 * HTTP response (timeout, connection reset).
 */
public class ClusterApiException extends RuntimeException {

    public static final int NO_RESPONSE = 0;

    @Getter
    private final int statusCode;

    public ClusterApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ClusterApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public static ClusterApiException fromApiException(String operation, ApiException ex) {
        return new ClusterApiException(
                "%s failed with status %d: %s".formatted(operation, ex.getCode(), ex.getResponseBody()),
                ex.getCode(), ex);
    }

    public static ClusterApiException transport(String operation, Throwable cause) {
        return new ClusterApiException(operation + " failed without a response: " + cause.getMessage(),
                NO_RESPONSE, cause);
    }

    public boolean isNotFound() {
        return statusCode == HttpURLConnection.HTTP_NOT_FOUND;
    }

    public boolean isDenied() {
        return statusCode == HttpURLConnection.HTTP_UNAUTHORIZED
                || statusCode == HttpURLConnection.HTTP_FORBIDDEN;
    }
}
