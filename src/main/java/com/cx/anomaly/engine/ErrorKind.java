package com.cx.anomaly.engine;

/**
 * Classifies detector failures so callers can tell a bad request from a broken deployment.
 */
public enum ErrorKind {

    CONFIGURATION(false),
    SCHEMA(true),
    INVALID_SELECTION(true),
    NOT_FITTED(false),
    NOT_LOADED(false),
    MODEL_UNAVAILABLE(false),
    ARTIFACT_MISSING(false),
    ARTIFACT_MALFORMED(false),
    ARTIFACT_WRITE(false);

    private final boolean clientError;

    ErrorKind(boolean clientError) {
        this.clientError = clientError;
    }

    /**
     * True when the failure is caused by the caller's input and is recoverable per request.
     */
    public boolean isClientError() {
        return clientError;
    }
}
