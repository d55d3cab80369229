package com.cx.anomaly.engine;

public class DetectorException extends RuntimeException {

    private final ErrorKind kind;

    public DetectorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DetectorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static DetectorException configuration(String message) {
        return new DetectorException(ErrorKind.CONFIGURATION, message);
    }

    public static DetectorException schema(String message) {
        return new DetectorException(ErrorKind.SCHEMA, message);
    }

    public static DetectorException notLoaded() {
        return new DetectorException(ErrorKind.NOT_LOADED, "Models not loaded");
    }
}
