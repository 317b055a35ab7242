package io.oraclemesh.extract;

public class ExtractionUnavailableException extends RuntimeException {
    public ExtractionUnavailableException(String message) {
        super(message);
    }

    public ExtractionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
