package io.oraclemesh.arbitration;

public class ArbitrationUnavailableException extends RuntimeException {
    public ArbitrationUnavailableException(String message) {
        super(message);
    }

    public ArbitrationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
