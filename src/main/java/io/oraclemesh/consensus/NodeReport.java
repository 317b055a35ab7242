package io.oraclemesh.consensus;

public record NodeReport(
        String nodeId,
        Status status,
        String error,
        long elapsedMs
) {
    public enum Status {
        ATTESTED,
        ABSTAINED,
        TIMED_OUT,
        FAILED
    }
}
