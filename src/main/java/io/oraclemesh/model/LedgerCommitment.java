package io.oraclemesh.model;

public record LedgerCommitment(
        String storeKey,
        String digest,
        String committedAt,
        String contractAddress
) {
}
