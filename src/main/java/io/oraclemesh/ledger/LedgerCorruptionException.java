package io.oraclemesh.ledger;

/**
 * A second commit under an existing key carried a different digest. The append-only
 * guarantee is already broken upstream; callers must not recover locally.
 */
public class LedgerCorruptionException extends IllegalStateException {
    private final String storeKey;
    private final String storedDigest;
    private final String attemptedDigest;

    public LedgerCorruptionException(String storeKey, String storedDigest, String attemptedDigest) {
        super("ledger key " + storeKey + " already committed with digest " + storedDigest
                + ", refusing digest " + attemptedDigest);
        this.storeKey = storeKey;
        this.storedDigest = storedDigest;
        this.attemptedDigest = attemptedDigest;
    }

    public String storeKey() {
        return storeKey;
    }

    public String storedDigest() {
        return storedDigest;
    }

    public String attemptedDigest() {
        return attemptedDigest;
    }
}
