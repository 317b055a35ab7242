package io.oraclemesh.security;

import java.util.Locale;

public final class Signers {
    private Signers() {
    }

    public static Signer forScheme(String scheme, NodeKeyring keyring) {
        String normalized = scheme == null ? "" : scheme.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "", "hmac-sha256" -> new HmacSigner(keyring);
            case "ed25519" -> new Ed25519Signer(keyring);
            default -> throw new IllegalArgumentException("Unknown signature scheme: " + scheme);
        };
    }
}
