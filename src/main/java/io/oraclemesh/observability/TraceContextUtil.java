package io.oraclemesh.observability;

import io.oraclemesh.util.Hashing;

import java.security.SecureRandom;

public final class TraceContextUtil {
    private static final SecureRandom RANDOM = new SecureRandom();

    private TraceContextUtil() {
    }

    public static String newTraceId() {
        return randomHex(16); // 32 hex chars
    }

    public static String newRunId() {
        return "run_" + randomHex(8);
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        return Hashing.toHex(value);
    }
}
