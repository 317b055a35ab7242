package io.oraclemesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.oraclemesh.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks key material and patient identifiers before details reach the audit log.
 * Integrity fields and identifiers stay readable.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "secret", "token", "credential", "private", "hmac", "patient", "raw_text"
    );
    private static final Set<String> INTEGRITY_HINTS = Set.of(
            "digest", "hash", "signature", "commitment", "contract"
    );

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        return masked(input, false);
    }

    private static JsonNode masked(JsonNode input, boolean integrityField) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                if (containsHint(key, SENSITIVE_HINTS)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(entry.getValue(), isPublicField(key)));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value, integrityField));
            }
            return out;
        }
        if (!integrityField && input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().valueToTree(MASK);
        }
        return input;
    }

    private static boolean isPublicField(String key) {
        return containsHint(key, INTEGRITY_HINTS) || key.toLowerCase(Locale.ROOT).endsWith("id");
    }

    private static boolean containsHint(String rawKey, Set<String> hints) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : hints) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 40) {
            return false;
        }
        // base64 key material; hex digests outside integrity fields are caught too
        return v.matches("^[A-Za-z0-9+/=_\\-]{40,}$");
    }
}
