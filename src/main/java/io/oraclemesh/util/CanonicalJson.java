package io.oraclemesh.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stable JSON form used for every digest in the pipeline.
 *
 * <p>Object keys are sorted at every depth, arrays keep their order, output is
 * compact. Two values with equal content always produce byte-identical text.
 */
public final class CanonicalJson {
    private CanonicalJson() {
    }

    public static String canonicalize(Object value) {
        ObjectMapper mapper = Jsons.compactMapper();
        JsonNode node = value instanceof JsonNode json ? json : mapper.valueToTree(value);
        try {
            return mapper.writeValueAsString(normalize(mapper, node));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to canonicalize JSON", e);
        }
    }

    public static String digest(Object value) {
        return Hashing.sha256Hex(canonicalize(value));
    }

    private static JsonNode normalize(ObjectMapper mapper, JsonNode node) {
        if (node == null || node.isNull()) {
            return NullNode.getInstance();
        }
        if (node.isObject()) {
            ObjectNode out = mapper.createObjectNode();
            List<String> fields = new ArrayList<>();
            node.fieldNames().forEachRemaining(fields::add);
            Collections.sort(fields);
            for (String field : fields) {
                out.set(field, normalize(mapper, node.get(field)));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = mapper.createArrayNode();
            for (JsonNode item : node) {
                out.add(normalize(mapper, item));
            }
            return out;
        }
        return node;
    }
}
