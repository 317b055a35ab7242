package io.oraclemesh.extract;

import io.oraclemesh.model.AnnotatedToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text on whitespace and strips surrounding punctuation. Tokens carry no
 * extractor label, so only the custom vocabularies can classify them.
 */
public final class WhitespaceTokenExtractor implements EntityExtractor {
    @Override
    public String id() {
        return "whitespace";
    }

    @Override
    public List<AnnotatedToken> extract(String text) {
        if (text == null) {
            throw new ExtractionUnavailableException("no input text");
        }
        List<AnnotatedToken> out = new ArrayList<>();
        for (String raw : text.trim().split("\\s+")) {
            String token = stripPunctuation(raw);
            if (!token.isEmpty()) {
                out.add(AnnotatedToken.plain(token));
            }
        }
        return out;
    }

    static String stripPunctuation(String raw) {
        int start = 0;
        int end = raw.length();
        while (start < end && !Character.isLetterOrDigit(raw.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(raw.charAt(end - 1))) {
            end--;
        }
        return raw.substring(start, end);
    }
}
