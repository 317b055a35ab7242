package io.oraclemesh.extract;

import com.fasterxml.jackson.core.type.TypeReference;
import io.oraclemesh.model.AnnotatedToken;
import io.oraclemesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads tokens that an external NLP service has already annotated.
 *
 * <p>File shape: {@code [{"text":"MRI","recognizedLabel":"ORG"}, {"text":"scan"}]}.
 * The text passed to {@link #extract(String)} is ignored; it is only the audit copy
 * of the original report.
 */
public final class TokenFileExtractor implements EntityExtractor {
    private static final TypeReference<List<AnnotatedToken>> TOKEN_LIST = new TypeReference<>() {
    };

    private final Path tokenFile;

    public TokenFileExtractor(Path tokenFile) {
        this.tokenFile = tokenFile;
    }

    @Override
    public String id() {
        return "token-file";
    }

    @Override
    public List<AnnotatedToken> extract(String text) {
        if (tokenFile == null || !Files.isRegularFile(tokenFile)) {
            throw new ExtractionUnavailableException("token file not found: " + tokenFile);
        }
        try {
            List<AnnotatedToken> tokens = Jsons.mapper().readValue(tokenFile.toFile(), TOKEN_LIST);
            return tokens == null ? List.of() : List.copyOf(tokens);
        } catch (IOException | IllegalArgumentException e) {
            throw new ExtractionUnavailableException("token file unreadable: " + tokenFile, e);
        }
    }
}
