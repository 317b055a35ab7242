package io.oraclemesh.extract;

import io.oraclemesh.model.AnnotatedToken;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class EntityExtractorTest {

    @Test
    void whitespaceExtractorStripsPunctuation() {
        List<AnnotatedToken> tokens = new WhitespaceTokenExtractor().extract("  Took ibuprofen, for (headache)...  ");

        Assertions.assertEquals(List.of(
                AnnotatedToken.plain("Took"),
                AnnotatedToken.plain("ibuprofen"),
                AnnotatedToken.plain("for"),
                AnnotatedToken.plain("headache")
        ), tokens);
        Assertions.assertTrue(new WhitespaceTokenExtractor().extract("   ").isEmpty());
        Assertions.assertEquals("X-ray", WhitespaceTokenExtractor.stripPunctuation("\"X-ray\","));
    }

    @Test
    void whitespaceExtractorWithoutTextIsUnavailable() {
        Assertions.assertThrows(ExtractionUnavailableException.class, () -> new WhitespaceTokenExtractor().extract(null));
    }

    @Test
    void tokenFileExtractorReadsAnnotatedTokens() throws IOException {
        Path file = Files.createTempFile("oraclemesh-test-tokens-", ".json");
        try {
            Files.writeString(file, "[{\"text\":\"MRI\",\"recognizedLabel\":\"ORG\"},{\"text\":\"scan\",\"recognizedLabel\":\"\"}]",
                    StandardCharsets.UTF_8);
            List<AnnotatedToken> tokens = new TokenFileExtractor(file).extract("ignored");

            Assertions.assertEquals(List.of(AnnotatedToken.labelled("MRI", "ORG"), AnnotatedToken.plain("scan")), tokens);
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void tokenFileExtractorFailsOnMissingOrBrokenFile() throws IOException {
        Path file = Files.createTempFile("oraclemesh-test-tokens-bad-", ".json");
        try {
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(ExtractionUnavailableException.class, () -> new TokenFileExtractor(file).extract(""));
            Assertions.assertThrows(ExtractionUnavailableException.class,
                    () -> new TokenFileExtractor(file.resolveSibling("missing-tokens.json")).extract(""));
        } finally {
            Files.deleteIfExists(file);
        }
    }
}
