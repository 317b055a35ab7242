package io.oraclemesh.vocab;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

final class VocabularyTest {

    @Test
    void defaultVocabularyIsLowerCasedInDeclarationOrder() {
        Vocabulary vocab = Vocabulary.loadDefault();

        Assertions.assertEquals("ibuprofen", vocab.drugs().iterator().next());
        Assertions.assertTrue(vocab.symptoms().contains("headache"));
        Assertions.assertTrue(vocab.tests().contains("mri"));
        Assertions.assertTrue(vocab.tests().contains("x-ray"));
    }

    @Test
    void loadsCustomFileAndToleratesMissingLists() throws IOException {
        Path file = Files.createTempFile("oraclemesh-test-vocab-", ".json");
        try {
            Files.writeString(file, "{\"drugs\":[\" Metformin \",\"\"],\"symptoms\":[\"Dizziness\"]}", StandardCharsets.UTF_8);
            Vocabulary vocab = Vocabulary.load(file);

            Assertions.assertEquals(Set.of("metformin"), vocab.drugs());
            Assertions.assertEquals(Set.of("dizziness"), vocab.symptoms());
            Assertions.assertTrue(vocab.tests().isEmpty());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void ofBuildsVocabularyWithoutTests() {
        Vocabulary vocab = Vocabulary.of(Set.of("Aspirin"), Set.of("Fever"));

        Assertions.assertEquals(List.of("aspirin"), List.copyOf(vocab.drugs()));
        Assertions.assertTrue(vocab.tests().isEmpty());
    }
}
