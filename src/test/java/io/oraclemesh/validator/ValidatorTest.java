package io.oraclemesh.validator;

import io.oraclemesh.model.AnnotatedToken;
import io.oraclemesh.model.EntityLabels;
import io.oraclemesh.model.NodeAttestation;
import io.oraclemesh.model.ValidatedEntity;
import io.oraclemesh.model.ValidationPackage;
import io.oraclemesh.security.HmacSigner;
import io.oraclemesh.security.NodeKeyring;
import io.oraclemesh.vocab.Vocabulary;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

final class ValidatorTest {
    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final NodeKeyring keyring = NodeKeyring.inMemory();
    private final HmacSigner signer = new HmacSigner(keyring);
    private final Vocabulary vocab = Vocabulary.loadDefault();

    private Validator validator(String nodeId, double threshold) {
        return new Validator(nodeId, keyring.keyFor(nodeId), signer, threshold, FIXED);
    }

    @Test
    void classifiesByVocabularyBeforeExtractorLabel() {
        ValidationPackage pkg = validator("oracle-a", 0.7d).validate(List.of(
                AnnotatedToken.labelled("Ibuprofen", "ORG"),
                AnnotatedToken.plain("headache"),
                AnnotatedToken.plain("MRI"),
                AnnotatedToken.labelled("Boston", "GPE"),
                AnnotatedToken.plain("the")
        ), vocab);

        Assertions.assertEquals(List.of(
                new ValidatedEntity("Ibuprofen", EntityLabels.DRUG, 0.95d),
                new ValidatedEntity("headache", EntityLabels.SYMPTOM, 0.90d),
                new ValidatedEntity("MRI", EntityLabels.TEST, 0.90d),
                new ValidatedEntity("Boston", "GPE", 0.85d)
        ), pkg.entities());
        Assertions.assertEquals(ValidationPackage.STATUS_VALIDATED, pkg.status());
        Assertions.assertEquals(ValidationPackage.DEFAULT_SOURCE, pkg.source());
        Assertions.assertEquals("oracle-a", pkg.sourceNodeId());
    }

    @Test
    void drugVocabularyMatchesSubstringAndWinsOverSymptom() {
        ValidationPackage pkg = validator("oracle-a", 0.7d).validate(List.of(
                AnnotatedToken.plain("aspirin-for-headache"),
                AnnotatedToken.plain("headaches")
        ), vocab);

        Assertions.assertEquals(EntityLabels.DRUG, pkg.entities().get(0).label());
        Assertions.assertEquals(EntityLabels.SYMPTOM, pkg.entities().get(1).label());
    }

    @Test
    void testVocabularyRequiresWholeToken() {
        ValidationPackage pkg = validator("oracle-a", 0.7d).validate(List.of(
                AnnotatedToken.plain("doctor"),
                AnnotatedToken.plain("ct")
        ), vocab);

        Assertions.assertEquals(1, pkg.entities().size());
        Assertions.assertEquals("ct", pkg.entities().get(0).text());
        Assertions.assertEquals(EntityLabels.TEST, pkg.entities().get(0).label());
    }

    @Test
    void dropsEntitiesBelowConfidenceThreshold() {
        ValidationPackage pkg = validator("oracle-a", 0.9d).validate(List.of(
                AnnotatedToken.plain("fever"),
                AnnotatedToken.labelled("Boston", "GPE")
        ), vocab);

        Assertions.assertEquals(List.of(new ValidatedEntity("fever", EntityLabels.SYMPTOM, 0.90d)), pkg.entities());
    }

    @Test
    void abstainsWhenNothingSurvives() {
        Validator validator = validator("oracle-a", 0.7d);
        List<AnnotatedToken> tokens = List.of(AnnotatedToken.plain("patient"), AnnotatedToken.plain("rested"));

        ValidationPackage pkg = validator.validate(tokens, vocab);
        Assertions.assertTrue(pkg.isEmpty());
        Assertions.assertEquals(ValidationPackage.STATUS_NO_VALID_ENTITIES, pkg.status());
        Assertions.assertNull(validator.attest(tokens, vocab));
        Assertions.assertNull(validator.attest(List.of(), vocab));
    }

    @Test
    void digestIsDeterministicAndSignaturesAreNodeBound() {
        List<AnnotatedToken> tokens = List.of(AnnotatedToken.plain("ibuprofen"), AnnotatedToken.plain("headache"));
        Validator a = validator("oracle-a", 0.7d);
        Validator b = validator("oracle-b", 0.7d);

        NodeAttestation first = a.attest(tokens, vocab);
        NodeAttestation second = a.attest(tokens, vocab);
        NodeAttestation other = b.attest(tokens, vocab);

        Assertions.assertEquals(first.digest(), second.digest());
        Assertions.assertEquals(first.signature(), second.signature());
        Assertions.assertEquals(64, first.digest().length());
        Assertions.assertEquals(first.digest(), Validator.digestOf(first.validationPackage()));
        Assertions.assertNotEquals(first.signature(), other.signature());
        Assertions.assertTrue(signer.verify(first.digest(), first.signature(), "oracle-a"));
        Assertions.assertFalse(signer.verify(first.digest(), first.signature(), "oracle-b"));
        Assertions.assertEquals("hmac-sha256", first.signatureScheme());
    }

    @Test
    void rejectsKeyOfAnotherNode() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new Validator("oracle-a", keyring.keyFor("oracle-b"), signer, 0.7d));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new Validator("oracle-a", keyring.keyFor("oracle-a"), signer, 1.5d));
    }

    @Test
    void registryKeepsSubmissionOrderAndRejectsHumanIds() {
        ValidatorRegistry registry = new ValidatorRegistry();
        registry.register(validator("oracle-b", 0.7d));
        registry.register(validator("oracle-a", 0.7d));

        Assertions.assertEquals(List.of("oracle-b", "oracle-a"), registry.listNodeIds());
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register(validator("oracle-a", 0.7d)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register(validator("HITL_007", 0.7d)));
        Assertions.assertTrue(registry.findById("oracle-b").isPresent());
    }
}
