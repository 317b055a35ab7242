package io.oraclemesh.validator;

import io.oraclemesh.model.AnnotatedToken;
import io.oraclemesh.model.EntityLabels;
import io.oraclemesh.model.NodeAttestation;
import io.oraclemesh.model.ValidatedEntity;
import io.oraclemesh.model.ValidationPackage;
import io.oraclemesh.security.NodeKey;
import io.oraclemesh.security.Signer;
import io.oraclemesh.util.CanonicalJson;
import io.oraclemesh.vocab.Vocabulary;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One oracle node. Classifies extractor tokens into validated entities and signs the
 * resulting package with the node's key.
 *
 * <p>Classification order per token: drug vocabulary, symptom vocabulary, test
 * vocabulary, then the extractor's own label. Custom vocabularies always win over the
 * extractor. Entities under the confidence threshold are dropped.
 */
public final class Validator implements OracleNode {
    public static final double DRUG_CONFIDENCE = 0.95d;
    public static final double SYMPTOM_CONFIDENCE = 0.90d;
    public static final double TEST_CONFIDENCE = 0.90d;
    public static final double EXTRACTOR_LABEL_CONFIDENCE = 0.85d;

    private final String nodeId;
    private final NodeKey key;
    private final Signer signer;
    private final double confidenceThreshold;
    private final Clock clock;

    public Validator(String nodeId, NodeKey key, Signer signer, double confidenceThreshold) {
        this(nodeId, key, signer, confidenceThreshold, Clock.systemUTC());
    }

    public Validator(String nodeId, NodeKey key, Signer signer, double confidenceThreshold, Clock clock) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("validator nodeId cannot be empty");
        }
        if (key == null || !nodeId.equals(key.nodeId())) {
            throw new IllegalArgumentException("key does not belong to node: " + nodeId);
        }
        if (confidenceThreshold < 0.0d || confidenceThreshold > 1.0d) {
            throw new IllegalArgumentException("confidence threshold must be within [0,1]: " + confidenceThreshold);
        }
        this.nodeId = nodeId;
        this.key = key;
        this.signer = signer;
        this.confidenceThreshold = confidenceThreshold;
        this.clock = clock;
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    public double confidenceThreshold() {
        return confidenceThreshold;
    }

    public ValidationPackage validate(List<AnnotatedToken> tokens, Vocabulary vocab) {
        List<ValidatedEntity> entities = new ArrayList<>();
        if (tokens != null) {
            for (AnnotatedToken token : tokens) {
                ValidatedEntity entity = classify(token, vocab);
                if (entity != null && entity.confidence() >= confidenceThreshold) {
                    entities.add(entity);
                }
            }
        }
        String status = entities.isEmpty()
                ? ValidationPackage.STATUS_NO_VALID_ENTITIES
                : ValidationPackage.STATUS_VALIDATED;
        return new ValidationPackage(
                entities,
                clock.instant().toString(),
                nodeId,
                ValidationPackage.DEFAULT_SOURCE,
                status
        );
    }

    public NodeAttestation sign(ValidationPackage pkg) {
        if (pkg == null) {
            throw new IllegalArgumentException("package cannot be null");
        }
        String digest = digestOf(pkg);
        return new NodeAttestation(nodeId, pkg, digest, signer.sign(digest, key), signer.scheme());
    }

    /**
     * Runs validation and signing. Returns {@code null} when the node abstains because
     * no entity survived validation.
     */
    @Override
    public NodeAttestation attest(List<AnnotatedToken> tokens, Vocabulary vocab) {
        ValidationPackage pkg = validate(tokens, vocab);
        if (pkg.isEmpty()) {
            return null;
        }
        return sign(pkg);
    }

    public static String digestOf(ValidationPackage pkg) {
        return CanonicalJson.digest(pkg);
    }

    static ValidatedEntity classify(AnnotatedToken token, Vocabulary vocab) {
        if (token == null || token.text().isBlank()) {
            return null;
        }
        String lower = token.text().toLowerCase(Locale.ROOT);
        if (containsAny(lower, vocab.drugs())) {
            return new ValidatedEntity(token.text(), EntityLabels.DRUG, DRUG_CONFIDENCE);
        }
        if (containsAny(lower, vocab.symptoms())) {
            return new ValidatedEntity(token.text(), EntityLabels.SYMPTOM, SYMPTOM_CONFIDENCE);
        }
        // short test acronyms (CT) would hit ordinary words as substrings
        if (vocab.tests().contains(lower)) {
            return new ValidatedEntity(token.text(), EntityLabels.TEST, TEST_CONFIDENCE);
        }
        if (token.hasLabel()) {
            return new ValidatedEntity(token.text(), token.recognizedLabel(), EXTRACTOR_LABEL_CONFIDENCE);
        }
        return null;
    }

    private static boolean containsAny(String lowerText, Iterable<String> terms) {
        for (String term : terms) {
            if (lowerText.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
