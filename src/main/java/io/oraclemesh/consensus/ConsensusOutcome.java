package io.oraclemesh.consensus;

import io.oraclemesh.model.NodeAttestation;
import io.oraclemesh.model.ValidationPackage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one consensus round; produced once per round.
 *
 * <p>{@code attestations} keeps every submitted slot in node order, {@code null} for
 * nodes that abstained or never answered.
 */
public record ConsensusOutcome(
        boolean approved,
        ValidationPackage canonicalPackage,
        String canonicalNodeId,
        List<String> contributingDigests,
        List<String> contributingSignatures,
        List<NodeAttestation> attestations,
        int validCount,
        int threshold,
        ConsensusPolicy policy,
        boolean unanimous,
        String reason
) {
    public ConsensusOutcome {
        contributingDigests = contributingDigests == null ? List.of() : List.copyOf(contributingDigests);
        contributingSignatures = contributingSignatures == null ? List.of() : List.copyOf(contributingSignatures);
        attestations = attestations == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(attestations));
    }

    /**
     * Approved under the plurality policy while some valid nodes disagreed.
     */
    public boolean partial() {
        return approved && policy == ConsensusPolicy.PLURALITY && !unanimous;
    }

    public static ConsensusOutcome approved(
            NodeAttestation canonical,
            List<NodeAttestation> contributing,
            List<NodeAttestation> attestations,
            int validCount,
            int threshold,
            ConsensusPolicy policy,
            boolean unanimous
    ) {
        List<String> digests = new ArrayList<>();
        List<String> signatures = new ArrayList<>();
        for (NodeAttestation attestation : contributing) {
            digests.add(attestation.digest());
            signatures.add(attestation.signature());
        }
        return new ConsensusOutcome(
                true,
                canonical.validationPackage(),
                canonical.nodeId(),
                digests,
                signatures,
                attestations,
                validCount,
                threshold,
                policy,
                unanimous,
                "consensus reached with " + contributing.size() + " of " + attestations.size() + " nodes"
        );
    }

    public static ConsensusOutcome failed(
            List<NodeAttestation> attestations,
            int validCount,
            int threshold,
            ConsensusPolicy policy,
            String reason
    ) {
        return new ConsensusOutcome(
                false,
                null,
                null,
                List.of(),
                List.of(),
                attestations,
                validCount,
                threshold,
                policy,
                false,
                reason
        );
    }
}
