package io.oraclemesh.consensus;

import io.oraclemesh.model.NodeAttestation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Attestations in node order, {@code null} where a node abstained, failed or timed out.
 */
public record GatherResult(
        List<NodeAttestation> attestations,
        List<NodeReport> reports
) {
    public GatherResult {
        attestations = Collections.unmodifiableList(new ArrayList<>(attestations));
        reports = List.copyOf(reports);
    }

    public long count(NodeReport.Status status) {
        return reports.stream().filter(r -> r.status() == status).count();
    }
}
