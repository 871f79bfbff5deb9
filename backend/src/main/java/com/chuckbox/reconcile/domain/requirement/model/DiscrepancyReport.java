package com.chuckbox.reconcile.domain.requirement.model;

import java.util.List;
import java.util.Map;

/**
 * Discrepancies of one reconciliation run.
 *
 * @param entries           findings in emission order
 * @param unmatchedByFormat unmatched identifier counts per grammar, for triage only
 */
public record DiscrepancyReport(
        List<DiscrepancyEntry> entries,
        Map<IdFormat, Integer> unmatchedByFormat
) {
    public List<DiscrepancyEntry> ofKind(DiscrepancyKind kind) {
        return entries.stream().filter(e -> e.kind() == kind).toList();
    }
}
