package com.chuckbox.reconcile.interfaces.batch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Flat list of discrepancies across every reconciled checklist version.
 */
public record DiscrepancyOutputDocument(
        @JsonProperty("generated_at") String generatedAt,
        @JsonProperty("total_discrepancies") int totalDiscrepancies,
        @JsonProperty("by_kind") Map<String, Integer> byKind,
        @JsonProperty("unmatched_by_format") Map<String, Integer> unmatchedByFormat,
        List<DiscrepancyRecord> discrepancies
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DiscrepancyRecord(
            String type,
            String badgeName,
            int versionYear,
            String scoutbookId,
            String uiLabel,
            String description,
            String suggestedAction
    ) {}
}
