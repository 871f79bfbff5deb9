package com.chuckbox.reconcile.domain.requirement.model;

/**
 * Advisory finding of one reconciliation run.
 *
 * @param kind            category of the finding
 * @param identifier      authoritative identifier or visual label involved (nullable)
 * @param explanation     human-readable description
 * @param suggestedAction what a reviewer should try next
 */
public record DiscrepancyEntry(
        DiscrepancyKind kind,
        String identifier,
        String explanation,
        String suggestedAction
) {}
