package com.chuckbox.reconcile.domain.requirement.model;

import java.util.List;

/**
 * Final output of reconciling one checklist version.
 */
public record ReconciliationResult(
        List<CanonicalNode> roots,
        AssignmentOutcome assignments,
        DiscrepancyReport discrepancies,
        HierarchyReport hierarchy
) {}
