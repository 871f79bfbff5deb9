package com.chuckbox.reconcile.infrastructure.reconcile;

import com.chuckbox.reconcile.domain.requirement.model.AssignmentOutcome;
import com.chuckbox.reconcile.domain.requirement.model.CanonicalNode;
import com.chuckbox.reconcile.domain.requirement.model.DiscrepancyReport;
import com.chuckbox.reconcile.domain.requirement.model.HierarchyReport;
import com.chuckbox.reconcile.domain.requirement.model.ReconciliationResult;
import com.chuckbox.reconcile.domain.requirement.model.TaggedNode;
import com.chuckbox.reconcile.domain.requirement.model.VisualNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context object passed through pipeline stages.
 * Accumulates results from each stage for the next.
 */
@Data
public class ReconciliationContext {

    // --- Input ---
    private String checklistName;
    private int versionYear;
    private List<String> authoritativeIds = new ArrayList<>();
    private List<VisualNode> nodes = new ArrayList<>();

    // --- Assignment ---
    private AssignmentOutcome assignmentOutcome;

    // --- Tagging ---
    private List<TaggedNode> taggedNodes = new ArrayList<>();
    private List<VisualNode> unmatchedNodes = new ArrayList<>();

    // --- Tree ---
    private List<CanonicalNode> roots = new ArrayList<>();
    private HierarchyReport hierarchyReport;

    // --- Report ---
    private DiscrepancyReport discrepancyReport;

    public ReconciliationResult toResult() {
        return new ReconciliationResult(List.copyOf(roots), assignmentOutcome, discrepancyReport, hierarchyReport);
    }
}
