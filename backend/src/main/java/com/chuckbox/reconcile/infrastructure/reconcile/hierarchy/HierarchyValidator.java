package com.chuckbox.reconcile.infrastructure.reconcile.hierarchy;

import com.chuckbox.reconcile.domain.requirement.model.CanonicalNode;
import com.chuckbox.reconcile.domain.requirement.model.HierarchyIssue;
import com.chuckbox.reconcile.domain.requirement.model.HierarchyIssue.Severity;
import com.chuckbox.reconcile.domain.requirement.model.HierarchyIssueType;
import com.chuckbox.reconcile.domain.requirement.model.HierarchyReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rule-based structural checks on a reconciled tree.
 * Findings are advisory: they are reported, never thrown.
 */
@Slf4j
@Component
public class HierarchyValidator {

    /**
     * Validate a tree against the identifiers it was reconciled from.
     *
     * @param roots           reconciled roots
     * @param authoritativeIds identifiers that should appear somewhere in the tree
     * @return statistics and findings
     */
    public HierarchyReport validate(List<CanonicalNode> roots, Collection<String> authoritativeIds) {
        List<HierarchyIssue> issues = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Counts counts = new Counts();

        int maxDepth = walk(roots, 0, issues, seenIds, counts);

        if (authoritativeIds != null) {
            for (String id : new LinkedHashSet<>(authoritativeIds)) {
                if (!seenIds.contains(id)) {
                    issues.add(new HierarchyIssue(HierarchyIssueType.MISSING_AUTHORITATIVE_ID, Severity.WARNING, id,
                            "Authoritative id \"" + id + "\" not found in reconciled tree"));
                }
            }
        }

        if (!issues.isEmpty()) {
            log.debug("Hierarchy validation: {} issues ({} headers, {} completables, depth {})",
                    issues.size(), counts.headers, counts.completables, maxDepth);
        }
        return new HierarchyReport(counts.headers, counts.completables, maxDepth, List.copyOf(issues));
    }

    private int walk(List<CanonicalNode> siblings, int depth, List<HierarchyIssue> issues,
                     Set<String> seenIds, Counts counts) {
        int maxDepth = depth;
        Set<Integer> displayOrders = new HashSet<>();

        for (CanonicalNode node : siblings) {
            seenIds.add(node.getResolvedId());

            if (node.getDescription() == null || node.getDescription().isBlank()) {
                issues.add(new HierarchyIssue(HierarchyIssueType.MISSING_DESCRIPTION, Severity.WARNING,
                        node.getResolvedId(), "Requirement " + node.getRequirementNumber()
                        + " (" + node.getResolvedId() + ") has no description"));
            }

            if (node.isHeader()) {
                counts.headers++;
                if (node.getChildren().isEmpty()) {
                    issues.add(new HierarchyIssue(HierarchyIssueType.EMPTY_HEADER_CHILDREN, Severity.WARNING,
                            node.getResolvedId(), "Header " + node.getRequirementNumber()
                            + " (" + node.getResolvedId() + ") has no children"));
                }
            } else {
                counts.completables++;
                if (!node.getChildren().isEmpty()) {
                    issues.add(new HierarchyIssue(HierarchyIssueType.COMPLETABLE_WITH_CHILDREN, Severity.ERROR,
                            node.getResolvedId(), "Completable " + node.getResolvedId()
                            + " has " + node.getChildren().size() + " children"));
                }
            }

            if (!displayOrders.add(node.getDisplayOrder())) {
                issues.add(new HierarchyIssue(HierarchyIssueType.DUPLICATE_DISPLAY_ORDER, Severity.ERROR,
                        node.getResolvedId(), "Duplicate display_order " + node.getDisplayOrder() + " at depth " + depth));
            }

            if (!node.getChildren().isEmpty()) {
                maxDepth = Math.max(maxDepth, walk(node.getChildren(), depth + 1, issues, seenIds, counts));
            }
        }
        return maxDepth;
    }

    private static final class Counts {
        private int headers;
        private int completables;
    }
}
