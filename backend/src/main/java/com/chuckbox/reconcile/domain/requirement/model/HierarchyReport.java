package com.chuckbox.reconcile.domain.requirement.model;

import java.util.List;

/**
 * Statistics and findings of a hierarchy validation.
 */
public record HierarchyReport(
        int headers,
        int completables,
        int maxDepth,
        List<HierarchyIssue> issues
) {
    public boolean passed() {
        return errors().isEmpty();
    }

    public List<HierarchyIssue> errors() {
        return issues.stream().filter(i -> i.severity() == HierarchyIssue.Severity.ERROR).toList();
    }

    public List<HierarchyIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == HierarchyIssue.Severity.WARNING).toList();
    }

    public int totalNodes() {
        return headers + completables;
    }
}
