package com.chuckbox.reconcile.domain.requirement.model;

/**
 * Structural finding about a reconciled tree.
 *
 * @param type       the kind of finding
 * @param severity   ERROR for broken structure, WARNING for incomplete data
 * @param resolvedId node the finding refers to (nullable)
 * @param message    human-readable description
 */
public record HierarchyIssue(
        HierarchyIssueType type,
        Severity severity,
        String resolvedId,
        String message
) {
    public enum Severity {
        ERROR,
        WARNING
    }
}
