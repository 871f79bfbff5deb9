package com.chuckbox.reconcile.domain.requirement.model;

public enum HierarchyIssueType {
    MISSING_DESCRIPTION,
    EMPTY_HEADER_CHILDREN,
    COMPLETABLE_WITH_CHILDREN,
    DUPLICATE_DISPLAY_ORDER,
    MISSING_AUTHORITATIVE_ID
}
