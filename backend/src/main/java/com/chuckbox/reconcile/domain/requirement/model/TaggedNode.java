package com.chuckbox.reconcile.domain.requirement.model;

import java.util.List;

/**
 * Visual node after matching: either a completable carrying its authoritative
 * identifier, or a header carrying a synthesized one.
 */
public record TaggedNode(
        String resolvedId,
        String label,
        String description,
        boolean header,
        int displayOrder,
        List<RequirementLink> links
) {}
