package com.chuckbox.reconcile.domain.requirement.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the reconciled checklist tree. Headers may have children; completables
 * are always leaves.
 */
@Getter
public class CanonicalNode {

    private final String resolvedId;
    private final String requirementNumber;
    private final String description;
    private final boolean header;
    private final int displayOrder;
    private final List<RequirementLink> links;
    private final List<CanonicalNode> children = new ArrayList<>();
    private String parentId;

    public CanonicalNode(TaggedNode tagged) {
        this.resolvedId = tagged.resolvedId();
        this.requirementNumber = tagged.label() == null ? "" : tagged.label();
        this.description = tagged.description();
        this.header = tagged.header();
        this.displayOrder = tagged.displayOrder();
        this.links = tagged.links();
    }

    public void addChild(CanonicalNode child) {
        child.parentId = this.resolvedId;
        children.add(child);
    }

    public List<CanonicalNode> getChildren() {
        return Collections.unmodifiableList(children);
    }
}
