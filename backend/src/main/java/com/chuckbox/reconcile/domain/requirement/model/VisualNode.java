package com.chuckbox.reconcile.domain.requirement.model;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the rendered checklist, in visual order. Position in the list is
 * the only hierarchy signal trusted by the reconciliation.
 *
 * @param displayLabel raw label as rendered, e.g. "2", "(a)", "[1]" (nullable)
 * @param description  free text shown next to the label
 * @param hasCheckbox  whether the rendered node can be ticked off
 * @param parentHint   best-effort parent number from the scrape (nullable)
 * @param links        links shown with the node
 */
public record VisualNode(
        String displayLabel,
        String description,
        boolean hasCheckbox,
        String parentHint,
        List<RequirementLink> links
) {
    public VisualNode {
        description = description == null ? "" : description;
        links = links == null ? List.of() : links.stream().filter(Objects::nonNull).toList();
    }

    public VisualNode(String displayLabel, String description, boolean hasCheckbox) {
        this(displayLabel, description, hasCheckbox, null, List.of());
    }

    public boolean hasLabel() {
        return displayLabel != null && !displayLabel.isEmpty();
    }
}
