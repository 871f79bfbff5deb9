package com.chuckbox.reconcile.interfaces.batch.dto;

import com.chuckbox.reconcile.domain.requirement.model.CanonicalNode;
import com.chuckbox.reconcile.domain.requirement.model.RequirementLink;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reconciled checklist trees, grouped by checklist and version.
 */
public record CanonicalOutputDocument(
        @JsonProperty("generated_at") String generatedAt,
        String source,
        @JsonProperty("merit_badges") List<CanonicalChecklist> checklists
) {
    public record CanonicalChecklist(
            String code,
            String name,
            String category,
            @JsonProperty("is_eagle_required") boolean eagleRequired,
            @JsonProperty("is_active") boolean active,
            List<CanonicalVersion> versions
    ) {}

    public record CanonicalVersion(
            @JsonProperty("version_year") int versionYear,
            List<CanonicalRequirement> requirements
    ) {
        public int requirementCount() {
            return count(requirements);
        }

        private static int count(List<CanonicalRequirement> requirements) {
            int total = requirements.size();
            for (CanonicalRequirement requirement : requirements) {
                total += count(requirement.children());
            }
            return total;
        }
    }

    public record CanonicalRequirement(
            @JsonProperty("scoutbook_id") String resolvedId,
            @JsonProperty("requirement_number") String requirementNumber,
            String description,
            @JsonProperty("is_header") boolean header,
            @JsonProperty("display_order") int displayOrder,
            @JsonProperty("parent_scoutbook_id") String parentId,
            List<RequirementLink> links,
            List<CanonicalRequirement> children
    ) {
        public static CanonicalRequirement from(CanonicalNode node) {
            return new CanonicalRequirement(
                    node.getResolvedId(),
                    node.getRequirementNumber(),
                    node.getDescription(),
                    node.isHeader(),
                    node.getDisplayOrder(),
                    node.getParentId(),
                    node.getLinks(),
                    node.getChildren().stream().map(CanonicalRequirement::from).toList()
            );
        }
    }
}
