package com.chuckbox.reconcile.interfaces.batch.dto;

import com.chuckbox.reconcile.domain.requirement.model.RequirementLink;
import com.chuckbox.reconcile.domain.requirement.model.VisualNode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Rendered checklist nodes per checklist version, plus scrape metadata that the
 * reconciliation ignores.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VisualScrapeDocument(
        @NotNull(message = "badges list is required")
        List<@NotNull(message = "badge entry must not be null") @Valid ScrapedChecklist> badges,

        List<String> errors,
        String startedAt,
        String lastUpdatedAt
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScrapedChecklist(
            @NotBlank(message = "badgeName is required")
            String badgeName,

            String badgeSlug,
            int versionYear,
            String versionLabel,

            @NotNull(message = "requirements list is required")
            List<@NotNull(message = "requirement entry must not be null") @Valid ScrapedRequirement> requirements,

            String scrapedAt
    ) {
        public List<VisualNode> toVisualNodes() {
            return requirements.stream()
                    .filter(Objects::nonNull)
                    .map(ScrapedRequirement::toVisualNode)
                    .toList();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScrapedRequirement(
            String id,
            String displayLabel,
            String description,
            String parentNumber,
            int depth,
            int visualDepth,
            boolean hasCheckbox,
            List<@NotNull(message = "link entry must not be null") ScrapedLink> links
    ) {
        public VisualNode toVisualNode() {
            List<RequirementLink> nodeLinks = links == null
                    ? List.of()
                    : links.stream()
                    .filter(Objects::nonNull)
                    .map(l -> new RequirementLink(l.url(), l.text(), l.type()))
                    .toList();
            return new VisualNode(displayLabel, description, hasCheckbox, parentNumber, nodeLinks);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScrapedLink(
            String url,
            String text,
            String context,
            String type
    ) {}
}
