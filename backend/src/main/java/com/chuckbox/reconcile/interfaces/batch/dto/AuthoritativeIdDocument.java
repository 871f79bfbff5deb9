package com.chuckbox.reconcile.interfaces.batch.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Authoritative identifiers per checklist version, as extracted from the tabular export.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthoritativeIdDocument(
        String generatedAt,
        String csvPath,

        @NotNull(message = "badges list is required")
        List<@NotNull(message = "badge entry must not be null") @Valid ChecklistIds> badges
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChecklistIds(
            @NotBlank(message = "badgeName is required")
            String badgeName,

            int versionYear,

            @NotNull(message = "requirementIds list is required")
            List<@NotNull(message = "requirement id must not be null") String> requirementIds,

            int totalOccurrences
    ) {}
}
