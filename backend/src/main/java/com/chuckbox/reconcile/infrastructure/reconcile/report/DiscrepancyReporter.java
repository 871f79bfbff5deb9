package com.chuckbox.reconcile.infrastructure.reconcile.report;

import com.chuckbox.reconcile.domain.requirement.model.DiscrepancyEntry;
import com.chuckbox.reconcile.domain.requirement.model.DiscrepancyKind;
import com.chuckbox.reconcile.domain.requirement.model.DiscrepancyReport;
import com.chuckbox.reconcile.domain.requirement.model.IdFormat;
import com.chuckbox.reconcile.domain.requirement.model.MatchAssignment;
import com.chuckbox.reconcile.domain.requirement.model.VisualNode;
import com.chuckbox.reconcile.infrastructure.reconcile.parsing.IdentifierGrammarParser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the advisory findings of one reconciliation run.
 */
@Component
@RequiredArgsConstructor
public class DiscrepancyReporter {

    private final IdentifierGrammarParser parser;

    /**
     * One {@code csv_not_in_ui} entry per distinct identifier never claimed, then one
     * {@code ui_not_matched} entry per unclaimed node that carries a checkbox.
     *
     * @param claimedIds     identifiers committed to a node
     * @param allIds         every identifier of the version, duplicates allowed
     * @param unmatchedNodes nodes no identifier claimed
     */
    public DiscrepancyReport report(Set<String> claimedIds, List<String> allIds, List<VisualNode> unmatchedNodes) {
        return report(claimedIds, allIds, unmatchedNodes, List.of());
    }

    /**
     * Same as {@link #report(Set, List, List)}, plus one {@code ambiguous_match} entry
     * per committed assignment whose best confidence was tied by a later node.
     */
    public DiscrepancyReport report(Set<String> claimedIds,
                                    List<String> allIds,
                                    List<VisualNode> unmatchedNodes,
                                    Collection<MatchAssignment> assignments) {
        List<DiscrepancyEntry> entries = new ArrayList<>();
        Map<IdFormat, Integer> byFormat = new EnumMap<>(IdFormat.class);

        Set<String> distinctIds = allIds == null ? Set.of() : new LinkedHashSet<>(allIds);
        for (String id : distinctIds) {
            if (id == null || claimedIds.contains(id)) {
                continue;
            }
            IdFormat format = parser.parse(id).format();
            byFormat.merge(format, 1, Integer::sum);
            entries.add(new DiscrepancyEntry(
                    DiscrepancyKind.CSV_NOT_IN_UI,
                    id,
                    "CSV requirement ID \"" + id + "\" not found in scraped UI (format " + format.tag() + ")",
                    "Verify badge was fully expanded during scrape, or ID format mismatch"
            ));
        }

        if (unmatchedNodes != null) {
            for (VisualNode node : unmatchedNodes) {
                if (!node.hasCheckbox()) {
                    continue;
                }
                entries.add(new DiscrepancyEntry(
                        DiscrepancyKind.UI_NOT_MATCHED,
                        node.displayLabel(),
                        "Checkbox item \"" + (node.hasLabel() ? node.displayLabel() : node.description())
                                + "\" has no matching CSV requirement ID",
                        "Check whether the CSV export omits this requirement or uses an unrecognized ID"
                ));
            }
        }

        for (MatchAssignment assignment : assignments) {
            if (!assignment.isAmbiguous()) {
                continue;
            }
            entries.add(new DiscrepancyEntry(
                    DiscrepancyKind.AMBIGUOUS_MATCH,
                    assignment.authoritativeId(),
                    "CSV requirement ID \"" + assignment.authoritativeId() + "\" matched "
                            + (assignment.tiedCandidates() + 1) + " nodes at confidence "
                            + assignment.confidence() + "; kept the earliest (#" + assignment.nodeIndex() + ")",
                    "Review the visual order around this requirement"
            ));
        }

        return new DiscrepancyReport(List.copyOf(entries), Collections.unmodifiableMap(byFormat));
    }
}
