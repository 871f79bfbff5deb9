package com.chuckbox.reconcile.domain.requirement.model;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of running the assignment search over a whole identifier list.
 *
 * @param assignments  committed assignments, in identifier processing order
 * @param rejected     best candidates that matched below the confidence floor
 * @param unmatchedIds distinct identifiers left without a node, in processing order
 */
public record AssignmentOutcome(
        List<MatchAssignment> assignments,
        List<MatchAssignment> rejected,
        List<String> unmatchedIds
) {
    public Map<Integer, MatchAssignment> byNodeIndex() {
        Map<Integer, MatchAssignment> byIndex = new HashMap<>();
        for (MatchAssignment assignment : assignments) {
            byIndex.put(assignment.nodeIndex(), assignment);
        }
        return byIndex;
    }

    public Set<String> claimedIds() {
        Set<String> claimed = new LinkedHashSet<>();
        for (MatchAssignment assignment : assignments) {
            claimed.add(assignment.authoritativeId());
        }
        return claimed;
    }
}
