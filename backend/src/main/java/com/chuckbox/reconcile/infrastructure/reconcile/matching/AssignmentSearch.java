package com.chuckbox.reconcile.infrastructure.reconcile.matching;

import com.chuckbox.reconcile.domain.requirement.model.AddressingContext;
import com.chuckbox.reconcile.domain.requirement.model.AssignmentOutcome;
import com.chuckbox.reconcile.domain.requirement.model.MatchAssignment;
import com.chuckbox.reconcile.domain.requirement.model.MatchVerdict;
import com.chuckbox.reconcile.domain.requirement.model.ParsedId;
import com.chuckbox.reconcile.domain.requirement.model.VisualNode;
import com.chuckbox.reconcile.infrastructure.reconcile.context.ContextTracker;
import com.chuckbox.reconcile.infrastructure.reconcile.parsing.IdentifierGrammarParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Greedy one-to-one assignment of authoritative identifiers to visual nodes.
 *
 * Identifiers are processed in first-occurrence order. Each one scans every node
 * not yet claimed, keeps the highest-confidence match (earliest position on ties)
 * and claims it when the confidence reaches {@link #CONFIDENCE_FLOOR}. A claim is
 * visible to every identifier processed after it. The result is not globally
 * optimal: a different identifier order can produce a different pairing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssignmentSearch {

    public static final int CONFIDENCE_FLOOR = 75;

    private final IdentifierGrammarParser parser;
    private final ContextTracker contextTracker;
    private final ConfidenceMatcher matcher;

    /**
     * Assign every distinct identifier of a version.
     *
     * @param ids   authoritative identifiers, duplicates allowed
     * @param nodes visual sequence of the same version
     * @return committed assignments, rejected candidates and identifiers left over
     */
    public AssignmentOutcome assignAll(List<String> ids, List<VisualNode> nodes) {
        List<VisualNode> safeNodes = nodes == null ? List.of() : nodes;
        List<AddressingContext> contexts = contextTracker.trace(safeNodes);

        Set<Integer> claimed = new HashSet<>();
        List<MatchAssignment> assignments = new ArrayList<>();
        List<MatchAssignment> rejected = new ArrayList<>();
        List<String> unmatched = new ArrayList<>();

        for (String id : distinct(ids)) {
            Optional<MatchAssignment> best = bestCandidate(id, safeNodes, contexts, claimed);
            if (best.isPresent() && best.get().confidence() >= CONFIDENCE_FLOOR) {
                MatchAssignment assignment = best.get();
                claimed.add(assignment.nodeIndex());
                assignments.add(assignment);
                log.debug("[Assign] {} → #{} ({}, {})", id, assignment.nodeIndex(),
                        assignment.confidence(), assignment.matchType());
            } else {
                best.ifPresent(candidate -> {
                    rejected.add(candidate);
                    log.debug("[Assign] {} rejected below floor: #{} ({})", id,
                            candidate.nodeIndex(), candidate.confidence());
                });
                unmatched.add(id);
            }
        }

        return new AssignmentOutcome(List.copyOf(assignments), List.copyOf(rejected), List.copyOf(unmatched));
    }

    /**
     * Find the node a single identifier should claim.
     *
     * @param id             authoritative identifier
     * @param nodes          visual sequence
     * @param alreadyClaimed node positions that may not be used
     * @return the assignment, if a candidate reached the confidence floor
     */
    public Optional<MatchAssignment> findBestMatch(String id, List<VisualNode> nodes, Set<Integer> alreadyClaimed) {
        List<VisualNode> safeNodes = nodes == null ? List.of() : nodes;
        return bestCandidate(id, safeNodes, contextTracker.trace(safeNodes), alreadyClaimed)
                .filter(candidate -> candidate.confidence() >= CONFIDENCE_FLOOR);
    }

    private Optional<MatchAssignment> bestCandidate(String id,
                                                    List<VisualNode> nodes,
                                                    List<AddressingContext> contexts,
                                                    Set<Integer> alreadyClaimed) {
        ParsedId parsed = parser.parse(id);
        if (parsed.isUnknown()) {
            return Optional.empty();
        }

        int bestIndex = -1;
        MatchVerdict bestVerdict = null;
        int ties = 0;

        for (int i = 0; i < nodes.size(); i++) {
            if (alreadyClaimed.contains(i)) {
                continue;
            }
            MatchVerdict verdict = matcher.tryMatch(parsed, nodes.get(i), contexts.get(i));
            if (!verdict.matched()) {
                continue;
            }
            if (bestVerdict == null || verdict.confidence() > bestVerdict.confidence()) {
                bestIndex = i;
                bestVerdict = verdict;
                ties = 0;
            } else if (verdict.confidence() == bestVerdict.confidence()) {
                ties++;
            }
        }

        if (bestVerdict == null) {
            return Optional.empty();
        }
        return Optional.of(new MatchAssignment(id, bestIndex, bestVerdict.confidence(),
                bestVerdict.reason(), parsed.format(), ties));
    }

    private static Set<String> distinct(List<String> ids) {
        Set<String> distinct = new LinkedHashSet<>();
        if (ids != null) {
            for (String id : ids) {
                if (id != null) {
                    distinct.add(id);
                }
            }
        }
        return distinct;
    }
}
