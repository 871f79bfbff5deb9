package com.chuckbox.reconcile.infrastructure.reconcile;

import com.chuckbox.reconcile.domain.requirement.model.AssignmentOutcome;
import com.chuckbox.reconcile.domain.requirement.model.DiscrepancyReport;
import com.chuckbox.reconcile.domain.requirement.model.HierarchyIssue;
import com.chuckbox.reconcile.domain.requirement.model.HierarchyReport;
import com.chuckbox.reconcile.domain.requirement.model.MatchAssignment;
import com.chuckbox.reconcile.domain.requirement.model.ReconciliationResult;
import com.chuckbox.reconcile.domain.requirement.model.TaggedNode;
import com.chuckbox.reconcile.domain.requirement.model.VisualNode;
import com.chuckbox.reconcile.infrastructure.reconcile.hierarchy.HierarchyBuilder;
import com.chuckbox.reconcile.infrastructure.reconcile.hierarchy.HierarchyValidator;
import com.chuckbox.reconcile.infrastructure.reconcile.matching.AssignmentSearch;
import com.chuckbox.reconcile.infrastructure.reconcile.report.DiscrepancyReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Orchestrates the reconciliation of one checklist version:
 * <p>
 * assign ids → tag headers/completables → build tree → validate → report
 * </p>
 * Pure: no I/O and no state kept between calls.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationPipeline {

    private final AssignmentSearch assignmentSearch;
    private final HierarchyBuilder hierarchyBuilder;
    private final HierarchyValidator hierarchyValidator;
    private final DiscrepancyReporter discrepancyReporter;

    /**
     * Reconcile one checklist version.
     *
     * @param checklistName name used in log lines
     * @param versionYear   version used in log lines
     * @param ids           authoritative identifiers of the version
     * @param nodes         visual sequence of the version
     */
    public ReconciliationResult execute(String checklistName,
                                        int versionYear,
                                        List<String> ids,
                                        List<VisualNode> nodes) {
        ReconciliationContext ctx = new ReconciliationContext();
        ctx.setChecklistName(checklistName);
        ctx.setVersionYear(versionYear);
        ctx.setAuthoritativeIds(withoutNulls(ids));
        ctx.setNodes(withoutNulls(nodes));

        // 1. Assign
        assign(ctx);

        // 2. Tag
        tag(ctx);

        // 3. Build + validate tree
        buildTree(ctx);

        // 4. Report
        report(ctx);

        return ctx.toResult();
    }

    // ===== Internal methods =====

    private void assign(ReconciliationContext ctx) {
        AssignmentOutcome outcome = assignmentSearch.assignAll(ctx.getAuthoritativeIds(), ctx.getNodes());
        ctx.setAssignmentOutcome(outcome);

        log.info("[{} v{}] matched {} of {} ids against {} nodes",
                ctx.getChecklistName(), ctx.getVersionYear(), outcome.assignments().size(),
                outcome.assignments().size() + outcome.unmatchedIds().size(), ctx.getNodes().size());
        if (!outcome.unmatchedIds().isEmpty()) {
            log.warn("[{} v{}] unmatched ids: {}", ctx.getChecklistName(), ctx.getVersionYear(),
                    outcome.unmatchedIds());
        }
    }

    private void tag(ReconciliationContext ctx) {
        Map<Integer, MatchAssignment> byIndex = ctx.getAssignmentOutcome().byNodeIndex();
        Set<String> usedHeaderIds = new HashSet<>();
        List<TaggedNode> tagged = new ArrayList<>();
        List<VisualNode> unmatched = new ArrayList<>();

        List<VisualNode> nodes = ctx.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            VisualNode node = nodes.get(i);
            MatchAssignment assignment = byIndex.get(i);

            String resolvedId;
            if (assignment != null) {
                resolvedId = assignment.authoritativeId();
            } else {
                resolvedId = headerId(node, i, usedHeaderIds);
                unmatched.add(node);
            }

            tagged.add(new TaggedNode(
                    resolvedId,
                    node.hasLabel() ? node.displayLabel() : "",
                    node.description(),
                    assignment == null,
                    i,
                    node.links()
            ));
        }

        ctx.setTaggedNodes(tagged);
        ctx.setUnmatchedNodes(unmatched);
    }

    private void buildTree(ReconciliationContext ctx) {
        ctx.setRoots(hierarchyBuilder.build(ctx.getTaggedNodes()));

        HierarchyReport hierarchy = hierarchyValidator.validate(ctx.getRoots(), ctx.getAuthoritativeIds());
        ctx.setHierarchyReport(hierarchy);

        if (!hierarchy.passed()) {
            log.warn("[{} v{}] hierarchy errors: {}", ctx.getChecklistName(), ctx.getVersionYear(),
                    hierarchy.errors().stream().map(HierarchyIssue::message).toList());
        }
        if (!hierarchy.warnings().isEmpty()) {
            log.info("[{} v{}] hierarchy warnings: {}", ctx.getChecklistName(), ctx.getVersionYear(),
                    hierarchy.warnings().size());
        }
    }

    private void report(ReconciliationContext ctx) {
        AssignmentOutcome outcome = ctx.getAssignmentOutcome();
        DiscrepancyReport report = discrepancyReporter.report(
                outcome.claimedIds(),
                ctx.getAuthoritativeIds(),
                ctx.getUnmatchedNodes(),
                outcome.assignments()
        );
        ctx.setDiscrepancyReport(report);

        if (!report.unmatchedByFormat().isEmpty()) {
            log.info("[{} v{}] unmatched by format: {}", ctx.getChecklistName(), ctx.getVersionYear(),
                    report.unmatchedByFormat());
        }
    }

    private static <T> List<T> withoutNulls(List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    private static String headerId(VisualNode node, int index, Set<String> usedHeaderIds) {
        String parent = node.parentHint() == null || node.parentHint().isEmpty() ? "0" : node.parentHint();
        String suffix = node.hasLabel() ? node.displayLabel() : String.valueOf(index);
        String id = "header_" + parent + "_" + suffix;
        if (!usedHeaderIds.add(id)) {
            id = id + "_" + index;
            usedHeaderIds.add(id);
        }
        return id;
    }
}
