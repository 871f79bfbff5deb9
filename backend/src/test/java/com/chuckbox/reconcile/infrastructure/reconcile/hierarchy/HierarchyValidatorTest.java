package com.chuckbox.reconcile.infrastructure.reconcile.hierarchy;

import com.chuckbox.reconcile.domain.requirement.model.CanonicalNode;
import com.chuckbox.reconcile.domain.requirement.model.HierarchyIssue;
import com.chuckbox.reconcile.domain.requirement.model.HierarchyIssueType;
import com.chuckbox.reconcile.domain.requirement.model.HierarchyReport;
import com.chuckbox.reconcile.domain.requirement.model.TaggedNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HierarchyValidatorTest {

    private HierarchyValidator validator;

    @BeforeEach
    void setUp() {
        validator = new HierarchyValidator();
    }

    private static CanonicalNode node(String id, String description, boolean header, int order) {
        return new CanonicalNode(new TaggedNode(id, id, description, header, order, List.of()));
    }

    @Test
    @DisplayName("well-formed tree passes with statistics")
    void clean_tree() {
        CanonicalNode root = node("header_0_1", "Safety", true, 0);
        root.addChild(node("1a", "Explain hazards", false, 1));
        root.addChild(node("1b", "Show first aid", false, 2));

        HierarchyReport report = validator.validate(List.of(root), List.of("1a", "1b"));

        assertThat(report.passed()).isTrue();
        assertThat(report.issues()).isEmpty();
        assertThat(report.headers()).isEqualTo(1);
        assertThat(report.completables()).isEqualTo(2);
        assertThat(report.totalNodes()).isEqualTo(3);
        assertThat(report.maxDepth()).isEqualTo(1);
    }

    @Test
    @DisplayName("warnings do not fail validation")
    void warnings_only() {
        CanonicalNode emptyHeader = node("header_0_2", "", true, 0);

        HierarchyReport report = validator.validate(List.of(emptyHeader), List.of("2a"));

        assertThat(report.passed()).isTrue();
        assertThat(report.warnings()).extracting(HierarchyIssue::type).containsExactly(
                HierarchyIssueType.MISSING_DESCRIPTION,
                HierarchyIssueType.EMPTY_HEADER_CHILDREN,
                HierarchyIssueType.MISSING_AUTHORITATIVE_ID);
    }

    @Test
    @DisplayName("completable with children and duplicate sibling order are errors")
    void structural_errors() {
        CanonicalNode completable = node("1a", "Do it", false, 0);
        completable.addChild(node("1a(1)", "Part", false, 1));
        CanonicalNode sibling = node("1b", "Other", false, 0);

        HierarchyReport report = validator.validate(List.of(completable, sibling), List.of());

        assertThat(report.passed()).isFalse();
        assertThat(report.errors()).extracting(HierarchyIssue::type).containsExactly(
                HierarchyIssueType.COMPLETABLE_WITH_CHILDREN,
                HierarchyIssueType.DUPLICATE_DISPLAY_ORDER);
        assertThat(report.errors().get(1).resolvedId()).isEqualTo("1b");
    }

    @Test
    @DisplayName("empty tree")
    void empty_tree() {
        HierarchyReport report = validator.validate(List.of(), null);

        assertThat(report.passed()).isTrue();
        assertThat(report.totalNodes()).isZero();
        assertThat(report.maxDepth()).isZero();
    }
}
