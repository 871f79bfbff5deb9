package com.chuckbox.reconcile.infrastructure.reconcile.hierarchy;

import com.chuckbox.reconcile.domain.requirement.model.CanonicalNode;
import com.chuckbox.reconcile.domain.requirement.model.TaggedNode;
import com.chuckbox.reconcile.infrastructure.reconcile.parsing.LabelNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HierarchyBuilderTest {

    private HierarchyBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new HierarchyBuilder(new LabelNormalizer());
    }

    private static TaggedNode header(String id, String label, String description, int order) {
        return new TaggedNode(id, label, description, true, order, List.of());
    }

    private static TaggedNode completable(String id, String label, int order) {
        return new TaggedNode(id, label, "Do " + id, false, order, List.of());
    }

    private static List<TaggedNode> sample() {
        return List.of(
                header("header_0_1", "1", "Safety", 0),
                completable("1a", "a", 1),
                header("header_1_b", "b", "Explain:", 2),
                completable("1b(1)", "(1)", 3),
                header("header_0_2", "2", "Do ONE:", 4),
                header("header_0_5", "", "Option A—Sprinting", 5),
                header("header_2_a", "a", "Run:", 6),
                completable("2 Option A(1)", "(1)", 7)
        );
    }

    @Nested
    @DisplayName("Tree shape")
    class Shape {

        @Test
        @DisplayName("headers nest by level and completables stay leaves")
        void nests_by_level() {
            List<CanonicalNode> roots = builder.build(sample());

            assertThat(roots).extracting(CanonicalNode::getResolvedId).containsExactly("header_0_1", "header_0_2");

            CanonicalNode first = roots.get(0);
            assertThat(first.getChildren()).extracting(CanonicalNode::getResolvedId)
                    .containsExactly("1a", "header_1_b");
            assertThat(first.getChildren().get(1).getChildren()).extracting(CanonicalNode::getResolvedId)
                    .containsExactly("1b(1)");

            CanonicalNode option = roots.get(1).getChildren().get(0);
            assertThat(option.getResolvedId()).isEqualTo("header_0_5");
            assertThat(option.getChildren().get(0).getChildren()).extracting(CanonicalNode::getResolvedId)
                    .containsExactly("2 Option A(1)");
        }

        @Test
        @DisplayName("parent ids point at the attaching header")
        void parent_ids() {
            List<CanonicalNode> roots = builder.build(sample());

            assertThat(roots.get(0).getParentId()).isNull();
            assertThat(roots.get(0).getChildren().get(0).getParentId()).isEqualTo("header_0_1");
            assertThat(roots.get(1).getChildren().get(0).getChildren().get(0).getParentId()).isEqualTo("header_0_5");
        }

        @Test
        @DisplayName("pre-order traversal reproduces the input order")
        void preserves_order() {
            List<Integer> orders = new ArrayList<>();
            flatten(builder.build(sample()), orders);

            assertThat(orders).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        }

        @Test
        @DisplayName("completables before any header become roots")
        void leading_completables() {
            List<CanonicalNode> roots = builder.build(List.of(
                    completable("1", "1", 0), completable("2", "2", 1)));

            assertThat(roots).hasSize(2);
            assertThat(roots).allSatisfy(root -> assertThat(root.getChildren()).isEmpty());
        }

        @Test
        @DisplayName("wrapped numbers above ten stay under their letter")
        void wrapped_double_digit_under_letter() {
            List<CanonicalNode> roots = builder.build(List.of(
                    header("header_0_1", "1", "Do the following:", 0),
                    header("header_1_a", "a", "Choose:", 1),
                    header("header_a_(11)", "(11)", "Eleventh item:", 2),
                    completable("1a(11)(a)", "a", 3)));

            assertThat(roots).extracting(CanonicalNode::getResolvedId).containsExactly("header_0_1");
            CanonicalNode letter = roots.get(0).getChildren().get(0);
            assertThat(letter.getChildren()).extracting(CanonicalNode::getResolvedId)
                    .containsExactly("header_a_(11)");
        }

        @Test
        @DisplayName("empty or null input gives no roots")
        void empty() {
            assertThat(builder.build(List.of())).isEmpty();
            assertThat(builder.build(null)).isEmpty();
        }

        private void flatten(List<CanonicalNode> nodes, List<Integer> out) {
            for (CanonicalNode node : nodes) {
                out.add(node.getDisplayOrder());
                flatten(node.getChildren(), out);
            }
        }
    }

    @Nested
    @DisplayName("Header levels")
    class Levels {

        @ParameterizedTest
        @CsvSource({
                "1, '', 0",
                "20, '', 0",
                "a, '', 2",
                "B., '', 2",
                "(1), '', 3",
                "[2], '', 3",
                "(11), '', 3",
                "(20), '', 3",
                "(25), '', 3",
                "8a1, '', 3",
                "5b, '', 2",
                "21, '', 0",
                "iv, '', 1"
        })
        void labeled(String label, String description, int expected) {
            assertThat(builder.levelOf(label, description)).isEqualTo(expected);
        }

        @Test
        @DisplayName("unlabeled headers: option or activity names sit at level 1")
        void unlabeled() {
            assertThat(builder.levelOf("", "Option B—Distance")).isEqualTo(HierarchyBuilder.LEVEL_OPTION);
            assertThat(builder.levelOf(null, "Swimming")).isEqualTo(HierarchyBuilder.LEVEL_OPTION);
            assertThat(builder.levelOf("", "Do the following")).isEqualTo(HierarchyBuilder.LEVEL_MAIN);
            assertThat(builder.levelOf("", null)).isEqualTo(HierarchyBuilder.LEVEL_MAIN);
        }
    }
}
