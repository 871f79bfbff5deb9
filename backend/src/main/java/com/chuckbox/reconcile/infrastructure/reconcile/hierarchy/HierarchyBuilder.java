package com.chuckbox.reconcile.infrastructure.reconcile.hierarchy;

import com.chuckbox.reconcile.domain.requirement.model.CanonicalNode;
import com.chuckbox.reconcile.domain.requirement.model.TaggedNode;
import com.chuckbox.reconcile.infrastructure.reconcile.parsing.LabelNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the flat, ordered node sequence into a tree with a level stack.
 *
 * Headers get a level from their label shape, pop every stacked node at the same
 * or a deeper level, attach under what remains and are pushed. Completables attach
 * under the current stack top as leaves and are never pushed. Children keep input
 * order.
 */
@Component
@RequiredArgsConstructor
public class HierarchyBuilder {

    static final int LEVEL_MAIN = 0;
    static final int LEVEL_OPTION = 1;
    static final int LEVEL_LETTER = 2;
    static final int LEVEL_SUB_NUMBER = 3;

    // Unlabeled headers that name an option or an activity sit between main number and letter
    private static final Pattern OPTION_HEADER = Pattern.compile(
            "Option|Swimming|Biking|Running|Cycling|Ice|Inline|Alpine|Nordic", Pattern.CASE_INSENSITIVE);

    private static final Pattern COMPOUND_LABEL = Pattern.compile("^(\\d+)([a-z])?(\\d)?", Pattern.CASE_INSENSITIVE);

    private final LabelNormalizer labelNormalizer;

    public List<CanonicalNode> build(List<TaggedNode> nodes) {
        List<CanonicalNode> roots = new ArrayList<>();
        if (nodes == null) {
            return roots;
        }

        Deque<StackEntry> stack = new ArrayDeque<>();
        for (TaggedNode tagged : nodes) {
            CanonicalNode node = new CanonicalNode(tagged);

            if (tagged.header()) {
                int level = levelOf(tagged.label(), tagged.description());
                while (!stack.isEmpty() && stack.peek().level() >= level) {
                    stack.pop();
                }
                attach(node, stack, roots);
                stack.push(new StackEntry(node, level));
            } else {
                attach(node, stack, roots);
            }
        }
        return roots;
    }

    /**
     * Nesting level of a header, derived from its label shape.
     */
    int levelOf(String rawLabel, String description) {
        if (rawLabel == null || rawLabel.isBlank()) {
            return description != null && OPTION_HEADER.matcher(description).find() ? LEVEL_OPTION : LEVEL_MAIN;
        }

        String label = labelNormalizer.clean(rawLabel);
        boolean wrapped = labelNormalizer.isWrapped(rawLabel);

        if (labelNormalizer.isNumberAtMost(label, 20) && !wrapped) {
            return LEVEL_MAIN;
        }
        // "(n)" and "[n]" are sub-items whatever their number
        if (labelNormalizer.isNumber(label) && wrapped) {
            return LEVEL_SUB_NUMBER;
        }
        if (labelNormalizer.isSingleLetter(label)) {
            return LEVEL_LETTER;
        }

        Matcher compound = COMPOUND_LABEL.matcher(label);
        if (compound.find()) {
            if (compound.group(3) != null) {
                return LEVEL_SUB_NUMBER;
            }
            return compound.group(2) != null ? LEVEL_LETTER : LEVEL_MAIN;
        }
        return LEVEL_OPTION;
    }

    private static void attach(CanonicalNode node, Deque<StackEntry> stack, List<CanonicalNode> roots) {
        if (stack.isEmpty()) {
            roots.add(node);
        } else {
            stack.peek().node().addChild(node);
        }
    }

    private record StackEntry(CanonicalNode node, int level) {}
}
