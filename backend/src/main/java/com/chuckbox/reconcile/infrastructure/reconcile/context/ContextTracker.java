package com.chuckbox.reconcile.infrastructure.reconcile.context;

import com.chuckbox.reconcile.domain.requirement.model.AddressingContext;
import com.chuckbox.reconcile.domain.requirement.model.VisualNode;
import com.chuckbox.reconcile.infrastructure.reconcile.parsing.LabelNormalizer;
import com.chuckbox.reconcile.infrastructure.reconcile.parsing.OptionExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Derives the addressing context (main number, letter, option) in effect at each
 * position of a visual node sequence.
 *
 * Transitions, first matching rule per node wins:
 *   1. unwrapped number ≤ 20           → new main number, everything else reset
 *   2. no label, description names an option → option set, letter state reset
 *   3. single letter                   → letter set, header if the node has no checkbox
 *   4. wrapped number ≤ 10             → sub-item, context unchanged
 *   5. single letter after the letter  → sub-letter set
 *
 * The context at position i depends only on nodes 0..i, so {@link #trace} and
 * {@link #contextAt} always agree.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextTracker {

    private static final int MAX_MAIN_NUMBER = 20;
    private static final int MAX_SUB_NUMBER = 10;

    private final LabelNormalizer labelNormalizer;
    private final OptionExtractor optionExtractor;

    /**
     * Compute the context at every position in one left-to-right pass.
     *
     * @param nodes the visual sequence
     * @return contexts, one per node, same order
     */
    public List<AddressingContext> trace(List<VisualNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return List.of();
        }

        State state = new State();
        List<AddressingContext> contexts = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            advance(state, nodes.get(i), i);
            contexts.add(state.snapshot());
        }
        return List.copyOf(contexts);
    }

    /**
     * Compute the context at a single position by folding from the start.
     *
     * @param nodes  the visual sequence
     * @param cursor position to evaluate; clamped to the sequence
     * @return the context in effect at {@code cursor}
     */
    public AddressingContext contextAt(List<VisualNode> nodes, int cursor) {
        if (nodes == null || nodes.isEmpty() || cursor < 0) {
            return AddressingContext.EMPTY;
        }

        State state = new State();
        int last = Math.min(cursor, nodes.size() - 1);
        for (int i = 0; i <= last; i++) {
            advance(state, nodes.get(i), i);
        }
        return state.snapshot();
    }

    private void advance(State state, VisualNode node, int index) {
        String rawLabel = node.displayLabel();
        String label = labelNormalizer.clean(rawLabel);
        boolean wrapped = labelNormalizer.isWrapped(rawLabel);

        // 1. Main requirement number (a wrapped "(1)" is never a main number)
        if (labelNormalizer.isNumberAtMost(label, MAX_MAIN_NUMBER) && !wrapped) {
            state.resetTo(label);
            log.trace("[Context] #{} main number → {}", index, label);
            return;
        }

        // 2. Option group header
        if (!node.hasLabel() && !node.description().isEmpty()) {
            String option = optionExtractor.extractOption(node.description());
            if (option != null) {
                state.option = option;
                state.letter = null;
                state.letterIsHeader = false;
                state.letterIndex = -1;
                state.clearSubLetter();
                log.trace("[Context] #{} option → {}", index, option);
                return;
            }
        }

        // 3. Letter
        if (labelNormalizer.isSingleLetter(label)) {
            String letter = label.toLowerCase(Locale.ROOT);
            if (state.letter != null && !letter.equals(state.letter)) {
                state.clearSubLetter();
            }
            state.letter = letter;
            state.letterIsHeader = !node.hasCheckbox();
            state.letterIndex = index;
            return;
        }

        // 4. Wrapped sub-number keeps the current letter/option
        if (labelNormalizer.isNumberAtMost(label, MAX_SUB_NUMBER) && wrapped) {
            return;
        }

        // 5. Sub-letter ("5f[1]b"); rule 3 claims single letters first, so this stays latent
        if (labelNormalizer.isSingleLetter(label) && state.letterIndex >= 0 && index > state.letterIndex) {
            state.subLetter = label.toLowerCase(Locale.ROOT);
        }
    }

    private static final class State {
        private String mainNumber;
        private String letter;
        private boolean letterIsHeader;
        private String subLetter;
        private String option;
        private int letterIndex = -1;

        private void resetTo(String mainNumber) {
            this.mainNumber = mainNumber;
            this.letter = null;
            this.letterIsHeader = false;
            this.option = null;
            this.letterIndex = -1;
            clearSubLetter();
        }

        private void clearSubLetter() {
            this.subLetter = null;
        }

        private AddressingContext snapshot() {
            return new AddressingContext(mainNumber, letter, letterIsHeader, subLetter, option);
        }
    }
}
