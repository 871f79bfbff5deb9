package com.chuckbox.reconcile.infrastructure.reconcile.matching;

import com.chuckbox.reconcile.domain.requirement.model.AddressingContext;
import com.chuckbox.reconcile.domain.requirement.model.MatchVerdict;
import com.chuckbox.reconcile.domain.requirement.model.ParsedId;
import com.chuckbox.reconcile.domain.requirement.model.VisualNode;
import com.chuckbox.reconcile.infrastructure.reconcile.parsing.LabelNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;

/**
 * Decides whether a visual node, seen under its addressing context, is the node an
 * authoritative identifier refers to.
 *
 * Each grammar compares the node's clean label with the field that should appear
 * at that position (sub-letter, then sub-number, then letter) and requires the
 * context main number and option to agree. Confidence is a fixed value per
 * grammar, higher for grammars that corroborate more fields.
 */
@Component
@RequiredArgsConstructor
public class ConfidenceMatcher {

    private final LabelNormalizer labelNormalizer;

    public MatchVerdict tryMatch(ParsedId parsed, VisualNode node, AddressingContext context) {
        String label = labelNormalizer.clean(node.displayLabel()).toLowerCase(Locale.ROOT);
        boolean wrapped = labelNormalizer.isWrapped(node.displayLabel());

        boolean hasMainNum = Objects.equals(context.mainNumber(), parsed.mainNumber());
        boolean hasLetter = Objects.equals(context.letter(), parsed.letter());
        boolean hasOption = Objects.equals(context.option(), parsed.option());
        boolean isSubNumUnderLetter = context.letterIsHeader() && labelNormalizer.isNumberAtMost(label, 10);

        return switch (parsed.format()) {
            case SIMPLE -> MatchVerdict.of(
                    label.equals(parsed.letter()) && hasMainNum, 95,
                    "simple: label=%s, expected=%s, parent=%s".formatted(label, parsed.letter(), context.mainNumber()));

            case BRACKET_ONLY -> MatchVerdict.of(
                    label.equals(parsed.subNumber()) && hasMainNum && hasLetter && isSubNumUnderLetter, 92,
                    "bracket_only: label=%s, letter=%s, letterIsHeader=%s, expected subNum=%s"
                            .formatted(label, context.letter(), context.letterIsHeader(), parsed.subNumber()));

            case PAREN_NESTED -> parenNested(parsed, context, label, hasMainNum, hasLetter);

            case THREE_PART -> MatchVerdict.of(
                    label.equals(parsed.subNumber()) && hasMainNum && hasLetter, 90,
                    "three_part: label=%s, expected subNum=%s".formatted(label, parsed.subNumber()));

            case NUMBER_ONLY -> MatchVerdict.of(
                    label.equals(parsed.mainNumber()) && !wrapped && hasMainNum, 90,
                    "number_only: label=%s, wrapped=%s, expected=%s".formatted(label, wrapped, parsed.mainNumber()));

            case BRACKET_OPTION -> MatchVerdict.of(
                    label.equals(parsed.subNumber()) && hasMainNum && hasLetter && hasOption, 85,
                    "bracket_option: label=%s, option=%s, expected=%s".formatted(label, context.option(), parsed.option()));

            case SPACE_OPTION -> {
                boolean matched = parsed.subNumber() != null
                        ? label.equals(parsed.subNumber()) && hasMainNum && hasLetter && hasOption
                        : label.equals(parsed.letter()) && hasMainNum && hasOption;
                yield MatchVerdict.of(matched, 85,
                        "space_option: label=%s, letter=%s, option=%s, expected option=%s"
                                .formatted(label, context.letter(), context.option(), parsed.option()));
            }

            case OPTION_FORMAT -> MatchVerdict.of(
                    matchesDeepestField(label, parsed) && hasMainNum && hasOption, 82,
                    "option_format: label=%s, expected subNum=%s, subLetter=%s, option=%s"
                            .formatted(label, parsed.subNumber(), parsed.subLetter(), context.option()));

            case OPT_FORMAT -> MatchVerdict.of(
                    hasMainNum && hasOption && matchesDeepestField(label, parsed), 80,
                    "opt_format: label=%s, option=%s".formatted(label, context.option()));

            case OPT_DOT_FORMAT -> MatchVerdict.of(
                    label.equals(parsed.subNumber()) && hasMainNum && hasOption, 80,
                    "opt_dot_format: label=%s, expected subNum=%s, option=%s"
                            .formatted(label, parsed.subNumber(), context.option()));

            case PAREN_OPTION -> MatchVerdict.of(
                    label.equals(parsed.subNumber()) && hasMainNum && hasOption, 80,
                    "paren_option: label=%s, expected subNum=%s, option=%s"
                            .formatted(label, parsed.subNumber(), context.option()));

            case OPT_NUM_FORMAT -> MatchVerdict.of(
                    hasMainNum && hasOption && matchesDeepestField(label, parsed), 78,
                    "opt_num_format: label=%s, option=%s".formatted(label, context.option()));

            case OTHER -> MatchVerdict.of(
                    matchesDeepestField(label, parsed) && hasMainNum && hasOption, 78,
                    "other: label=%s, expected subNum=%s, subLetter=%s, option=%s"
                            .formatted(label, parsed.subNumber(), parsed.subLetter(), context.option()));

            case UNKNOWN -> MatchVerdict.of(false, 0, "unknown format: " + parsed.raw());
        };
    }

    private MatchVerdict parenNested(ParsedId parsed, AddressingContext context, String label,
                                     boolean hasMainNum, boolean hasLetter) {
        String reason = "paren_nested: label=%s, letter=%s, letterIsHeader=%s, expected subNum=%s"
                .formatted(label, context.letter(), context.letterIsHeader(), parsed.subNumber());

        if (parsed.letter() != null && parsed.subNumber() != null) {
            boolean matched = label.equals(parsed.subNumber()) && hasMainNum && hasLetter;
            return MatchVerdict.of(matched, context.letterIsHeader() ? 92 : 88, reason);
        }
        if (parsed.subNumber() != null) {
            return MatchVerdict.of(label.equals(parsed.subNumber()) && hasMainNum, 85, reason);
        }
        return MatchVerdict.of(false, 0, reason);
    }

    // Sub-letter beats sub-number beats letter; an identifier with none of them matches on context alone
    private static boolean matchesDeepestField(String label, ParsedId parsed) {
        if (parsed.subLetter() != null) {
            return label.equals(parsed.subLetter());
        }
        if (parsed.subNumber() != null) {
            return label.equals(parsed.subNumber());
        }
        if (parsed.letter() != null) {
            return label.equals(parsed.letter());
        }
        return true;
    }
}
