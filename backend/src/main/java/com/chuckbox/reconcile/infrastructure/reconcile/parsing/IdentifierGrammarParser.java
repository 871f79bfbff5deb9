package com.chuckbox.reconcile.infrastructure.reconcile.parsing;

import com.chuckbox.reconcile.domain.requirement.model.IdFormat;
import com.chuckbox.reconcile.domain.requirement.model.ParsedId;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies authoritative identifiers ("6c2 hog", "2a[1] Ice", "5 Option A(1)")
 * into one of the known grammars and extracts their structural fields.
 *
 * Grammars are tried in priority order and the first match wins. Several of them
 * share prefixes, so the more specific ones must come first.
 */
@Component
public class IdentifierGrammarParser {

    private record GrammarRule(Pattern pattern, BiFunction<String, Matcher, ParsedId> extractor) {}

    private static final Pattern ROMAN_OR_DIGITS = Pattern.compile("\\d+|i+", Pattern.CASE_INSENSITIVE);

    /**
     * Grammars in priority order (higher priority = earlier in list).
     */
    private static final List<GrammarRule> GRAMMARS = List.of(
            // 1. "5 Option A(1)", "8 Option A (1)", "5 Option A (1)(a)"
            new GrammarRule(
                    compile("(\\d+)\\s+Option\\s+([A-Z])\\s*\\((\\d+)\\)(?:\\(([a-z])\\))?"),
                    (raw, m) -> new ParsedId(raw, m.group(1), null, m.group(3), lower(m.group(4)),
                            "option " + lower(m.group(2)), IdFormat.OPTION_FORMAT)
            ),
            // 2. "5. Opt A (1)"
            new GrammarRule(
                    compile("(\\d+)\\.\\s*Opt\\s+([A-Z])\\s*\\((\\d+)\\)"),
                    (raw, m) -> new ParsedId(raw, m.group(1), null, m.group(3), null,
                            "opt " + lower(m.group(2)), IdFormat.OPT_DOT_FORMAT)
            ),
            // 3. "6 avian (1)", "6 avian (4)(a)" - word used as the option
            new GrammarRule(
                    compile("(\\d+)\\s+(\\w+)\\s*\\((\\d+)\\)(?:\\(([a-z])\\))?"),
                    (raw, m) -> new ParsedId(raw, m.group(1), null, m.group(3), lower(m.group(4)),
                            lower(m.group(2)), IdFormat.OTHER)
            ),
            // 4. "6(2) hog"
            new GrammarRule(
                    compile("(\\d+)\\((\\d+)\\)\\s+(\\w+)"),
                    (raw, m) -> new ParsedId(raw, m.group(1), null, m.group(2), null,
                            lower(m.group(3)), IdFormat.PAREN_OPTION)
            ),
            // 5. "5f[1]b Opt A", "2a Opt a"
            new GrammarRule(
                    compile("(\\d+)([a-z])?(?:\\[(\\d+)\\])?([a-z])?\\s+Opt\\s+([a-z])"),
                    (raw, m) -> new ParsedId(raw, m.group(1), lower(m.group(2)), m.group(3), lower(m.group(4)),
                            "opt " + lower(m.group(5)), IdFormat.OPT_FORMAT)
            ),
            // 6. "8A Opt 1"
            new GrammarRule(
                    compile("(\\d+)([a-z])\\s+Opt\\s+(\\d+)"),
                    (raw, m) -> new ParsedId(raw, m.group(1), lower(m.group(2)), null, null,
                            "opt " + m.group(3), IdFormat.OPT_NUM_FORMAT)
            ),
            // 7. "8A1 Opt 3"
            new GrammarRule(
                    compile("(\\d+)([a-z])(\\d+)\\s+Opt\\s+(\\d+)"),
                    (raw, m) -> new ParsedId(raw, m.group(1), lower(m.group(2)), m.group(3), null,
                            "opt " + m.group(4), IdFormat.OPT_NUM_FORMAT)
            ),
            // 8. "2a[1] Ice"
            new GrammarRule(
                    compile("(\\d+)([a-z])\\[(\\d+)\\]\\s+(\\w+)"),
                    (raw, m) -> new ParsedId(raw, m.group(1), lower(m.group(2)), m.group(3), null,
                            lower(m.group(4)), IdFormat.BRACKET_OPTION)
            ),
            // 9. "2d[1]"
            new GrammarRule(
                    compile("(\\d+)([a-z])\\[(\\d+)\\]$"),
                    (raw, m) -> new ParsedId(raw, m.group(1), lower(m.group(2)), m.group(3), null,
                            null, IdFormat.BRACKET_ONLY)
            ),
            // 10. "3a(1)", "6b(i)", "2(a)(1)"
            new GrammarRule(
                    compile("(\\d+)([a-z])?\\(([a-z]|\\d+|i+)\\)(?:\\((\\d+)\\))?"),
                    IdentifierGrammarParser::parenNested
            ),
            // 11. "6c2 hog", "5a Grp 1" - rest is taken verbatim as the option
            new GrammarRule(
                    compile("(\\d+)([a-z])(\\d+)?\\s+(.+)$"),
                    (raw, m) -> new ParsedId(raw, m.group(1), lower(m.group(2)), m.group(3), null,
                            lower(m.group(4).strip()), IdFormat.SPACE_OPTION)
            ),
            // 12. "8a1"
            new GrammarRule(
                    compile("(\\d+)([a-z])(\\d+)$"),
                    (raw, m) -> new ParsedId(raw, m.group(1), lower(m.group(2)), m.group(3), null,
                            null, IdFormat.THREE_PART)
            ),
            // 13. "2a", "2a."
            new GrammarRule(
                    compile("(\\d+)([a-z])\\.?$"),
                    (raw, m) -> new ParsedId(raw, m.group(1), lower(m.group(2)), null, null,
                            null, IdFormat.SIMPLE)
            ),
            // 14. "1", "1."
            new GrammarRule(
                    compile("(\\d+)\\.?$"),
                    (raw, m) -> new ParsedId(raw, m.group(1), null, null, null,
                            null, IdFormat.NUMBER_ONLY)
            )
    );

    /**
     * Parse an authoritative identifier. Never fails: anything that fits no grammar
     * comes back as {@link IdFormat#UNKNOWN} with every field empty.
     *
     * @param id the identifier (nullable)
     * @return the parsed view
     */
    public ParsedId parse(String id) {
        if (id == null || id.isBlank()) {
            return ParsedId.unknown(id);
        }

        String trimmed = id.strip();
        for (GrammarRule rule : GRAMMARS) {
            Matcher matcher = rule.pattern().matcher(trimmed);
            if (matcher.lookingAt()) {
                return rule.extractor().apply(id, matcher);
            }
        }
        return ParsedId.unknown(id);
    }

    // Digit or roman content is a sub-number under the letter; a bare letter is the letter itself
    private static ParsedId parenNested(String raw, Matcher m) {
        String inner = m.group(3);
        if (ROMAN_OR_DIGITS.matcher(inner).matches()) {
            return new ParsedId(raw, m.group(1), lower(m.group(2)), lower(inner), null,
                    null, IdFormat.PAREN_NESTED);
        }
        return new ParsedId(raw, m.group(1), lower(inner), m.group(4), null,
                null, IdFormat.PAREN_NESTED);
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
