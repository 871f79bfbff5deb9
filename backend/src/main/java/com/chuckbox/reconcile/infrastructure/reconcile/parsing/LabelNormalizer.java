package com.chuckbox.reconcile.infrastructure.reconcile.parsing;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes rendered labels before they are compared:
 * - Invisible character removal
 * - Wrapper/punctuation stripping ("(1)" → "1", "a." → "a")
 * - Shape predicates (bare number, single letter, wrapped)
 */
@Component
public class LabelNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    private static final Pattern LABEL_PUNCTUATION = Pattern.compile("[()\\[\\].,]");

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final Pattern SINGLE_LETTER = Pattern.compile("[a-zA-Z]");

    /**
     * Strip wrappers and punctuation from a raw label.
     *
     * @param rawLabel label as rendered (nullable)
     * @return the clean label, never null
     */
    public String clean(String rawLabel) {
        if (rawLabel == null || rawLabel.isEmpty()) {
            return "";
        }
        String result = INVISIBLE_CHARS.matcher(rawLabel).replaceAll("");
        result = LABEL_PUNCTUATION.matcher(result).replaceAll("");
        return result.strip();
    }

    /**
     * True when the label is rendered inside "(...)" or "[...]".
     */
    public boolean isWrapped(String rawLabel) {
        if (rawLabel == null) {
            return false;
        }
        String trimmed = INVISIBLE_CHARS.matcher(rawLabel).replaceAll("").strip();
        return trimmed.startsWith("(") || trimmed.startsWith("[");
    }

    public boolean isNumber(String cleanLabel) {
        return cleanLabel != null && DIGITS.matcher(cleanLabel).matches();
    }

    /**
     * True when the clean label is a bare number no greater than {@code max}.
     */
    public boolean isNumberAtMost(String cleanLabel, int max) {
        if (!isNumber(cleanLabel)) {
            return false;
        }
        String digits = cleanLabel.replaceFirst("^0+(?=\\d)", "");
        return digits.length() <= 9 && Integer.parseInt(digits) <= max;
    }

    public boolean isSingleLetter(String cleanLabel) {
        return cleanLabel != null && SINGLE_LETTER.matcher(cleanLabel).matches();
    }
}
