package com.chuckbox.reconcile.infrastructure.reconcile.parsing;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps descriptive option headings ("Option A—Sprinting", "Beef Cattle Option",
 * "Ice Skating") to the short option tokens used inside authoritative identifiers.
 *
 * Checks, first hit wins:
 *   1. leading "Option X" with a letter        → "option x"
 *   2. leading "Option N" with a number        → "option n"
 *   3. synonym dictionary, substring match     → dictionary token
 *   4. trailing "... Option"                   → first word of the prefix
 */
@Component
public class OptionExtractor {

    private static final Pattern OPTION_LETTER = Pattern.compile(
            "^Option\\s+([A-Z])(?:[\\s\\u2014\\u2013.:-]|$)", Pattern.CASE_INSENSITIVE);

    private static final Pattern OPTION_NUMBER = Pattern.compile(
            "^Option\\s+(\\d+)(?:[\\s\\u2014\\u2013.:-]|$)", Pattern.CASE_INSENSITIVE);

    private static final Pattern TRAILING_OPTION = Pattern.compile(
            "^(.+?)\\s*Option$", Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Iteration order matters: longer phrases are listed before the words they contain
    private static final Map<String, String> SYNONYMS = synonyms();

    /**
     * Extract the option token from a description.
     *
     * @param text description text (nullable)
     * @return the option token, or null if the text names no option
     */
    public String extractOption(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.strip();

        Matcher letter = OPTION_LETTER.matcher(trimmed);
        if (letter.find()) {
            return "option " + letter.group(1).toLowerCase(Locale.ROOT);
        }

        Matcher number = OPTION_NUMBER.matcher(trimmed);
        if (number.find()) {
            return "option " + number.group(1);
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> synonym : SYNONYMS.entrySet()) {
            if (lower.contains(synonym.getKey())) {
                return synonym.getValue();
            }
        }

        Matcher trailing = TRAILING_OPTION.matcher(trimmed);
        if (trailing.find()) {
            String prefix = trailing.group(1).strip();
            return WHITESPACE.split(prefix)[0].toLowerCase(Locale.ROOT);
        }

        return null;
    }

    public Map<String, String> synonymDictionary() {
        return Collections.unmodifiableMap(SYNONYMS);
    }

    private static Map<String, String> synonyms() {
        Map<String, String> map = new LinkedHashMap<>();
        // Animal science
        map.put("beef cattle", "beef");
        map.put("dairying", "dairy");
        map.put("dairy cattle", "dairy");
        map.put("horse", "horse");
        map.put("sheep", "sheep");
        map.put("hog", "hog");
        map.put("swine", "hog");
        map.put("avian", "avian");
        map.put("poultry", "avian");
        map.put("rabbit", "rabbit");
        // Skating
        map.put("ice skating", "ice");
        map.put("inline skating", "line");
        map.put("roller skating", "roll");
        map.put("board skating", "board");
        map.put("skateboard", "board");
        // Snow sports
        map.put("alpine skiing", "alpine");
        map.put("alpine", "alpine");
        map.put("nordic skiing", "nordic");
        map.put("nordic", "nordic");
        map.put("snowshoe", "shoe");
        map.put("snowshoeing", "shoe");
        map.put("snowboard", "snow");
        // Multisport
        map.put("triathlon", "triathlon");
        map.put("duathlon", "duathlon");
        map.put("aquathlon", "aquathlon");
        map.put("aquabike", "aquabike");
        // Groups
        map.put("group 1", "grp 1");
        map.put("group 2", "grp 2");
        map.put("group 3", "grp 3");
        map.put("group 4", "grp 4");
        map.put("group a", "grp a");
        map.put("group b", "grp b");
        map.put("group c", "grp c");
        map.put("group d", "grp d");
        map.put("group e", "grp e");
        map.put("group f", "grp f");
        map.put("group g", "grp g");
        map.put("group h", "grp h");
        map.put("group i", "grp i");
        // Abbreviated options
        map.put("opt 1", "opt 1");
        map.put("opt 2", "opt 2");
        map.put("opt 3", "opt 3");
        map.put("opt a", "opt a");
        map.put("opt b", "opt b");
        map.put("opt c", "opt c");
        return map;
    }
}
