package com.chuckbox.reconcile.domain.requirement.model;

/**
 * Structural view of one authoritative identifier such as "6c2 hog" or "2a[1] Ice".
 * Absent fields are null. {@link IdFormat#UNKNOWN} carries no fields at all;
 * every other format carries a main number.
 *
 * @param raw        the identifier as given
 * @param mainNumber top-level requirement number, e.g. "6"
 * @param letter     lower-case letter under the main number
 * @param subNumber  number (or roman "i", "ii") under the letter
 * @param subLetter  lower-case letter under the sub-number
 * @param option     normalized option token, e.g. "hog", "option a", "opt 1"
 * @param format     grammar that produced this view
 */
public record ParsedId(
        String raw,
        String mainNumber,
        String letter,
        String subNumber,
        String subLetter,
        String option,
        IdFormat format
) {
    public static ParsedId unknown(String raw) {
        return new ParsedId(raw, null, null, null, null, null, IdFormat.UNKNOWN);
    }

    public boolean isUnknown() {
        return format == IdFormat.UNKNOWN;
    }
}
