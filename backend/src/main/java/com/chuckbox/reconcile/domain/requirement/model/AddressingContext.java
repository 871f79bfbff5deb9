package com.chuckbox.reconcile.domain.requirement.model;

/**
 * Addressing state in effect at one position of the visual sequence.
 * Derived only from the nodes up to and including that position.
 *
 * @param mainNumber     active main requirement number (nullable)
 * @param letter         active letter, lower-case (nullable)
 * @param letterIsHeader true when the active letter was rendered without a checkbox
 * @param subLetter      active sub-letter (nullable)
 * @param option         active option token (nullable)
 */
public record AddressingContext(
        String mainNumber,
        String letter,
        boolean letterIsHeader,
        String subLetter,
        String option
) {
    public static final AddressingContext EMPTY = new AddressingContext(null, null, false, null, null);
}
