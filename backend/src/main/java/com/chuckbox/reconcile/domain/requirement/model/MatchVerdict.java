package com.chuckbox.reconcile.domain.requirement.model;

/**
 * Outcome of comparing one parsed identifier against one visual node.
 *
 * @param matched    true if the node corroborates the identifier
 * @param confidence 0 when not matched, otherwise the format's fixed confidence
 * @param reason     diagnostic description of the comparison
 */
public record MatchVerdict(
        boolean matched,
        int confidence,
        String reason
) {
    public static MatchVerdict of(boolean matched, int confidence, String reason) {
        return new MatchVerdict(matched, matched ? confidence : 0, reason);
    }
}
