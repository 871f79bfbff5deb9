package com.chuckbox.reconcile.domain.requirement.model;

/**
 * Pairing of an authoritative identifier with a visual node position.
 *
 * @param authoritativeId identifier as given in the tabular export
 * @param nodeIndex       position of the claimed node in the visual sequence
 * @param confidence      confidence of the winning comparison
 * @param matchType       diagnostic reason of the winning comparison
 * @param format          grammar of the identifier
 * @param tiedCandidates  number of later candidates that reached the same confidence
 */
public record MatchAssignment(
        String authoritativeId,
        int nodeIndex,
        int confidence,
        String matchType,
        IdFormat format,
        int tiedCandidates
) {
    public boolean isAmbiguous() {
        return tiedCandidates > 0;
    }
}
