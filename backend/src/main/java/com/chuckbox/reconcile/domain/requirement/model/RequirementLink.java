package com.chuckbox.reconcile.domain.requirement.model;

/**
 * Link attached to a visual node. Passed through to the canonical output untouched.
 *
 * @param url  target address
 * @param text anchor text
 * @param type source category, e.g. "pamphlet", "worksheet", "video", "external"
 */
public record RequirementLink(
        String url,
        String text,
        String type
) {}
