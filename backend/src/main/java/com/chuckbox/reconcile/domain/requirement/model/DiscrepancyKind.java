package com.chuckbox.reconcile.domain.requirement.model;

public enum DiscrepancyKind {
    CSV_NOT_IN_UI("csv_not_in_ui"),
    UI_NOT_MATCHED("ui_not_matched"),
    BADGE_NOT_ACCESSIBLE("badge_not_accessible"),
    AMBIGUOUS_MATCH("ambiguous_match"),
    VERSION_MISMATCH("version_mismatch");

    private final String tag;

    DiscrepancyKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
