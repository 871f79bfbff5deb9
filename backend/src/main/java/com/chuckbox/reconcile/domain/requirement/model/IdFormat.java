package com.chuckbox.reconcile.domain.requirement.model;

/**
 * Grammar shapes an authoritative identifier can take, in parser priority order.
 */
public enum IdFormat {
    OPTION_FORMAT("option_format"),
    OPT_DOT_FORMAT("opt_dot_format"),
    OTHER("other"),
    PAREN_OPTION("paren_option"),
    OPT_FORMAT("opt_format"),
    OPT_NUM_FORMAT("opt_num_format"),
    BRACKET_OPTION("bracket_option"),
    BRACKET_ONLY("bracket_only"),
    PAREN_NESTED("paren_nested"),
    SPACE_OPTION("space_option"),
    THREE_PART("three_part"),
    SIMPLE("simple"),
    NUMBER_ONLY("number_only"),
    UNKNOWN("unknown");

    private final String tag;

    IdFormat(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
