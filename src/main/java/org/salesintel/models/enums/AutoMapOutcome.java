package org.salesintel.models.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AutoMapOutcome {
    /** Suggestions replaced the in-memory set. */
    SUGGESTED("suggested"),
    /** The capability answered with nothing; the set is untouched. */
    NO_SUGGESTIONS("no_suggestions"),
    /** The capability failed and the static default table replaced the set. */
    DEFAULTS_APPLIED("defaults_applied"),
    /** No default table exists for the pair; the set is untouched. */
    NO_DEFAULTS("no_defaults");

    private final String wireName;

    AutoMapOutcome(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
