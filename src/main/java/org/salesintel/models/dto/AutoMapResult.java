package org.salesintel.models.dto;

import org.salesintel.models.enums.AutoMapOutcome;

public record AutoMapResult(AutoMapOutcome outcome, int count, String message) {

    public static AutoMapResult suggested(int count) {
        return new AutoMapResult(AutoMapOutcome.SUGGESTED, count, "Suggested " + count + " field mappings");
    }

    public static AutoMapResult noSuggestions() {
        return new AutoMapResult(AutoMapOutcome.NO_SUGGESTIONS, 0, "No mappings suggested");
    }

    public static AutoMapResult defaultsApplied(int count) {
        return new AutoMapResult(AutoMapOutcome.DEFAULTS_APPLIED, count, "Applied " + count + " default mappings");
    }

    public static AutoMapResult noDefaults() {
        return new AutoMapResult(AutoMapOutcome.NO_DEFAULTS, 0, "No default mappings available");
    }

    public boolean replacedSet() {
        return outcome == AutoMapOutcome.SUGGESTED
                || outcome == AutoMapOutcome.DEFAULTS_APPLIED;
    }
}
