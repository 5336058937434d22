package com.kotsin.surge.detector;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One (pattern, cause) pair matched against free-text news headlines.
 */
public record CauseRule(Pattern pattern, String cause) {

    public CauseRule {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(cause, "cause cannot be null");
    }

    /**
     * Case-insensitive rule from a regular expression.
     */
    public static CauseRule of(String regex, String cause) {
        return new CauseRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), cause);
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
