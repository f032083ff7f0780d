package com.voltscope.sampling;

import java.util.List;

/**
 * Raised when neither an explicit key nor an inferable default field determines the x or y accessor of a series.
 */
public class ResolutionException extends IllegalArgumentException {
    private final KeyRole role;
    private final List<String> candidates;

    public ResolutionException(KeyRole role, List<String> candidates, String message) {
        super(message);
        this.role = role;
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public KeyRole role() {
        return role;
    }

    /** Keys that were tried, in the order they were tried. */
    public List<String> candidates() {
        return candidates;
    }

    public enum KeyRole {
        X,
        Y
    }
}
