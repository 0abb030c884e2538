package com.findly.search.fallback;

import java.util.EnumSet;
import java.util.Set;

public enum FallbackState {
    FILTERED,
    FALLBACK,
    DONE;

    /**
     * FILTERED may finish or fall back once; FALLBACK can only finish. Nothing leaves DONE.
     */
    public Set<FallbackState> successors() {
        return switch (this) {
            case FILTERED -> EnumSet.of(FALLBACK, DONE);
            case FALLBACK -> EnumSet.of(DONE);
            case DONE -> EnumSet.noneOf(FallbackState.class);
        };
    }

    public boolean canTransitionTo(FallbackState next) {
        return successors().contains(next);
    }
}
