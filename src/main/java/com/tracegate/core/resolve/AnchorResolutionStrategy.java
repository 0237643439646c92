package com.tracegate.core.resolve;

import com.tracegate.core.model.AnchorRefs;

import java.util.Optional;

/**
 * One path from an artifact's upstream references to its level-3 anchor.
 * <p>
 * Strategies are tried in ascending {@link #priority()} order and the first one that returns a
 * value wins. A strategy that cannot resolve returns empty and never throws for missing data.
 */
public interface AnchorResolutionStrategy {

    /** Lower runs first. */
    int priority();

    /** Short path name, used in logs and metrics. */
    String name();

    Optional<String> resolve(AnchorRefs refs);
}
