package com.tracegate.core.suggest;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Artifacts traceable from one scope source, deduplicated, in discovery order.
 *
 * @param sourceFound false when the declared source entity no longer exists; {@code hits} is
 *                    then empty
 */
public record TraceResult(boolean sourceFound, List<TraceHit> hits) {

    public static TraceResult missingSource() {
        return new TraceResult(false, List.of());
    }

    public Set<String> artifactIds() {
        Set<String> ids = new LinkedHashSet<>();
        hits.forEach(h -> ids.add(h.artifact().id()));
        return ids;
    }
}
