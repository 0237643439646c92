package com.tracegate.core.resolve;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of an anchor resolution.
 *
 * @param anchorId level-3 node id; null on a miss
 * @param path     name of the strategy that matched; {@code "none"} on a miss
 */
public record AnchorResolution(
    @JsonProperty("anchor_id") String anchorId,
    String path
) {
    public static final String NO_PATH = "none";

    public static AnchorResolution miss() {
        return new AnchorResolution(null, NO_PATH);
    }

    public boolean resolved() {
        return anchorId != null;
    }
}
