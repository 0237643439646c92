package com.tracegate.core.suggest;

import com.tracegate.core.model.TestArtifact;

/**
 * A test artifact reached from a scope source, with the path that reached it.
 */
public record TraceHit(TestArtifact artifact, String reason) {}
