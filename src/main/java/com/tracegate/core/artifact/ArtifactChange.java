package com.tracegate.core.artifact;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracegate.core.model.CaseSuiteLink;
import com.tracegate.core.model.TestArtifact;
import com.tracegate.core.policy.ValidationOutcome;

/**
 * A stored artifact together with the layer check it passed.
 *
 * @param validation {@code ok} or {@code warn}; rejected artifacts are never stored
 * @param suiteLink  membership created alongside the artifact; null when none
 */
public record ArtifactChange(
    TestArtifact artifact,
    ValidationOutcome validation,
    @JsonProperty("suite_link") CaseSuiteLink suiteLink
) {}
