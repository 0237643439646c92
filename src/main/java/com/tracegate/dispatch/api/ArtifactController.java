package com.tracegate.dispatch.api;

import com.tracegate.core.artifact.ArtifactChange;
import com.tracegate.core.artifact.ArtifactDraft;
import com.tracegate.core.artifact.TestArtifactService;
import com.tracegate.core.model.AnchorRefs;
import com.tracegate.core.model.CaseSuiteLink;
import com.tracegate.core.model.TestArtifact;
import com.tracegate.core.model.TestLayer;
import com.tracegate.core.suite.AssociationManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the test artifact lifecycle. Changes that a layer rejects return 422.
 */
@RestController
@RequestMapping("/api/v1/artifacts")
public class ArtifactController {

    private final TestArtifactService artifacts;
    private final AssociationManager associations;

    public ArtifactController(TestArtifactService artifacts, AssociationManager associations) {
        this.artifacts = artifacts;
        this.associations = associations;
    }

    @PostMapping
    public ResponseEntity<ArtifactChange> register(@RequestBody ArtifactDraft draft) {
        return ResponseEntity.status(HttpStatus.CREATED).body(artifacts.register(draft));
    }

    @GetMapping("/{artifactId}")
    public ResponseEntity<TestArtifact> get(@PathVariable String artifactId) {
        return ResponseEntity.ok(artifacts.get(artifactId));
    }

    @GetMapping("/{artifactId}/suites")
    public ResponseEntity<List<CaseSuiteLink>> suites(@PathVariable String artifactId) {
        return ResponseEntity.ok(associations.listSuitesForCase(artifactId));
    }

    @PutMapping("/{artifactId}/links")
    public ResponseEntity<ArtifactChange> relink(@PathVariable String artifactId, @RequestBody AnchorRefs refs) {
        return ResponseEntity.ok(artifacts.relink(artifactId, refs));
    }

    @PutMapping("/{artifactId}/layer")
    public ResponseEntity<ArtifactChange> reclassify(@PathVariable String artifactId,
                                                     @RequestBody LayerRequest request) {
        return ResponseEntity.ok(artifacts.reclassify(artifactId, TestLayer.fromCode(request.testLayer())));
    }

    @PostMapping("/{artifactId}/archive")
    public ResponseEntity<TestArtifact> archive(@PathVariable String artifactId) {
        return ResponseEntity.ok(artifacts.archive(artifactId));
    }

    @PostMapping("/{artifactId}/clone")
    public ResponseEntity<ArtifactChange> cloneInto(@PathVariable String artifactId,
                                                    @RequestBody CloneRequest request) {
        if (request.suiteId() == null || request.suiteId().isBlank()) {
            throw new IllegalArgumentException("suite_id is required");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(artifacts.cloneInto(artifactId, request.suiteId()));
    }
}
