package com.tracegate.dispatch.api;

import com.tracegate.core.model.AddedMethod;
import com.tracegate.core.model.CaseSuiteLink;
import com.tracegate.core.suite.AssociationManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for suite membership.
 */
@RestController
@RequestMapping("/api/v1/suites")
public class SuiteController {

    private final AssociationManager associations;

    public SuiteController(AssociationManager associations) {
        this.associations = associations;
    }

    @GetMapping("/{suiteId}/cases")
    public ResponseEntity<List<CaseSuiteLink>> listCases(@PathVariable String suiteId) {
        return ResponseEntity.ok(associations.listCasesForSuite(suiteId));
    }

    /**
     * POST /api/v1/suites/{suiteId}/cases: Add an artifact to the suite. 409 when already a member.
     */
    @PostMapping("/{suiteId}/cases")
    public ResponseEntity<CaseSuiteLink> link(@PathVariable String suiteId, @RequestBody LinkRequest request) {
        if (request.testArtifactId() == null || request.testArtifactId().isBlank()) {
            throw new IllegalArgumentException("test_artifact_id is required");
        }
        CaseSuiteLink link = associations.link(request.testArtifactId(), suiteId, request.addedMethod());
        return ResponseEntity.status(HttpStatus.CREATED).body(link);
    }

    @DeleteMapping("/{suiteId}/cases/{artifactId}")
    public ResponseEntity<Void> unlink(@PathVariable String suiteId, @PathVariable String artifactId) {
        associations.unlink(artifactId, suiteId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{suiteId}/provenance")
    public ResponseEntity<Map<String, Long>> provenance(@PathVariable String suiteId) {
        Map<String, Long> result = new LinkedHashMap<>();
        for (Map.Entry<AddedMethod, Long> entry : associations.provenanceBreakdown(suiteId).entrySet()) {
            result.put(entry.getKey().code(), entry.getValue());
        }
        return ResponseEntity.ok(result);
    }
}
