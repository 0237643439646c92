package com.tracegate.dispatch.api;

import com.tracegate.core.model.AnchorRefs;
import com.tracegate.core.model.TestLayer;
import com.tracegate.core.policy.LayerValidationPolicy;
import com.tracegate.core.policy.ValidationOutcome;
import com.tracegate.core.resolve.AnchorResolution;
import com.tracegate.core.resolve.AnchorResolver;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for anchor resolution and layer validation. Both are read-only.
 */
@RestController
@RequestMapping("/api/v1/scope")
public class ScopeController {

    private final AnchorResolver resolver;
    private final LayerValidationPolicy policy;

    public ScopeController(AnchorResolver resolver, LayerValidationPolicy policy) {
        this.resolver = resolver;
        this.policy = policy;
    }

    /**
     * POST /api/v1/scope/resolve: Resolve references to a level-3 anchor.
     * A miss is a 200 with {@code anchor_id: null}.
     */
    @PostMapping("/resolve")
    public ResponseEntity<AnchorResolution> resolve(@RequestBody AnchorRefs refs) {
        return ResponseEntity.ok(resolver.resolve(refs));
    }

    /**
     * POST /api/v1/scope/validate: Check an anchor against a layer's policy.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationOutcome> validate(@RequestBody ValidateRequest request) {
        TestLayer layer = TestLayer.fromCode(request.testLayer());
        return ResponseEntity.ok(policy.validate(layer, request.anchorId()));
    }
}
