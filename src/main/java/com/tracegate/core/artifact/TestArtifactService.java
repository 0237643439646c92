package com.tracegate.core.artifact;

import com.tracegate.core.error.AlreadyExistsException;
import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.error.ValidationRejectedException;
import com.tracegate.core.logging.MdcContext;
import com.tracegate.core.model.*;
import com.tracegate.core.policy.LayerValidationPolicy;
import com.tracegate.core.policy.ValidationOutcome;
import com.tracegate.core.resolve.AnchorResolver;
import com.tracegate.core.store.EntityGraphStore;
import com.tracegate.core.store.UniqueViolationException;
import com.tracegate.core.suite.AssociationManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Creates and maintains test artifacts.
 * <p>
 * Every change to an artifact's links or layer re-resolves its anchor and re-applies the layer
 * policy; a rejected change is never stored. Artifacts are archived, never deleted.
 */
@Service
public class TestArtifactService {

    private static final Logger log = LoggerFactory.getLogger(TestArtifactService.class);

    private final EntityGraphStore store;
    private final AnchorResolver resolver;
    private final LayerValidationPolicy policy;
    private final AssociationManager associations;

    public TestArtifactService(EntityGraphStore store, AnchorResolver resolver,
                               LayerValidationPolicy policy, AssociationManager associations) {
        this.store = store;
        this.resolver = resolver;
        this.policy = policy;
        this.associations = associations;
    }

    public TestArtifact get(String artifactId) {
        return store.findTestArtifact(artifactId)
                .orElseThrow(() -> new NotFoundException("Test artifact", artifactId));
    }

    /**
     * Registers a new artifact and optionally places it in a suite, tagging the membership with
     * the provenance that matches the artifact's origin.
     *
     * @throws ValidationRejectedException if the layer mandates an anchor and none resolves
     * @throws NotFoundException           if a referenced entity or the suite does not exist
     * @throws AlreadyExistsException      if the given id is taken, including by an archived artifact
     * @throws IllegalArgumentException    if the layer or title is missing
     */
    public ArtifactChange register(ArtifactDraft draft) {
        if (draft.testLayer() == null) {
            throw new IllegalArgumentException("test_layer is required");
        }
        if (draft.title() == null || draft.title().isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        requireReferences(draft.refs());
        if (draft.suiteId() != null && store.findSuite(draft.suiteId()).isEmpty()) {
            throw new NotFoundException("Suite", draft.suiteId());
        }
        ArtifactOrigin origin = draft.origin() != null ? draft.origin() : ArtifactOrigin.MANUAL;
        if (origin == ArtifactOrigin.FROM_DEVELOPMENT_ITEM && isBlank(draft.developmentItemId())) {
            throw new IllegalArgumentException("Artifacts generated from a development item need development_item_id");
        }
        if (origin == ArtifactOrigin.FROM_PROCESS && isBlank(draft.anchorId())) {
            throw new IllegalArgumentException("Artifacts generated from a process node need anchor_id");
        }

        String id = isBlank(draft.id()) ? UUID.randomUUID().toString() : draft.id();
        if (store.findTestArtifact(id).isPresent()) {
            throw new AlreadyExistsException("Test artifact", id, null);
        }
        MdcContext.setArtifact(id);
        try {
            String anchor = resolver.resolveAnchor(draft.refs()).orElse(null);
            ValidationOutcome validation = policy.enforce(draft.testLayer(), anchor);
            var artifact = new TestArtifact(id, isBlank(draft.code()) ? id : draft.code(), draft.title(),
                    draft.testLayer(), draft.anchorId(), draft.developmentItemId(), draft.requirementId(),
                    anchor, origin, false);
            insert(artifact);
            log.info("Registered {} artifact {} (anchor {}, {})", draft.testLayer().code(), id, anchor,
                    validation.status().code());
            CaseSuiteLink link = draft.suiteId() != null
                    ? associations.link(id, draft.suiteId(), provenanceOf(origin))
                    : null;
            return new ArtifactChange(artifact, validation, link);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Replaces the upstream links of an artifact.
     */
    public ArtifactChange relink(String artifactId, AnchorRefs refs) {
        TestArtifact existing = get(artifactId);
        AnchorRefs links = refs != null ? refs : new AnchorRefs(null, null, null);
        requireReferences(links);
        String anchor = resolver.resolveAnchor(links).orElse(null);
        ValidationOutcome validation = policy.enforce(existing.testLayer(), anchor);
        TestArtifact updated = existing.withLinks(links, anchor);
        store.saveTestArtifact(updated);
        log.info("Re-linked artifact {} (anchor {} -> {})", artifactId, existing.resolvedAnchorId(), anchor);
        return new ArtifactChange(updated, validation, null);
    }

    /**
     * Moves an artifact to another test layer, re-checking the layer's anchor requirement.
     */
    public ArtifactChange reclassify(String artifactId, TestLayer layer) {
        if (layer == null) {
            throw new IllegalArgumentException("test_layer is required");
        }
        TestArtifact existing = get(artifactId);
        String anchor = resolver.resolveAnchor(existing.refs()).orElse(null);
        ValidationOutcome validation = policy.enforce(layer, anchor);
        TestArtifact updated = existing.withLayer(layer, anchor);
        store.saveTestArtifact(updated);
        log.info("Reclassified artifact {} from {} to {}", artifactId, existing.testLayer().code(), layer.code());
        return new ArtifactChange(updated, validation, null);
    }

    public TestArtifact archive(String artifactId) {
        TestArtifact archived = get(artifactId).asArchived();
        store.saveTestArtifact(archived);
        log.info("Archived artifact {}", artifactId);
        return archived;
    }

    /**
     * Copies an artifact, links included, and places the copy in a suite with provenance
     * {@code cloned}.
     */
    public ArtifactChange cloneInto(String artifactId, String suiteId) {
        TestArtifact source = get(artifactId);
        if (store.findSuite(suiteId).isEmpty()) {
            throw new NotFoundException("Suite", suiteId);
        }
        String anchor = resolver.resolveAnchor(source.refs()).orElse(null);
        ValidationOutcome validation = policy.enforce(source.testLayer(), anchor);
        String id = UUID.randomUUID().toString();
        var copy = new TestArtifact(id, source.code() + "-CLONE", source.title(), source.testLayer(),
                source.anchorId(), source.developmentItemId(), source.requirementId(), anchor,
                ArtifactOrigin.CLONED, false);
        insert(copy);
        CaseSuiteLink link = associations.link(id, suiteId, AddedMethod.CLONED);
        log.info("Cloned artifact {} into {} as {}", artifactId, suiteId, id);
        return new ArtifactChange(copy, validation, link);
    }

    static AddedMethod provenanceOf(ArtifactOrigin origin) {
        return switch (origin) {
            case MANUAL -> AddedMethod.MANUAL;
            case FROM_DEVELOPMENT_ITEM -> AddedMethod.DERIVED_FROM_DEVELOPMENT_ITEM;
            case FROM_PROCESS -> AddedMethod.DERIVED_FROM_PROCESS;
            case CLONED -> AddedMethod.CLONED;
        };
    }

    private void insert(TestArtifact artifact) {
        try {
            store.insertTestArtifact(artifact);
        } catch (UniqueViolationException e) {
            throw new AlreadyExistsException("Test artifact", artifact.id(), e);
        }
    }

    private void requireReferences(AnchorRefs refs) {
        if (!isBlank(refs.anchorId()) && store.findNode(refs.anchorId()).isEmpty()) {
            throw new NotFoundException("Process node", refs.anchorId());
        }
        if (!isBlank(refs.developmentItemId()) && store.findDevelopmentItem(refs.developmentItemId()).isEmpty()) {
            throw new NotFoundException("Development item", refs.developmentItemId());
        }
        if (!isBlank(refs.requirementId()) && store.findRequirement(refs.requirementId()).isEmpty()) {
            throw new NotFoundException("Requirement", refs.requirementId());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
