package com.tracegate.core.suggest;

import com.tracegate.core.model.*;
import com.tracegate.core.resolve.ProcessHierarchy;
import com.tracegate.core.store.ArtifactLinkField;
import com.tracegate.core.store.EntityGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Traces a scope source forward to the test artifacts that verify it.
 * <p>
 * Shared by suggestion and coverage so both see the same traceable set:
 * <ul>
 *   <li>development item: artifacts linked to the item</li>
 *   <li>requirement: artifacts linked to the requirement, to its derived item, and to any item
 *       back-linked to it</li>
 *   <li>process anchor: artifacts anchored to the node, plus the requirement expansion of every
 *       requirement anchored to it</li>
 *   <li>scenario: every level-3 node under the scenario node, every requirement anchored to that
 *       node or one of its level-4 variants, then the requirement expansion</li>
 * </ul>
 * Archived artifacts are never returned. Within one trace the first path to reach an artifact
 * supplies its reason.
 */
@Component
public class ForwardTracer {

    private static final Logger log = LoggerFactory.getLogger(ForwardTracer.class);

    private final EntityGraphStore store;
    private final ProcessHierarchy hierarchy;

    public ForwardTracer(EntityGraphStore store, ProcessHierarchy hierarchy) {
        this.store = store;
        this.hierarchy = hierarchy;
    }

    public TraceResult trace(ScopeDeclaration declaration) {
        String label = declaration.label();
        return switch (declaration.sourceType()) {
            case DEVELOPMENT_ITEM -> traceDevelopmentItem(declaration.sourceId(), label);
            case REQUIREMENT -> traceRequirement(declaration.sourceId(), label);
            case PROCESS_ANCHOR -> traceAnchor(declaration.sourceId(), label);
            case SCENARIO -> traceScenario(declaration.sourceId(), label);
        };
    }

    public TraceResult traceDevelopmentItem(String itemId, String label) {
        if (store.findDevelopmentItem(itemId).isEmpty()) {
            return TraceResult.missingSource();
        }
        var hits = new LinkedHashMap<String, TraceHit>();
        collect(hits, ArtifactLinkField.DEVELOPMENT_ITEM_ID, itemId, "Development item " + label);
        return found(hits);
    }

    public TraceResult traceRequirement(String requirementId, String label) {
        Optional<Requirement> requirement = store.findRequirement(requirementId);
        if (requirement.isEmpty()) {
            return TraceResult.missingSource();
        }
        var hits = new LinkedHashMap<String, TraceHit>();
        expandRequirement(hits, requirement.get(), "Requirement " + label);
        return found(hits);
    }

    public TraceResult traceAnchor(String anchorId, String label) {
        if (store.findNode(anchorId).isEmpty()) {
            return TraceResult.missingSource();
        }
        var hits = new LinkedHashMap<String, TraceHit>();
        String prefix = "Process anchor " + label;
        collect(hits, ArtifactLinkField.ANCHOR_ID, anchorId, prefix);
        for (Requirement requirement : store.findRequirementsByAnchor(anchorId)) {
            expandRequirement(hits, requirement, prefix + " -> " + requirement.code());
        }
        return found(hits);
    }

    public TraceResult traceScenario(String scenarioNodeId, String label) {
        if (store.findNode(scenarioNodeId).isEmpty()) {
            return TraceResult.missingSource();
        }
        var hits = new LinkedHashMap<String, TraceHit>();
        for (ProcessNode anchor : hierarchy.anchorLevelDescendants(scenarioNodeId)) {
            String prefix = "Scenario " + label + " -> " + anchor.code();
            for (Requirement requirement : store.findRequirementsByAnchor(anchor.id())) {
                expandRequirement(hits, requirement, prefix + " -> " + requirement.code());
            }
            for (ProcessNode variant : hierarchy.variantsOf(anchor.id())) {
                for (Requirement requirement : store.findRequirementsByAnchor(variant.id())) {
                    expandRequirement(hits, requirement,
                            prefix + " -> " + variant.code() + " -> " + requirement.code());
                }
            }
        }
        log.debug("Scenario {} traced to {} artifacts", scenarioNodeId, hits.size());
        return found(hits);
    }

    private void expandRequirement(Map<String, TraceHit> hits, Requirement requirement, String prefix) {
        collect(hits, ArtifactLinkField.REQUIREMENT_ID, requirement.id(), prefix);
        String derivedId = requirement.developmentItemId();
        if (derivedId != null && !derivedId.isBlank()) {
            String itemCode = store.findDevelopmentItem(derivedId).map(DevelopmentItem::code).orElse(derivedId);
            collect(hits, ArtifactLinkField.DEVELOPMENT_ITEM_ID, derivedId, prefix + " -> " + itemCode);
        }
        for (DevelopmentItem item : store.findDevelopmentItemsByRequirement(requirement.id())) {
            if (!item.id().equals(derivedId)) {
                collect(hits, ArtifactLinkField.DEVELOPMENT_ITEM_ID, item.id(), prefix + " -> " + item.code());
            }
        }
    }

    private void collect(Map<String, TraceHit> hits, ArtifactLinkField field, String id, String prefix) {
        for (TestArtifact artifact : store.findTestArtifactsBy(field, id)) {
            if (!artifact.archived()) {
                hits.putIfAbsent(artifact.id(), new TraceHit(artifact, prefix + " -> " + artifact.code()));
            }
        }
    }

    private static TraceResult found(Map<String, TraceHit> hits) {
        return new TraceResult(true, new ArrayList<>(hits.values()));
    }
}
