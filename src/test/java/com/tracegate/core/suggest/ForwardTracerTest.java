package com.tracegate.core.suggest;

import com.tracegate.core.GraphFixture;
import com.tracegate.core.model.*;
import com.tracegate.core.resolve.ProcessHierarchy;
import com.tracegate.core.store.InMemoryEntityGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ForwardTracerTest {

    private InMemoryEntityGraphStore store;
    private ForwardTracer tracer;

    @BeforeEach
    void setUp() {
        store = GraphFixture.hierarchy();
        store.saveTestArtifact(GraphFixture.anchored("TC-1", "L3-042"));
        store.saveTestArtifact(GraphFixture.artifact("TC-2", TestLayer.ACCEPTANCE, null, null, "R1"));
        store.saveTestArtifact(GraphFixture.artifact("TC-3", TestLayer.COMPONENT, null, "D9", null));
        store.saveTestArtifact(GraphFixture.artifact("TC-4", TestLayer.REGRESSION, null, "D7", null));
        store.saveTestArtifact(GraphFixture.artifact("TC-5", TestLayer.SYSTEM_INTEGRATION, "L3-050", null, "R2"));
        tracer = new ForwardTracer(store, new ProcessHierarchy(store));
    }

    @Test
    @DisplayName("development item finds its directly linked artifacts")
    void developmentItem() {
        var result = tracer.traceDevelopmentItem("D7", "CFG-007");
        assertTrue(result.sourceFound());
        assertEquals(Set.of("TC-4"), result.artifactIds());
        assertEquals("Development item CFG-007 -> TC-4", result.hits().get(0).reason());
    }

    @Test
    @DisplayName("requirement expands to artifacts of its development item")
    void requirementExpansion() {
        var result = tracer.traceRequirement("R1", "REQ-001");
        assertEquals(Set.of("TC-2", "TC-3"), result.artifactIds());
        var viaItem = result.hits().stream().filter(h -> h.artifact().id().equals("TC-3")).findFirst().orElseThrow();
        assertEquals("Requirement REQ-001 -> E-009 -> TC-3", viaItem.reason());
    }

    @Test
    @DisplayName("anchor includes artifacts of requirements anchored to it")
    void anchorWithRequirements() {
        var result = tracer.traceAnchor("L3-050", "OTC.SD.050");
        assertEquals(Set.of("TC-5"), result.artifactIds());
        assertEquals("Process anchor OTC.SD.050 -> TC-5", result.hits().get(0).reason());
    }

    @Test
    @DisplayName("scenario walks anchors, their variants and requirements")
    void scenario() {
        store.saveRequirement(new Requirement("R1", "REQ-001", "Credit check", "L4-042-01", null, "D9"));

        var result = tracer.traceScenario("L1-OTC", "OTC");

        assertEquals(Set.of("TC-2", "TC-3", "TC-5"), result.artifactIds());
        var viaVariant = result.hits().stream().filter(h -> h.artifact().id().equals("TC-2")).findFirst().orElseThrow();
        assertEquals("Scenario OTC -> OTC.SD.042 -> OTC.SD.042.01 -> REQ-001 -> TC-2", viaVariant.reason());
    }

    @Test
    @DisplayName("archived artifacts are never returned")
    void archivedExcluded() {
        store.saveTestArtifact(GraphFixture.anchored("TC-1", "L3-042").asArchived());
        assertTrue(tracer.traceAnchor("L3-042", "OTC.SD.042").hits().isEmpty());
    }

    @Test
    @DisplayName("missing source is reported, not an error")
    void missingSource() {
        var declaration = GraphFixture.declaration("DECL-X", ScopeSourceType.REQUIREMENT, "R-GONE");
        var result = tracer.trace(declaration);
        assertFalse(result.sourceFound());
        assertTrue(result.hits().isEmpty());
    }

    @Test
    @DisplayName("an artifact reached twice is reported once with the first reason")
    void dedupWithinTrace() {
        store.saveTestArtifact(GraphFixture.artifact("TC-6", TestLayer.SYSTEM_INTEGRATION, "L3-050", null, "R2"));
        var result = tracer.traceAnchor("L3-050", "OTC.SD.050");
        assertEquals(2, result.hits().size());
        result.hits().forEach(hit -> assertFalse(hit.reason().contains("REQ-002")));
    }
}
