package com.tracegate.dispatch.api;

import com.tracegate.core.artifact.ArtifactChange;
import com.tracegate.core.artifact.ArtifactDraft;
import com.tracegate.core.artifact.TestArtifactService;
import com.tracegate.core.error.AlreadyExistsException;
import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.error.ValidationRejectedException;
import com.tracegate.core.model.*;
import com.tracegate.core.policy.ValidationOutcome;
import com.tracegate.core.suite.AssociationManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ArtifactController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ArtifactControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TestArtifactService artifacts;

    @MockitoBean
    private AssociationManager associations;

    private static TestArtifact artifact(String id, TestLayer layer, String resolved) {
        return new TestArtifact(id, id, "Create sales order", layer, null, "D9", null,
                resolved, ArtifactOrigin.MANUAL, false);
    }

    @Test
    @DisplayName("POST /artifacts returns 201 with the resolved anchor and validation")
    void register() throws Exception {
        when(artifacts.register(any(ArtifactDraft.class))).thenReturn(new ArtifactChange(
                artifact("TC-9", TestLayer.SYSTEM_INTEGRATION, "L3-042"), ValidationOutcome.ok(), null));

        mockMvc.perform(post("/api/v1/artifacts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"TC-9\",\"title\":\"Create sales order\","
                                + "\"test_layer\":\"sit\",\"development_item_id\":\"D9\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.artifact.resolved_anchor_id").value("L3-042"))
                .andExpect(jsonPath("$.artifact.test_layer").value("sit"))
                .andExpect(jsonPath("$.validation.status").value("ok"));
    }

    @Test
    @DisplayName("POST /artifacts on a mandatory layer without an anchor is 422")
    void rejected() throws Exception {
        when(artifacts.register(any(ArtifactDraft.class))).thenThrow(new ValidationRejectedException(
                TestLayer.ACCEPTANCE, "Layer uat requires a process anchor"));

        mockMvc.perform(post("/api/v1/artifacts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"TC-10\",\"test_layer\":\"uat\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_rejected"))
                .andExpect(jsonPath("$.test_layer").value("uat"))
                .andExpect(jsonPath("$.error").value("Layer uat requires a process anchor"));
    }

    @Test
    @DisplayName("POST /artifacts with an id that is already taken is 409")
    void registerTakenId() throws Exception {
        when(artifacts.register(any(ArtifactDraft.class)))
                .thenThrow(new AlreadyExistsException("Test artifact", "TC-1", null));

        mockMvc.perform(post("/api/v1/artifacts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"TC-1\",\"title\":\"Replacement\",\"test_layer\":\"performance\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("already_exists"))
                .andExpect(jsonPath("$.error").value("Test artifact already exists: TC-1"));
    }

    @Test
    @DisplayName("GET /artifacts/{id} returns 404 for an unknown artifact")
    void getUnknown() throws Exception {
        when(artifacts.get("TC-404")).thenThrow(new NotFoundException("Test artifact", "TC-404"));

        mockMvc.perform(get("/api/v1/artifacts/TC-404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Test artifact not found: TC-404"));
    }

    @Test
    @DisplayName("GET /artifacts/{id}/suites lists memberships")
    void suites() throws Exception {
        when(associations.listSuitesForCase("TC-1")).thenReturn(List.of(
                new CaseSuiteLink("TC-1", "S-A", AddedMethod.MANUAL, Instant.parse("2026-03-01T12:00:00Z")),
                new CaseSuiteLink("TC-1", "S-B", AddedMethod.IMPORTED, Instant.parse("2026-03-02T12:00:00Z"))));

        mockMvc.perform(get("/api/v1/artifacts/TC-1/suites"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].suite_id").value("S-B"));
    }

    @Test
    @DisplayName("PUT /artifacts/{id}/links re-resolves the anchor")
    void relink() throws Exception {
        AnchorRefs refs = AnchorRefs.ofAnchor("L4-042-01");
        when(artifacts.relink("TC-1", refs)).thenReturn(new ArtifactChange(
                artifact("TC-1", TestLayer.SYSTEM_INTEGRATION, "L3-042"), ValidationOutcome.ok(), null));

        mockMvc.perform(put("/api/v1/artifacts/TC-1/links")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"anchor_id\":\"L4-042-01\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.artifact.resolved_anchor_id").value("L3-042"));

        verify(artifacts).relink("TC-1", refs);
    }

    @Test
    @DisplayName("PUT /artifacts/{id}/layer with an unknown layer code is 400")
    void reclassifyUnknownLayer() throws Exception {
        mockMvc.perform(put("/api/v1/artifacts/TC-1/layer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"test_layer\":\"smoke\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));

        verifyNoInteractions(artifacts);
    }

    @Test
    @DisplayName("PUT /artifacts/{id}/layer surfaces a warning for optional layers")
    void reclassifyWarn() throws Exception {
        when(artifacts.reclassify("TC-1", TestLayer.PERFORMANCE)).thenReturn(new ArtifactChange(
                artifact("TC-1", TestLayer.PERFORMANCE, null),
                ValidationOutcome.warn("No process anchor resolved"), null));

        mockMvc.perform(put("/api/v1/artifacts/TC-1/layer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"test_layer\":\"performance\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validation.status").value("warn"))
                .andExpect(jsonPath("$.artifact.resolved_anchor_id").value(nullValue()));
    }

    @Test
    @DisplayName("POST /artifacts/{id}/clone requires a suite id")
    void cloneRequiresSuite() throws Exception {
        mockMvc.perform(post("/api/v1/artifacts/TC-1/clone")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        CaseSuiteLink link = new CaseSuiteLink("TC-11", "S-B", AddedMethod.CLONED,
                Instant.parse("2026-03-01T12:00:00Z"));
        TestArtifact copy = new TestArtifact("TC-11", "TC-1", "Create sales order", TestLayer.SYSTEM_INTEGRATION,
                null, "D9", null, "L3-042", ArtifactOrigin.CLONED, false);
        when(artifacts.cloneInto("TC-1", "S-B")).thenReturn(new ArtifactChange(copy, ValidationOutcome.ok(), link));

        mockMvc.perform(post("/api/v1/artifacts/TC-1/clone")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"suite_id\":\"S-B\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.artifact.origin").value("CLONED"))
                .andExpect(jsonPath("$.suite_link.added_method").value("cloned"));
    }
}
