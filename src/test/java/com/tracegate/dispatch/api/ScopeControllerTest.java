package com.tracegate.dispatch.api;

import com.tracegate.core.model.AnchorRefs;
import com.tracegate.core.model.TestLayer;
import com.tracegate.core.policy.LayerValidationPolicy;
import com.tracegate.core.policy.ValidationOutcome;
import com.tracegate.core.resolve.AnchorResolution;
import com.tracegate.core.resolve.AnchorResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScopeController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ScopeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AnchorResolver resolver;

    @MockitoBean
    private LayerValidationPolicy policy;

    // ── POST /api/v1/scope/resolve ──────────────────────────────────────

    @Test
    @DisplayName("POST /scope/resolve returns the anchor and the path that found it")
    void resolveHit() throws Exception {
        when(resolver.resolve(new AnchorRefs(null, "D9", null)))
                .thenReturn(new AnchorResolution("L3-042", "development_item"));

        mockMvc.perform(post("/api/v1/scope/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"development_item_id\":\"D9\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anchor_id").value("L3-042"))
                .andExpect(jsonPath("$.path").value("development_item"));
    }

    @Test
    @DisplayName("POST /scope/resolve miss is 200 with a null anchor")
    void resolveMiss() throws Exception {
        when(resolver.resolve(any())).thenReturn(AnchorResolution.miss());

        mockMvc.perform(post("/api/v1/scope/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"development_item_id\":\"D7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anchor_id").value(nullValue()))
                .andExpect(jsonPath("$.path").value("none"));
    }

    // ── POST /api/v1/scope/validate ─────────────────────────────────────

    @Test
    @DisplayName("POST /scope/validate reports a rejection as data, not an error")
    void validateReject() throws Exception {
        when(policy.validate(eq(TestLayer.SYSTEM_INTEGRATION), any()))
                .thenReturn(ValidationOutcome.reject("A level-3 process anchor is required"));

        mockMvc.perform(post("/api/v1/scope/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"test_layer\":\"sit\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("reject"))
                .andExpect(jsonPath("$.message").value(containsString("anchor")));
    }

    @Test
    @DisplayName("POST /scope/validate with an unknown layer is 400")
    void validateUnknownLayer() throws Exception {
        mockMvc.perform(post("/api/v1/scope/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"test_layer\":\"smoke\",\"anchor_id\":\"L3-042\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));
    }

    @Test
    @DisplayName("malformed body is 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/scope/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }
}
