package com.baykanat.cardflow.api.controller;

import com.baykanat.cardflow.domain.exception.AuthorizationException;
import com.baykanat.cardflow.domain.mapper.CardflowMapperImpl;
import com.baykanat.cardflow.domain.model.AccessContext;
import com.baykanat.cardflow.domain.model.ConfigScope;
import com.baykanat.cardflow.domain.model.EntropyConfig;
import com.baykanat.cardflow.domain.model.Role;
import com.baykanat.cardflow.domain.service.EntropyConfigService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for EntropyConfigController: ISO-8601 periods, admin role header and error mapping.
 */
@WebMvcTest(EntropyConfigController.class)
@Import(CardflowMapperImpl.class)
class EntropyConfigControllerTest {

    private static final AccessContext ADMIN = new AccessContext("t1", "root", Role.ADMIN);
    private static final AccessContext MEMBER = new AccessContext("t1", "alice", Role.MEMBER);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private EntropyConfigService configService;

    @Test
    @DisplayName("PUT /entropy-configs/boards/{id} - admin stores an ISO-8601 period")
    void adminConfiguresBoard() throws Exception {
        when(configService.configure(ADMIN, ConfigScope.board("b1"), Duration.ofDays(7)))
                .thenReturn(EntropyConfig.builder().tenantId("t1").scope(ConfigScope.board("b1"))
                        .autoPostponePeriod(Duration.ofDays(7)).updatedBy("root")
                        .updatedAt(Instant.parse("2026-07-01T10:00:00Z")).build());

        mockMvc.perform(put("/entropy-configs/boards/b1")
                        .header("X-Tenant-Id", "t1")
                        .header("X-Actor-Id", "root")
                        .header("X-Actor-Role", "admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"auto_postpone_period\": \"P7D\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scope").value("board"))
                .andExpect(jsonPath("$.scope_id").value("b1"))
                .andExpect(jsonPath("$.auto_postpone_period").value("PT168H"));
    }

    @Test
    @DisplayName("PUT /entropy-configs/tenant - member role returns 403")
    void memberIsForbidden() throws Exception {
        when(configService.configure(MEMBER, ConfigScope.tenant("t1"), Duration.ofDays(7)))
                .thenThrow(new AuthorizationException("Only admins can configure auto-postpone periods"));

        mockMvc.perform(put("/entropy-configs/tenant")
                        .header("X-Tenant-Id", "t1")
                        .header("X-Actor-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"auto_postpone_period\": \"P7D\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("PUT /entropy-configs/tenant - malformed duration returns 400")
    void malformedDurationReturns400() throws Exception {
        mockMvc.perform(put("/entropy-configs/tenant")
                        .header("X-Tenant-Id", "t1")
                        .header("X-Actor-Id", "root")
                        .header("X-Actor-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"auto_postpone_period\": \"thirty days\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(configService);
    }

    @Test
    @DisplayName("PUT /entropy-configs/tenant - missing period returns 400")
    void missingPeriodReturns400() throws Exception {
        mockMvc.perform(put("/entropy-configs/tenant")
                        .header("X-Tenant-Id", "t1")
                        .header("X-Actor-Id", "root")
                        .header("X-Actor-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));
    }

    @Test
    @DisplayName("GET /entropy-configs/boards/{id}/effective - returns the resolved period")
    void effectivePeriod() throws Exception {
        when(configService.effectivePeriod(MEMBER, "b1")).thenReturn(Duration.ofDays(30));

        mockMvc.perform(get("/entropy-configs/boards/b1/effective")
                        .header("X-Tenant-Id", "t1")
                        .header("X-Actor-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.board_id").value("b1"))
                .andExpect(jsonPath("$.auto_postpone_period").value("PT720H"));
    }
}
