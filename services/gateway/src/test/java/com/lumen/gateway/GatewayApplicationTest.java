package com.lumen.gateway;

import com.lumen.gateway.capability.ServiceLocator;
import com.lumen.gateway.capability.analytic.AnalyticService;
import com.lumen.gateway.capability.analytic.UserEventService;
import com.lumen.gateway.capability.auth.AuthenticationService;
import com.lumen.gateway.capability.auth.User;
import com.lumen.gateway.capability.email.EmailService;
import com.lumen.gateway.capability.job.JobService;
import com.lumen.gateway.capability.license.LicenseService;
import com.lumen.gateway.capability.model.EmbeddingModel;
import com.lumen.gateway.capability.page.PageService;
import com.lumen.gateway.capability.repository.IntegrationService;
import com.lumen.gateway.capability.repository.RepositoryService;
import com.lumen.gateway.capability.setting.SettingService;
import com.lumen.gateway.capability.thread.ThreadService;
import com.lumen.gateway.capability.usergroup.AccessPolicyService;
import com.lumen.gateway.capability.usergroup.UserGroupService;
import com.lumen.gateway.config.GatewayProperties;
import com.lumen.security.Principal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Boots the full context with every capability mocked, using the {@code test} profile.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Gateway Application")
class GatewayApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @MockBean private AuthenticationService auth;
    @MockBean private LicenseService license;
    @MockBean private EmailService email;
    @MockBean private SettingService setting;
    @MockBean private RepositoryService repository;
    @MockBean private IntegrationService integration;
    @MockBean private JobService job;
    @MockBean private AnalyticService analytic;
    @MockBean private UserEventService userEvent;
    @MockBean private ThreadService thread;
    @MockBean private PageService page;
    @MockBean private UserGroupService userGroup;
    @MockBean private AccessPolicyService accessPolicy;
    @MockBean private EmbeddingModel embedding;

    private void signedIn(String token, String userId) {
        when(auth.verifyAccessToken(token)).thenReturn(Optional.of(new Principal(userId, false, false)));
        when(auth.getUser(userId)).thenReturn(Optional.of(
                new User(userId, userId + "@lumen.dev", userId, false, false, true, Instant.now())));
    }

    @Test
    @DisplayName("properties are loaded from the test profile")
    void properties() {
        var props = context.getBean(GatewayProperties.class);
        assertThat(props.name()).isEqualTo("lumen-gateway-test");
        assertThat(props.environment()).isEqualTo("test");
        assertThat(props.streaming().bufferSize()).isEqualTo(8);
    }

    @Test
    @DisplayName("pages are wired when enabled, models are not")
    void locator() {
        var locator = context.getBean(ServiceLocator.class);
        assertThat(locator.page()).isPresent();
        assertThat(locator.chat()).isEmpty();
        assertThat(locator.completion()).isEmpty();
    }

    @Test
    @DisplayName("server info is public")
    void serverInfo() throws Exception {
        when(auth.isAdminInitialized()).thenReturn(true);

        mockMvc.perform(get("/api/v1/server-info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.adminInitialized").value(true))
                .andExpect(jsonPath("$.chatEnabled").value(false))
                .andExpect(jsonPath("$.pageEnabled").value(true));
    }

    @Test
    @DisplayName("anonymous callers get a structured 401")
    void anonymous() throws Exception {
        mockMvc.perform(get("/api/v1/users"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.correlationId").exists());
    }

    @Test
    @DisplayName("a rejected bearer token is treated as anonymous")
    void rejectedToken() throws Exception {
        mockMvc.perform(get("/api/v1/users").header("Authorization", "Bearer expired"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("members cannot call admin operations")
    void memberOnAdminOperation() throws Exception {
        signedIn("member-token", "alice");

        mockMvc.perform(get("/api/v1/users").header("Authorization", "Bearer member-token"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"))
                .andExpect(jsonPath("$.detail").value("You must be admin to proceed"));
    }

    @Test
    @DisplayName("streaming runs are guarded before the stream opens")
    void guardedRun() throws Exception {
        mockMvc.perform(post("/api/v1/threads/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"thread\":{\"userMessage\":{\"content\":\"hi\"}}}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    @DisplayName("malformed bodies are INVALID_INPUT")
    void malformedBody() throws Exception {
        signedIn("member-token", "alice");

        mockMvc.perform(post("/api/v1/threads/runs")
                        .header("Authorization", "Bearer member-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    @DisplayName("correlation id is echoed on responses")
    void correlationId() throws Exception {
        mockMvc.perform(get("/api/v1/server-info").header("X-Correlation-ID", "corr-1"))
                .andExpect(header().string("X-Correlation-ID", "corr-1"));
    }

    @Test
    @DisplayName("actuator health endpoint is available")
    void health() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }
}
