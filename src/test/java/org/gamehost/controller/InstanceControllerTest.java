package org.gamehost.controller;

import org.gamehost.dto.ProvisioningResult;
import org.gamehost.entity.InstanceStatus;
import org.gamehost.exception.AuthorizationException;
import org.gamehost.exception.ContainerException;
import org.gamehost.exception.InstanceNotFoundException;
import org.gamehost.exception.LifecycleConflictException;
import org.gamehost.exception.PortException;
import org.gamehost.exception.RuntimeUnavailableException;
import org.gamehost.security.JwtTokenService;
import org.gamehost.security.TokenAuthenticator;
import org.gamehost.service.InstanceLifecycleService;
import org.gamehost.service.InstanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.net.ConnectException;
import java.util.Arrays;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class InstanceControllerTest {

    private static final String SECRET = "test-secret-key-that-is-at-least-32-bytes-long";

    private InstanceService instanceService;
    private InstanceLifecycleService lifecycleService;
    private MockMvc mockMvc;
    private String bearer;

    @BeforeEach
    void setUp() {
        instanceService = mock(InstanceService.class);
        lifecycleService = mock(InstanceLifecycleService.class);
        JwtTokenService jwtTokenService = new JwtTokenService(SECRET, 3600);

        InstanceController controller = new InstanceController();
        ReflectionTestUtils.setField(controller, "instanceService", instanceService);
        ReflectionTestUtils.setField(controller, "lifecycleService", lifecycleService);
        ReflectionTestUtils.setField(controller, "tokenAuthenticator", new TokenAuthenticator(jwtTokenService));

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
        bearer = "Bearer " + jwtTokenService.generateToken("user-1", "u1@example.com");
    }

    @Test
    void createReturnsCreatedWithConnectionDetails() throws Exception {
        ProvisioningResult result = new ProvisioningResult();
        result.setInstanceId("gs-1");
        result.setPort(25570);
        result.setIpAddress("154.12.1.20");
        result.setSecret("Xy7pQr2sTu9v");
        result.setStatus("RUNNING");
        when(instanceService.createInstance(eq("user-1"), any())).thenReturn(result);

        mockMvc.perform(post("/api/instances")
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"survival\",\"memory\":2,\"diskSpace\":10}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.port").value(25570))
            .andExpect(jsonPath("$.data.secret").value("Xy7pQr2sTu9v"));
    }

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/instances"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.errorCode").value(AuthorizationException.ERROR_CODE_AUTHENTICATION_FAILED));
    }

    @Test
    void foreignInstanceIsForbidden() throws Exception {
        when(instanceService.requireOwned("user-1", "gs-2"))
            .thenThrow(new AuthorizationException(AuthorizationException.ERROR_CODE_ACCESS_DENIED, "无权访问该实例"));

        mockMvc.perform(post("/api/instances/gs-2/stop").header(HttpHeaders.AUTHORIZATION, bearer))
            .andExpect(status().isForbidden());
        verify(lifecycleService, never()).stop(any(), any());
    }

    @Test
    void unknownInstanceIsNotFound() throws Exception {
        when(instanceService.requireOwned("user-1", "gs-x")).thenThrow(new InstanceNotFoundException("gs-x"));

        mockMvc.perform(get("/api/instances/gs-x/status").header(HttpHeaders.AUTHORIZATION, bearer))
            .andExpect(status().isNotFound());
    }

    @Test
    void concurrentOperationIsConflict() throws Exception {
        when(lifecycleService.restart("gs-1")).thenThrow(new LifecycleConflictException("gs-1", "restart"));

        mockMvc.perform(post("/api/instances/gs-1/restart").header(HttpHeaders.AUTHORIZATION, bearer))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value(LifecycleConflictException.ERROR_CODE));
    }

    @Test
    void invalidStateIsConflict() throws Exception {
        when(lifecycleService.stop("gs-1", null)).thenThrow(
            new ContainerException(ContainerException.ERROR_CODE_INVALID_STATE, "实例尚未启动"));

        mockMvc.perform(post("/api/instances/gs-1/stop").header(HttpHeaders.AUTHORIZATION, bearer))
            .andExpect(status().isConflict());
    }

    @Test
    void unreachableRuntimeIsServiceUnavailable() throws Exception {
        when(lifecycleService.getStatus("gs-1")).thenThrow(
            new RuntimeUnavailableException("Docker 守护进程不可达", new ConnectException("refused")));

        mockMvc.perform(get("/api/instances/gs-1/status").header(HttpHeaders.AUTHORIZATION, bearer))
            .andExpect(status().isServiceUnavailable());
    }

    @Test
    void exhaustedPortsIsServiceUnavailable() throws Exception {
        when(instanceService.createInstance(eq("user-1"), any())).thenThrow(
            new PortException(PortException.ERROR_CODE_PORTS_EXHAUSTED, "没有可用的端口"));

        mockMvc.perform(post("/api/instances")
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"survival\",\"memory\":2,\"diskSpace\":10}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.errorCode").value(PortException.ERROR_CODE_PORTS_EXHAUSTED));
    }

    @Test
    void invalidTailIsBadRequest() throws Exception {
        when(lifecycleService.getLogBuffer("gs-1", 0)).thenThrow(new IllegalArgumentException("tail 必须为正数"));

        mockMvc.perform(get("/api/instances/gs-1/logs?tail=0").header(HttpHeaders.AUTHORIZATION, bearer))
            .andExpect(status().isBadRequest());
    }

    @Test
    void logsAndDestroyDelegateToLifecycle() throws Exception {
        when(lifecycleService.getLogBuffer("gs-1", 2)).thenReturn(Arrays.asList("a", "b"));
        when(lifecycleService.destroy("gs-1", true)).thenReturn(InstanceStatus.DESTROYED);

        mockMvc.perform(get("/api/instances/gs-1/logs?tail=2").header(HttpHeaders.AUTHORIZATION, bearer))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[1]").value("b"));
        mockMvc.perform(delete("/api/instances/gs-1?purge=true").header(HttpHeaders.AUTHORIZATION, bearer))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value("DESTROYED"));
    }
}
