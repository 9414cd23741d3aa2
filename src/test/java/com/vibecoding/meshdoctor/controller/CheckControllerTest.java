package com.vibecoding.meshdoctor.controller;

import com.vibecoding.meshdoctor.exception.ApiExceptionHandler;
import com.vibecoding.meshdoctor.exception.CheckRetryException;
import com.vibecoding.meshdoctor.exception.HealthCheckException;
import com.vibecoding.meshdoctor.healthcheck.Check;
import com.vibecoding.meshdoctor.healthcheck.CheckObserver;
import com.vibecoding.meshdoctor.healthcheck.CheckOptions;
import com.vibecoding.meshdoctor.healthcheck.CheckResult;
import com.vibecoding.meshdoctor.healthcheck.HealthChecker;
import com.vibecoding.meshdoctor.healthcheck.RetryingCheckRunner;
import com.vibecoding.meshdoctor.service.HealthCheckService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("CheckController")
class CheckControllerTest {

    private HealthCheckService healthCheckService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        healthCheckService = mock(HealthCheckService.class);
        when(healthCheckService.defaultOptions()).thenReturn(CheckOptions.builder().controlPlaneNamespace("linkerd"));
        mockMvc = MockMvcBuilders.standaloneSetup(new CheckController(healthCheckService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    private static CheckResult result(String description, Exception error, boolean warning) {
        return CheckResult.builder()
            .category("data-plane")
            .description(description)
            .error(error)
            .retry(error instanceof CheckRetryException)
            .warning(warning)
            .build();
    }

    @Test
    @DisplayName("should stream observed results into the report with their status")
    void shouldReportResults() throws Exception {
        when(healthCheckService.runChecks(any(), any())).thenAnswer(invocation -> {
            CheckObserver observer = invocation.getArgument(1);
            observer.observe(result("namespace exists", null, false));
            observer.observe(result("proxies are ready", new CheckRetryException("web-1 not ready"), false));
            observer.observe(result("cli is up-to-date", new HealthCheckException("outdated"), true));
            observer.observe(result("proxies are healthy", new HealthCheckException("broken"), false));
            return false;
        });

        mockMvc.perform(get("/api/check").param("proxy", "true").param("namespace", "emojivoto"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.results.length()").value(4))
            .andExpect(jsonPath("$.results[0].status").value("ok"))
            .andExpect(jsonPath("$.results[1].status").value("retry"))
            .andExpect(jsonPath("$.results[1].error").value("web-1 not ready"))
            .andExpect(jsonPath("$.results[2].status").value("warning"))
            .andExpect(jsonPath("$.results[3].status").value("fail"));

        ArgumentCaptor<CheckOptions> options = ArgumentCaptor.forClass(CheckOptions.class);
        verify(healthCheckService).runChecks(options.capture(), any());
        assertThat(options.getValue().isDataPlaneOnly()).isTrue();
        assertThat(options.getValue().getDataPlaneNamespace()).isEqualTo("emojivoto");
        assertThat(options.getValue().isShouldCheckControlPlaneVersion()).isTrue();
    }

    @Test
    @DisplayName("should report only the final pass when waiting")
    void shouldReportLastPassWhenWaiting() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        HealthChecker checker = new HealthChecker()
            .add(Check.local("data-plane", "data plane proxies are ready", false, () -> {
                if (calls.incrementAndGet() == 1) {
                    throw new CheckRetryException("not ready");
                }
            }));
        when(healthCheckService.runChecks(any(), any())).thenAnswer(invocation ->
            new RetryingCheckRunner(Duration.ofSeconds(5), Duration.ofMillis(10))
                .run(checker, invocation.getArgument(1)));

        mockMvc.perform(get("/api/check").param("proxy", "true").param("wait", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.results.length()").value(1))
            .andExpect(jsonPath("$.results[0].status").value("ok"));

        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("should skip the control plane version check for pre-install runs")
    void shouldConfigurePreInstall() throws Exception {
        when(healthCheckService.runChecks(any(), any())).thenReturn(true);

        mockMvc.perform(get("/api/check").param("pre", "true").param("expectedVersion", "stable-2.0.0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));

        ArgumentCaptor<CheckOptions> options = ArgumentCaptor.forClass(CheckOptions.class);
        verify(healthCheckService).runChecks(options.capture(), any());
        assertThat(options.getValue().isPreInstallOnly()).isTrue();
        assertThat(options.getValue().isShouldCheckControlPlaneVersion()).isFalse();
        assertThat(options.getValue().getVersionOverride()).isEqualTo("stable-2.0.0");
    }

    @Test
    @DisplayName("should reject combining pre-install and proxy checks")
    void shouldRejectPreWithProxy() throws Exception {
        mockMvc.perform(get("/api/check").param("pre", "true").param("proxy", "true"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400));

        verify(healthCheckService, never()).runChecks(any(), any());
    }
}
