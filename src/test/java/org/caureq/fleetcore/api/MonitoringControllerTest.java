package org.caureq.fleetcore.api;

import org.caureq.fleetcore.domain.ServerStatus;
import org.caureq.fleetcore.remote.UsageSample;
import org.caureq.fleetcore.service.AuditService;
import org.caureq.fleetcore.service.monitor.HealthMonitor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MonitoringController.class)
@DisplayName("MonitoringController")
class MonitoringControllerTest {

    @Autowired private MockMvc mvc;

    @MockBean private HealthMonitor monitor;
    @MockBean private AuditService audit;

    @Test
    @DisplayName("stop pauses the monitor and is audited")
    void stop() throws Exception {
        when(monitor.stop()).thenReturn(true);
        when(monitor.isRunning()).thenReturn(false);

        mvc.perform(post("/api/monitoring/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Monitoring stopped"))
                .andExpect(jsonPath("$.data.running").value(false));
        verify(audit).log(any(), eq("monitoring.stop"), eq("monitor"), any(), eq("stopped"));
    }

    @Test
    @DisplayName("start on a running monitor is a no-op that still answers 200")
    void startWhenRunning() throws Exception {
        when(monitor.start()).thenReturn(false);
        when(monitor.isRunning()).thenReturn(true);

        mvc.perform(post("/api/monitoring/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Monitoring already running"))
                .andExpect(jsonPath("$.data.running").value(true));
    }

    @Test
    @DisplayName("real-time lists the latest report per server")
    void realTime() throws Exception {
        when(monitor.isRunning()).thenReturn(true);
        when(monitor.latestReports()).thenReturn(List.of(new HealthMonitor.HealthReport(
                1L, "web-1", "10.0.0.21", true, 60, ServerStatus.ACTIVE,
                new UsageSample(40, 30, 20, 0.42), null, Instant.now())));

        mvc.perform(get("/api/monitoring/real-time"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.servers[0].name").value("web-1"))
                .andExpect(jsonPath("$.servers[0].health_score").value(60))
                .andExpect(jsonPath("$.servers[0].usage.cpu_usage").value(40.0));
    }
}
