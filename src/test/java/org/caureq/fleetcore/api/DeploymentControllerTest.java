package org.caureq.fleetcore.api;

import org.caureq.fleetcore.domain.DeploymentTask;
import org.caureq.fleetcore.domain.TaskStatus;
import org.caureq.fleetcore.domain.TaskType;
import org.caureq.fleetcore.service.AuditService;
import org.caureq.fleetcore.service.InvalidTransitionException;
import org.caureq.fleetcore.service.NotFoundException;
import org.caureq.fleetcore.service.TargetBusyException;
import org.caureq.fleetcore.service.deploy.DeploymentScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DeploymentController.class)
@DisplayName("DeploymentController")
class DeploymentControllerTest {

    @Autowired private MockMvc mvc;

    @MockBean private DeploymentScheduler scheduler;
    @MockBean private AuditService audit;

    private static final String INSTALL = """
            {"task_type":"install","service_type":"nginx","target_server_id":1}
            """;

    @Test
    @DisplayName("create answers 202 with the pending task")
    void create() throws Exception {
        when(scheduler.create(any())).thenReturn(DeploymentTask.builder()
                .id(7L).taskType(TaskType.INSTALL).serviceType("nginx").targetServerId(1L)
                .status(TaskStatus.PENDING).priority("normal").createdAt(Instant.now()).build());

        mvc.perform(post("/api/deployments/create").contentType(MediaType.APPLICATION_JSON).content(INSTALL))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value(7))
                .andExpect(jsonPath("$.data.task_type").value("INSTALL"))
                .andExpect(jsonPath("$.data.status").value("PENDING"))
                .andExpect(jsonPath("$.data.progress").value(0));
        verify(audit).log(any(), eq("task.create"), eq("task"), eq(7L), any());
    }

    @Test
    @DisplayName("a busy target is a 409 TARGET_BUSY error")
    void busy() throws Exception {
        when(scheduler.create(any())).thenThrow(new TargetBusyException(1L));

        mvc.perform(post("/api/deployments/create").contentType(MediaType.APPLICATION_JSON)
                        .header("X-Correlation-Id", "req-42").content(INSTALL))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("TARGET_BUSY"))
                .andExpect(jsonPath("$.correlation_id").value("req-42"))
                .andExpect(jsonPath("$.details.server_id").value(1));
        verify(audit, never()).log(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("a missing task_type fails validation")
    void missingType() throws Exception {
        mvc.perform(post("/api/deployments/create").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target_server_id\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.details.field_errors.taskType").exists());
    }

    @Test
    @DisplayName("an unknown task_type is a 400")
    void unknownType() throws Exception {
        mvc.perform(post("/api/deployments/create").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task_type\":\"destroy\",\"target_server_id\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("unknown task_type")));
    }

    @Test
    @DisplayName("malformed JSON is a 400")
    void malformed() throws Exception {
        mvc.perform(post("/api/deployments/create").contentType(MediaType.APPLICATION_JSON).content("{"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("logs of an unknown task are a 404")
    void logsNotFound() throws Exception {
        when(scheduler.logs(9L)).thenThrow(new NotFoundException("task", 9L));

        mvc.perform(get("/api/deployments/9/logs"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("logs expose status, progress and the ordered lines")
    void logs() throws Exception {
        when(scheduler.logs(3L)).thenReturn(new DeploymentScheduler.TaskLogs(3L, TaskStatus.RUNNING, 50, "start",
                List.of("Task created", "Step provision completed (25%)"), null));

        mvc.perform(get("/api/deployments/3/logs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.progress").value(50))
                .andExpect(jsonPath("$.current_step").value("start"))
                .andExpect(jsonPath("$.log[1]").value("Step provision completed (25%)"));
    }

    @Test
    @DisplayName("cancelling a finished task is a 409 INVALID_TRANSITION")
    void cancelFinished() throws Exception {
        when(scheduler.cancel(5L)).thenThrow(new InvalidTransitionException("task 5 is COMPLETED and cannot be cancelled"));

        mvc.perform(post("/api/deployments/5/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("cancelling a running task reports that it stops at the next step")
    void cancelRunning() throws Exception {
        when(scheduler.cancel(5L)).thenReturn(TaskStatus.RUNNING);

        mvc.perform(post("/api/deployments/5/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("RUNNING"));
    }
}
