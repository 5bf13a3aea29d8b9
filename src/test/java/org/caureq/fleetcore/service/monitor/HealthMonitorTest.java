package org.caureq.fleetcore.service.monitor;

import org.caureq.fleetcore.config.FleetProps;
import org.caureq.fleetcore.domain.AlertSeverity;
import org.caureq.fleetcore.domain.AlertStatus;
import org.caureq.fleetcore.domain.Server;
import org.caureq.fleetcore.domain.ServerStatus;
import org.caureq.fleetcore.remote.ConnectivityException;
import org.caureq.fleetcore.remote.HostProbe;
import org.caureq.fleetcore.remote.RemoteExecutor;
import org.caureq.fleetcore.repo.AlertRepo;
import org.caureq.fleetcore.repo.CredentialRepo;
import org.caureq.fleetcore.repo.ServerRepo;
import org.caureq.fleetcore.service.ServerRegistry;
import org.caureq.fleetcore.service.alerts.AlertConfigService;
import org.caureq.fleetcore.service.alerts.AlertManager;
import org.caureq.fleetcore.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DataJpaTest
@DisplayName("HealthMonitor")
class HealthMonitorTest {

    @Autowired private ServerRepo serverRepo;
    @Autowired private CredentialRepo credentialRepo;
    @Autowired private PlatformTransactionManager txManager;
    @Autowired private AlertRepo alertRepo;

    private RemoteExecutor remote;
    private AlertManager alerts;
    private HealthMonitor monitor;
    private Server web;

    @BeforeEach
    void setUp() {
        FleetProps props = TestFixtures.props();
        remote = mock(RemoteExecutor.class);
        var probe = new HostProbe(remote);
        var registry = new ServerRegistry(serverRepo, credentialRepo, probe, props, new TransactionTemplate(txManager));
        alerts = new AlertManager(alertRepo, serverRepo);
        monitor = new HealthMonitor(registry, probe, alerts, new AlertConfigService(props), Runnable::run, props);
        web = TestFixtures.server(serverRepo, credentialRepo, "web-1", "10.0.0.21");
    }

    private void usage(double cpu, double mem, double disk) {
        when(remote.exec(any(), anyString(), any(Duration.class))).thenReturn(TestFixtures.usage(cpu, mem, disk));
    }

    @Test
    @DisplayName("CPU 95 raises CRITICAL, CPU 40 on the next check resolves it")
    void cpuSpikeThenRecovery() {
        // Given
        usage(95, 30, 20);

        // When
        var report = monitor.healthCheckServer(web.getId());

        // Then
        assertThat(report.reachable()).isTrue();
        assertThat(report.healthScore()).isEqualTo(5);
        var active = alerts.list(AlertStatus.ACTIVE, null, web.getId(), 50, 0);
        assertThat(active).hasSize(1);
        assertThat(active.get(0).metricName()).isEqualTo("cpu_usage");
        assertThat(active.get(0).severity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(active.get(0).thresholdValue()).isEqualTo(90.0);

        // When
        usage(40, 30, 20);
        monitor.healthCheckServer(web.getId());

        // Then
        assertThat(alerts.list(AlertStatus.ACTIVE, null, web.getId(), 50, 0)).isEmpty();
        var resolved = alerts.list(AlertStatus.RESOLVED, null, web.getId(), 50, 0);
        assertThat(resolved).hasSize(1);
        assertThat(resolved.get(0).resolutionNotes()).startsWith("Auto-resolved");
        assertThat(serverRepo.findById(web.getId()).orElseThrow().getHealthScore()).isEqualTo(60);
    }

    @Test
    @DisplayName("values between warning and critical raise WARNING; thresholds are strict")
    void warningBand() {
        usage(80, 75, 90);

        monitor.healthCheckServer(web.getId());

        var active = alerts.list(AlertStatus.ACTIVE, null, web.getId(), 50, 0);
        assertThat(active).extracting(AlertManager.Alert::metricName).containsExactlyInAnyOrder("cpu_usage", "disk_usage");
        assertThat(active).allMatch(a -> a.severity() == AlertSeverity.WARNING);
    }

    @Test
    @DisplayName("an acknowledged alert is not auto-cleared when the metric recovers")
    void acknowledgedNotCleared() {
        usage(95, 30, 20);
        monitor.healthCheckServer(web.getId());
        var alert = alerts.list(AlertStatus.ACTIVE, null, web.getId(), 50, 0).get(0);
        alerts.acknowledge(alert.id());

        usage(40, 30, 20);
        monitor.healthCheckServer(web.getId());

        assertThat(alertRepo.findById(alert.id()).orElseThrow().getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
    }

    @Test
    @DisplayName("an unreachable server scores 0, turns UNREACHABLE and raises a reachability alert")
    void unreachable() {
        // Given
        when(remote.exec(any(), anyString(), any(Duration.class)))
                .thenThrow(new ConnectivityException(ConnectivityException.Kind.TIMEOUT, "10.0.0.21", "timed out"));

        // When
        var report = monitor.healthCheckServer(web.getId());

        // Then
        assertThat(report.reachable()).isFalse();
        assertThat(report.error()).contains("TIMEOUT");
        var s = serverRepo.findById(web.getId()).orElseThrow();
        assertThat(s.getStatus()).isEqualTo(ServerStatus.UNREACHABLE);
        assertThat(s.getHealthScore()).isZero();
        assertThat(s.getLastHealthCheck()).isNotNull();
        assertThat(alerts.list(AlertStatus.ACTIVE, AlertSeverity.CRITICAL, web.getId(), 50, 0))
                .extracting(AlertManager.Alert::metricName).containsExactly("reachability");
    }

    @Test
    @DisplayName("recovery clears the reachability alert and reactivates the server")
    void recovery() {
        when(remote.exec(any(), anyString(), any(Duration.class)))
                .thenThrow(new ConnectivityException(ConnectivityException.Kind.UNREACHABLE, "10.0.0.21", "refused"))
                .thenReturn(TestFixtures.usage(10, 10, 10));

        monitor.healthCheckServer(web.getId());
        monitor.healthCheckServer(web.getId());

        assertThat(serverRepo.findById(web.getId()).orElseThrow().getStatus()).isEqualTo(ServerStatus.ACTIVE);
        assertThat(alerts.list(AlertStatus.ACTIVE, null, web.getId(), 50, 0)).isEmpty();
    }

    @Test
    @DisplayName("disabled servers are skipped by the sweep")
    void disabledSkipped() {
        var off = TestFixtures.server(serverRepo, credentialRepo, "old-1", "10.0.0.99");
        off.setStatus(ServerStatus.DISABLED);
        serverRepo.save(off);
        usage(10, 10, 10);

        var reports = monitor.healthCheckAll();

        assertThat(reports).extracting(HealthMonitor.HealthReport::serverId).containsExactly(web.getId());
        verify(remote, never()).exec(argThat(t -> t != null && "10.0.0.99".equals(t.host())), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("a manual check on a disabled server keeps it DISABLED")
    void manualCheckKeepsDisabled() {
        web.setStatus(ServerStatus.DISABLED);
        serverRepo.save(web);
        usage(10, 10, 10);

        var report = monitor.healthCheckServer(web.getId());

        assertThat(report.status()).isEqualTo(ServerStatus.DISABLED);
        var s = serverRepo.findById(web.getId()).orElseThrow();
        assertThat(s.getStatus()).isEqualTo(ServerStatus.DISABLED);
        assertThat(s.getHealthScore()).isEqualTo(90);
    }

    @Test
    @DisplayName("a tick that starts while a manual check holds the lock is skipped")
    void overlappingTickSkipped() {
        // Given: the remote call of the manual check fires a tick from another thread
        AtomicReference<Boolean> tickRan = new AtomicReference<>();
        when(remote.exec(any(), anyString(), any(Duration.class))).thenAnswer(inv -> {
            tickRan.set(CompletableFuture.supplyAsync(monitor::runTick).get(5, TimeUnit.SECONDS));
            return TestFixtures.usage(10, 10, 10);
        });

        // When
        var report = monitor.healthCheckServer(web.getId());

        // Then
        assertThat(report.reachable()).isTrue();
        assertThat(tickRan.get()).isFalse();
        verify(remote, times(1)).exec(any(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("stop pauses periodic ticks, start resumes them; manual checks run either way")
    void stopAndStart() {
        usage(10, 10, 10);
        assertThat(monitor.isRunning()).isTrue();

        assertThat(monitor.stop()).isTrue();
        assertThat(monitor.stop()).isFalse();
        assertThat(monitor.runTick()).isFalse();
        verify(remote, never()).exec(any(), anyString(), any(Duration.class));

        monitor.healthCheckServer(web.getId());
        verify(remote, times(1)).exec(any(), anyString(), any(Duration.class));

        assertThat(monitor.start()).isTrue();
        assertThat(monitor.isRunning()).isTrue();
        assertThat(monitor.runTick()).isTrue();
        verify(remote, times(2)).exec(any(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("latest reports keep the newest check per server")
    void latestReports() {
        when(remote.exec(any(), anyString(), any(Duration.class)))
                .thenReturn(TestFixtures.usage(95, 30, 20))
                .thenReturn(TestFixtures.usage(40, 30, 20));

        monitor.healthCheckServer(web.getId());
        monitor.healthCheckServer(web.getId());

        assertThat(monitor.latestReports()).singleElement()
                .satisfies(r -> assertThat(r.healthScore()).isEqualTo(60));
    }

    @Test
    @DisplayName("score is 100 minus the worst metric, clamped")
    void score() {
        assertThat(HealthMonitor.score(new org.caureq.fleetcore.remote.UsageSample(12, 55.4, 30, 0))).isEqualTo(45);
        assertThat(HealthMonitor.score(new org.caureq.fleetcore.remote.UsageSample(100, 0, 0, 0))).isZero();
    }
}
