package org.caureq.fleetcore.service.alerts;

import org.caureq.fleetcore.domain.AlertSeverity;
import org.caureq.fleetcore.domain.AlertStatus;
import org.caureq.fleetcore.repo.AlertRepo;
import org.caureq.fleetcore.repo.CredentialRepo;
import org.caureq.fleetcore.repo.ServerRepo;
import org.caureq.fleetcore.service.InvalidTransitionException;
import org.caureq.fleetcore.service.NotFoundException;
import org.caureq.fleetcore.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@DisplayName("AlertManager")
class AlertManagerTest {

    @Autowired private AlertRepo alertRepo;
    @Autowired private ServerRepo serverRepo;
    @Autowired private CredentialRepo credentialRepo;

    private AlertManager alerts;
    private Long serverId;

    @BeforeEach
    void setUp() {
        alerts = new AlertManager(alertRepo, serverRepo);
        serverId = TestFixtures.server(serverRepo, credentialRepo, "web-1", "10.0.0.11").getId();
    }

    @Test
    @DisplayName("raising twice updates the single active alert in place")
    void dedup() {
        // Given
        var first = alerts.raise(serverId, "cpu_usage", 80, AlertSeverity.WARNING, 75.0);

        // When
        var second = alerts.raise(serverId, "cpu_usage", 97, AlertSeverity.CRITICAL, 90.0);

        // Then
        assertThat(second.id()).isEqualTo(first.id());
        assertThat(second.severity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(second.metricValue()).isEqualTo(97.0);
        assertThat(second.title()).contains("web-1");
        assertThat(alertRepo.countByStatus(AlertStatus.ACTIVE)).isEqualTo(1);
    }

    @Test
    @DisplayName("different metrics on the same server are separate alerts")
    void separateKeys() {
        alerts.raise(serverId, "cpu_usage", 95, AlertSeverity.CRITICAL);
        alerts.raise(serverId, "disk_usage", 95, AlertSeverity.CRITICAL);

        assertThat(alerts.list(AlertStatus.ACTIVE, null, serverId, 50, 0)).hasSize(2);
    }

    @Test
    @DisplayName("clearIfActive resolves with the auto-resolve note")
    void autoResolve() {
        var a = alerts.raise(serverId, "memory_usage", 96, AlertSeverity.CRITICAL);

        var cleared = alerts.clearIfActive(serverId, "memory_usage");

        assertThat(cleared).isPresent();
        var stored = alertRepo.findById(a.id()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(stored.getResolutionNotes()).isEqualTo(AlertManager.AUTO_RESOLVED_NOTE);
        assertThat(stored.getResolvedAt()).isNotNull();
        assertThat(alerts.clearIfActive(serverId, "memory_usage")).isEmpty();
    }

    @Test
    @DisplayName("acknowledged alerts survive clearIfActive and a new breach opens a fresh active alert")
    void acknowledgedThenRaisedAgain() {
        // Given
        var a = alerts.raise(serverId, "cpu_usage", 95, AlertSeverity.CRITICAL);
        alerts.acknowledge(a.id());

        // When
        var cleared = alerts.clearIfActive(serverId, "cpu_usage");
        var again = alerts.raise(serverId, "cpu_usage", 92, AlertSeverity.CRITICAL);

        // Then
        assertThat(cleared).isEmpty();
        assertThat(again.id()).isNotEqualTo(a.id());
        assertThat(again.status()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(again.metricValue()).isEqualTo(92.0);
        var acked = alertRepo.findById(a.id()).orElseThrow();
        assertThat(acked.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(acked.getMetricValue()).isEqualTo(95.0);
        assertThat(alertRepo.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("repeated raises after an acknowledge update only the new active alert")
    void raisesAfterAcknowledgeDedupOnActive() {
        var a = alerts.raise(serverId, "disk_usage", 91, AlertSeverity.CRITICAL);
        alerts.acknowledge(a.id());

        var second = alerts.raise(serverId, "disk_usage", 93, AlertSeverity.CRITICAL);
        var third = alerts.raise(serverId, "disk_usage", 94, AlertSeverity.CRITICAL);

        assertThat(third.id()).isEqualTo(second.id());
        assertThat(alertRepo.countByStatus(AlertStatus.ACTIVE)).isEqualTo(1);
        assertThat(alertRepo.countByStatus(AlertStatus.ACKNOWLEDGED)).isEqualTo(1);
    }

    @Test
    @DisplayName("acknowledge only applies to ACTIVE alerts")
    void acknowledgeTwice() {
        var a = alerts.raise(serverId, "cpu_usage", 95, AlertSeverity.CRITICAL);
        alerts.acknowledge(a.id());

        assertThatThrownBy(() -> alerts.acknowledge(a.id())).isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("resolve twice fails the second time")
    void resolveTwice() {
        var a = alerts.raise(serverId, "disk_usage", 91, AlertSeverity.CRITICAL);

        var resolved = alerts.resolve(a.id(), "cleaned /var/log");

        assertThat(resolved.status()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(resolved.resolutionNotes()).isEqualTo("cleaned /var/log");
        assertThatThrownBy(() -> alerts.resolve(a.id(), null)).isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("a new raise after resolution opens a fresh alert")
    void reopenAfterResolve() {
        var a = alerts.raise(serverId, "cpu_usage", 95, AlertSeverity.CRITICAL);
        alerts.resolve(a.id(), null);

        var b = alerts.raise(serverId, "cpu_usage", 96, AlertSeverity.CRITICAL);

        assertThat(b.id()).isNotEqualTo(a.id());
        assertThat(b.status()).isEqualTo(AlertStatus.ACTIVE);
    }

    @Test
    @DisplayName("unknown ids are not found")
    void unknown() {
        assertThatThrownBy(() -> alerts.resolve("nope", null)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("list filters by severity and pages newest first")
    void listFilters() {
        alerts.raise(serverId, "cpu_usage", 80, AlertSeverity.WARNING);
        alerts.raise(serverId, "disk_usage", 99, AlertSeverity.CRITICAL);

        assertThat(alerts.list(null, AlertSeverity.CRITICAL, null, 50, 0))
                .extracting(AlertManager.Alert::metricName).containsExactly("disk_usage");
        assertThat(alerts.list(null, null, null, 1, 0)).hasSize(1);
        assertThat(alerts.list(AlertStatus.RESOLVED, null, null, 50, 0)).isEmpty();
    }
}
