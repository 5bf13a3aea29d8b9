package org.caureq.fleetcore.repo;

import org.caureq.fleetcore.domain.AlertRecord;
import org.caureq.fleetcore.domain.AlertSeverity;
import org.caureq.fleetcore.domain.AlertStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AlertRepo extends JpaRepository<AlertRecord, String>, JpaSpecificationExecutor<AlertRecord> {
    Optional<AlertRecord> findFirstByServerIdAndMetricNameAndStatusOrderByFirstOccurrenceDesc(
            Long serverId, String metricName, AlertStatus status);
    List<AlertRecord> findByServerIdAndMetricNameAndStatusIn(Long serverId, String metricName,
                                                              Collection<AlertStatus> statuses);
    long countByStatus(AlertStatus status);
    long countByStatusAndSeverity(AlertStatus status, AlertSeverity severity);
}
