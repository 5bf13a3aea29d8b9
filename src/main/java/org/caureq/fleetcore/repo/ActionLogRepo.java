package org.caureq.fleetcore.repo;

import org.caureq.fleetcore.domain.ActionLog;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ActionLogRepo extends JpaRepository<ActionLog, Long> {
}
