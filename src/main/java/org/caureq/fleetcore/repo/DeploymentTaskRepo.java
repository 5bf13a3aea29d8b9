package org.caureq.fleetcore.repo;

import org.caureq.fleetcore.domain.DeploymentTask;
import org.caureq.fleetcore.domain.TaskStatus;
import org.caureq.fleetcore.domain.TaskType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface DeploymentTaskRepo extends JpaRepository<DeploymentTask, Long> {
    List<DeploymentTask> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);
    List<DeploymentTask> findByStatusIn(Collection<TaskStatus> statuses);
    boolean existsByTargetServerIdAndTaskTypeInAndStatusIn(Long targetServerId,
                                                           Collection<TaskType> types,
                                                           Collection<TaskStatus> statuses);
    long countByCreatedAtAfter(Instant since);
    long countByStatus(TaskStatus status);
}
