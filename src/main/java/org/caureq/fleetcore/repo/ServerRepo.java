package org.caureq.fleetcore.repo;

import org.caureq.fleetcore.domain.Server;
import org.caureq.fleetcore.domain.ServerStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ServerRepo extends JpaRepository<Server, Long> {
    Optional<Server> findByIpAddress(String ipAddress);
    Optional<Server> findByNameIgnoreCase(String name);
    boolean existsByIpAddress(String ipAddress);
    boolean existsByNameIgnoreCase(String name);
    List<Server> findByStatusNot(ServerStatus status);
    long countByStatus(ServerStatus status);
}
