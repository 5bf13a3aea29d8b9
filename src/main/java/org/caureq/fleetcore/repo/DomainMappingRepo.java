package org.caureq.fleetcore.repo;

import org.caureq.fleetcore.domain.DomainMapping;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DomainMappingRepo extends JpaRepository<DomainMapping, Long> {
    boolean existsByCustomDomainIgnoreCase(String customDomain);
    long countByStatus(String status);
    long countBySslEnabledTrue();
}
