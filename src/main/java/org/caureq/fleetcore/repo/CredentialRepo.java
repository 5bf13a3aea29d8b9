package org.caureq.fleetcore.repo;

import org.caureq.fleetcore.domain.ServerCredential;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CredentialRepo extends JpaRepository<ServerCredential, String> {
}
