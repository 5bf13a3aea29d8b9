package org.caureq.fleetcore.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "domain_mappings")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DomainMapping {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 255)
    private String customDomain;

    @Column(nullable = false, length = 100)
    private String targetSubdomain;

    private boolean sslEnabled;

    @Column(nullable = false, length = 20)
    private String status;  // pending | active | failed

    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (status == null) status = "pending";
    }
}
