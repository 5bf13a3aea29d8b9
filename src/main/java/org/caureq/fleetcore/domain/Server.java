package org.caureq.fleetcore.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "servers", indexes = {
        @Index(name = "idx_server_status", columnList = "status")
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class Server {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(nullable = false, unique = true, length = 45)
    private String ipAddress;

    private int port;

    @Column(nullable = false, length = 36)
    private String authRef;  // -> ServerCredential.authRef

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "server_roles", joinColumns = @JoinColumn(name = "server_id"))
    @Column(name = "role_tag", length = 32)
    @Builder.Default
    private Set<String> roles = new LinkedHashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ServerStatus status;

    private int healthScore;

    private Instant lastHealthCheck;

    // facts captured by the connection test
    @Column(length = 50)
    private String osType;
    @Column(length = 50)
    private String osVersion;
    private Integer cpuCores;
    private Integer memoryGb;
    private Integer diskGb;

    private Instant createdAt;
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
