package org.caureq.fleetcore.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/** Secret material behind a Server's authRef. Never serialized to API responses. */
@Entity
@Table(name = "server_credentials")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ServerCredential {
    @Id
    @Column(length = 36)
    private String authRef;

    @Column(nullable = false, length = 64)
    private String username;

    @Column(length = 255)
    private String password;

    @Column(length = 8000)
    private String privateKey;  // PEM / OpenSSH

    @PrePersist
    void prePersist() {
        if (authRef == null || authRef.isBlank()) authRef = UUID.randomUUID().toString();
    }
}
