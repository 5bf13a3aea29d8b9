package org.caureq.fleetcore.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

@Entity @Table(name = "action_log", indexes = {
        @Index(name="idx_action_ts", columnList = "ts DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ActionLog {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    private String userIp;
    private String actor;       // ex: "api"
    private String action;      // ex: "server.add", "task.cancel", "alert.resolve"
    private String targetType;  // server | task | alert
    private String targetId;
    @Column(length=2000)
    private String details;
    private Instant ts;
}
