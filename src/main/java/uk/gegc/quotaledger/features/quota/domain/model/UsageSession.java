package uk.gegc.quotaledger.features.quota.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A metered occupancy of one resource by one user. Leaves {@link UsageSessionStatus#ACTIVE}
 * exactly once, through a conditional update in
 * {@link uk.gegc.quotaledger.features.quota.infra.repository.UsageSessionRepository}.
 */
@Entity
@Table(name = "quota_usage_sessions", indexes = {
        @Index(name = "idx_usage_sessions_username", columnList = "username"),
        @Index(name = "idx_usage_sessions_status", columnList = "status"),
        @Index(name = "idx_usage_sessions_username_status", columnList = "username, status")
})
@Getter
@Setter
public class UsageSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "username", nullable = false, updatable = false, length = 255)
    private String username;

    @Column(name = "resource_type", nullable = false, updatable = false, length = 100)
    private String resourceType;

    @Column(name = "start_time", nullable = false, updatable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "quota_consumed")
    private Long quotaConsumed;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private UsageSessionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
