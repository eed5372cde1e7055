package uk.gegc.quotaledger.features.quota.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "quota_accounts",
        uniqueConstraints = @UniqueConstraint(name = "uk_quota_accounts_username", columnNames = "username"))
@Getter
@Setter
public class QuotaAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    /**
     * Always stored lower-case.
     */
    @Column(name = "username", nullable = false, updatable = false, length = 255)
    private String username;

    @Column(name = "balance", nullable = false)
    private long balance;

    @Column(name = "unlimited", nullable = false)
    private boolean unlimited;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
