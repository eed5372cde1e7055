package uk.gegc.quotaledger.features.quota.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * One audit row per balance mutation. Rows are written once and never updated.
 */
@Entity
@Immutable
@Table(name = "quota_transactions", indexes = {
        @Index(name = "idx_quota_transactions_username", columnList = "username"),
        @Index(name = "idx_quota_transactions_created_at", columnList = "created_at")
})
@Getter
@Setter
public class QuotaTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "username", nullable = false, updatable = false, length = 255)
    private String username;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false, length = 32)
    private QuotaTransactionType transactionType;

    @Column(name = "resource_type", updatable = false, length = 100)
    private String resourceType;

    @Column(name = "session_id", updatable = false)
    private Long sessionId;

    @Column(name = "description", updatable = false, length = 1000)
    private String description;

    @Column(name = "balance_before", nullable = false, updatable = false)
    private long balanceBefore;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private long balanceAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "created_by", updatable = false, length = 255)
    private String createdBy;
}
