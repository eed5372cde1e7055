package uk.gegc.quotaledger.features.quota.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.quotaledger.features.quota.domain.model.UsageSession;
import uk.gegc.quotaledger.features.quota.domain.model.UsageSessionStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface UsageSessionRepository extends JpaRepository<UsageSession, Long> {

    Optional<UsageSession> findFirstByUsernameAndStatusOrderByStartTimeDesc(String username, UsageSessionStatus status);

    List<UsageSession> findByStatusOrderByStartTimeAsc(UsageSessionStatus status);

    List<UsageSession> findByStatusAndStartTimeBefore(UsageSessionStatus status, LocalDateTime cutoff);

    long countByStatus(UsageSessionStatus status);

    /**
     * Closes a session as {@code COMPLETED} only while it is still {@code ACTIVE}.
     *
     * @return 1 when this caller performed the transition, 0 when another closer got there first
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE UsageSession s
        SET s.status = uk.gegc.quotaledger.features.quota.domain.model.UsageSessionStatus.COMPLETED,
            s.endTime = :endTime,
            s.durationMinutes = :durationMinutes,
            s.quotaConsumed = :quotaConsumed
        WHERE s.id = :id
          AND s.status = uk.gegc.quotaledger.features.quota.domain.model.UsageSessionStatus.ACTIVE
    """)
    int completeIfActive(@Param("id") Long id,
                         @Param("endTime") LocalDateTime endTime,
                         @Param("durationMinutes") Integer durationMinutes,
                         @Param("quotaConsumed") Long quotaConsumed);

    /**
     * Marks a session {@code CLEANED_UP} only while it is still {@code ACTIVE}. No charge is recorded.
     *
     * @return 1 when this caller performed the transition, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
        UPDATE UsageSession s
        SET s.status = uk.gegc.quotaledger.features.quota.domain.model.UsageSessionStatus.CLEANED_UP,
            s.endTime = :endTime,
            s.durationMinutes = :durationMinutes
        WHERE s.id = :id
          AND s.status = uk.gegc.quotaledger.features.quota.domain.model.UsageSessionStatus.ACTIVE
    """)
    int cleanUpIfActive(@Param("id") Long id,
                        @Param("endTime") LocalDateTime endTime,
                        @Param("durationMinutes") Integer durationMinutes);
}
