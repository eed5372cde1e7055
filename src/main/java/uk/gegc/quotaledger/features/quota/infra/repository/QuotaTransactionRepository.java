package uk.gegc.quotaledger.features.quota.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransaction;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransactionType;

import java.time.LocalDateTime;
import java.util.List;

public interface QuotaTransactionRepository extends JpaRepository<QuotaTransaction, Long> {

    @Query("""
        select t from QuotaTransaction t
        where t.username = :username
          and (:type is null or t.transactionType = :type)
          and (:dateFrom is null or t.createdAt >= :dateFrom)
          and (:dateTo is null or t.createdAt <= :dateTo)
        order by t.createdAt desc, t.id desc
    """)
    Page<QuotaTransaction> findByFilters(
            @Param("username") String username,
            @Param("type") QuotaTransactionType type,
            @Param("dateFrom") LocalDateTime dateFrom,
            @Param("dateTo") LocalDateTime dateTo,
            Pageable pageable
    );

    List<QuotaTransaction> findByUsernameOrderByCreatedAtDescIdDesc(String username, Pageable pageable);

    List<QuotaTransaction> findByUsernameOrderByIdAsc(String username);

    List<QuotaTransaction> findBySessionId(Long sessionId);

    long countByUsernameAndTransactionType(String username, QuotaTransactionType transactionType);
}
