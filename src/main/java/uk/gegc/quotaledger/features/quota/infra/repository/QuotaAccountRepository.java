package uk.gegc.quotaledger.features.quota.infra.repository;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaAccount;

import java.util.List;
import java.util.Optional;

public interface QuotaAccountRepository extends JpaRepository<QuotaAccount, Long> {

    Optional<QuotaAccount> findByUsername(String username);

    boolean existsByUsername(String username);

    /**
     * Row lock ({@code SELECT ... FOR UPDATE}) held until the surrounding transaction ends.
     * Every read-modify-write of a balance goes through this method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "10000"))
    @Query("SELECT a FROM QuotaAccount a WHERE a.username = :username")
    Optional<QuotaAccount> findByUsernameForUpdate(@Param("username") String username);

    List<QuotaAccount> findAllByOrderByUsernameAsc();
}
