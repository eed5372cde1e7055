package uk.gegc.quotaledger.features.quota.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.quotaledger.features.quota.api.dto.AccountDto;
import uk.gegc.quotaledger.features.quota.api.dto.TransactionDto;
import uk.gegc.quotaledger.features.quota.api.dto.UsageDeductionResultDto;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransactionType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Per-user balances and their audit trail.
 *
 * <p>Usernames are case-insensitive; every method normalizes to lower case. Each mutation
 * locks the account row and writes exactly one {@link QuotaTransactionType transaction} in the
 * same database transaction.</p>
 */
public interface QuotaLedgerService {

    /**
     * @return the balance, or 0 when no account exists (no account is created)
     */
    long getBalance(String username);

    boolean isUnlimited(String username);

    Optional<AccountDto> findAccount(String username);

    /**
     * Creates the account when absent, granting {@code defaultGrant} and recording an
     * {@code INITIAL_GRANT} when the grant is positive.
     *
     * @return the current balance
     */
    long ensureAccount(String username, long defaultGrant);

    /**
     * Overwrites the balance; the {@code SET} transaction carries {@code newBalance - oldBalance}.
     * A missing account is created with an old balance of 0.
     */
    long setBalance(String username, long newBalance, String actor);

    /**
     * Adds {@code delta} (negative values deduct) and records {@code ADD} or {@code DEDUCT}.
     *
     * @throws uk.gegc.quotaledger.features.quota.domain.exception.InsufficientQuotaException
     *         when the result would be negative
     */
    long addBalance(String username, long delta, String actor, String description);

    /**
     * Charges consumed usage. The balance is clamped at zero rather than refused, because the
     * work has already happened. Unlimited accounts and unknown users are not charged.
     */
    UsageDeductionResultDto deductForUsage(String username, long amount, String resourceType);

    /**
     * Same as {@link #deductForUsage(String, long, String)} with the originating session and an
     * explicit description recorded on the transaction.
     */
    UsageDeductionResultDto deductForUsage(String username, long amount, String resourceType,
                                           Long sessionId, String description);

    /**
     * Always records {@code SET_UNLIMITED} / {@code UNSET_UNLIMITED}, even when the flag is unchanged.
     */
    void setUnlimited(String username, boolean unlimited, String actor);

    List<AccountDto> getAllBalances();

    Page<TransactionDto> listTransactions(String username,
                                          QuotaTransactionType type,
                                          LocalDateTime dateFrom,
                                          LocalDateTime dateTo,
                                          Pageable pageable);

    List<TransactionDto> recentTransactions(String username, int limit);
}
