package uk.gegc.quotaledger.features.quota.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.quotaledger.features.quota.application.QuotaStructuredLogger;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaAccount;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransaction;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransactionType;
import uk.gegc.quotaledger.features.quota.infra.repository.QuotaAccountRepository;
import uk.gegc.quotaledger.features.quota.infra.repository.QuotaTransactionRepository;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Lazily creates accounts in their own transaction.
 *
 * <p>Two callers may try to create the same account at once; the unique key on
 * {@code username} lets exactly one insert win. The loser sees a
 * {@link DataIntegrityViolationException}, which only means the row now exists, and carries on
 * with the caller's own transaction unaffected.</p>
 */
@Slf4j
@Component
public class AccountProvisioner {

    private final QuotaAccountRepository accountRepository;
    private final QuotaTransactionRepository transactionRepository;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public AccountProvisioner(QuotaAccountRepository accountRepository,
                              QuotaTransactionRepository transactionRepository,
                              PlatformTransactionManager transactionManager,
                              Clock clock) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * @param username     already normalized to lower case
     * @param initialGrant balance of the new account; an {@code INITIAL_GRANT} row is written when positive
     * @return true when this call created the account
     */
    public boolean createIfAbsent(String username, long initialGrant) {
        if (accountRepository.existsByUsername(username)) {
            return false;
        }
        try {
            Boolean created = requiresNew.execute(status -> {
                if (accountRepository.existsByUsername(username)) {
                    return false;
                }
                LocalDateTime now = LocalDateTime.now(clock);
                long grant = Math.max(0L, initialGrant);

                QuotaAccount account = new QuotaAccount();
                account.setUsername(username);
                account.setBalance(grant);
                account.setUnlimited(false);
                account.setCreatedAt(now);
                account.setUpdatedAt(now);
                accountRepository.saveAndFlush(account);

                if (grant > 0) {
                    QuotaTransaction tx = new QuotaTransaction();
                    tx.setUsername(username);
                    tx.setAmount(grant);
                    tx.setTransactionType(QuotaTransactionType.INITIAL_GRANT);
                    tx.setBalanceBefore(0L);
                    tx.setBalanceAfter(grant);
                    tx.setDescription("Default quota for new user");
                    tx.setCreatedAt(now);
                    transactionRepository.save(tx);
                }
                QuotaStructuredLogger.logLedgerWrite(log, "info",
                        "Created quota account {} with initial grant {}",
                        username, QuotaTransactionType.INITIAL_GRANT, grant, 0L, grant, null,
                        username, grant);
                return true;
            });
            return Boolean.TRUE.equals(created);
        } catch (DataIntegrityViolationException ex) {
            log.debug("Quota account {} was created concurrently: {}", username, ex.getMessage());
            return false;
        }
    }
}
