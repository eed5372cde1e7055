package uk.gegc.quotaledger.features.quota.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.quotaledger.features.quota.api.dto.BatchBalanceEntry;
import uk.gegc.quotaledger.features.quota.api.dto.BatchSetResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshRequest;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshResultDto;
import uk.gegc.quotaledger.features.quota.application.QuotaLedgerService;
import uk.gegc.quotaledger.features.quota.application.QuotaMetricsService;
import uk.gegc.quotaledger.features.quota.application.QuotaRefreshService;
import uk.gegc.quotaledger.features.quota.application.QuotaStructuredLogger;
import uk.gegc.quotaledger.features.quota.application.RefreshTargetMatcher;
import uk.gegc.quotaledger.features.quota.domain.exception.InvalidQuotaRequestException;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaAccount;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransaction;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransactionType;
import uk.gegc.quotaledger.features.quota.domain.model.RefreshAction;
import uk.gegc.quotaledger.features.quota.infra.repository.QuotaAccountRepository;
import uk.gegc.quotaledger.features.quota.infra.repository.QuotaTransactionRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Batch refresh and batch set.
 *
 * <p>Refresh sweeps are serialized by an in-process lock. Each selected account is re-read under
 * its row lock and re-matched before it is changed, so a balance that moved since the snapshot
 * is evaluated on its current value.</p>
 */
@Slf4j
@Service
public class QuotaRefreshServiceImpl implements QuotaRefreshService {

    private final QuotaAccountRepository accountRepository;
    private final QuotaTransactionRepository transactionRepository;
    private final QuotaLedgerService ledgerService;
    private final QuotaMetricsService metricsService;
    private final TransactionTemplate perAccount;
    private final Clock clock;
    private final ReentrantLock sweepLock = new ReentrantLock();

    public QuotaRefreshServiceImpl(QuotaAccountRepository accountRepository,
                                   QuotaTransactionRepository transactionRepository,
                                   QuotaLedgerService ledgerService,
                                   QuotaMetricsService metricsService,
                                   PlatformTransactionManager transactionManager,
                                   Clock clock) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.ledgerService = ledgerService;
        this.metricsService = metricsService;
        this.perAccount = new TransactionTemplate(transactionManager);
        this.perAccount.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    @Override
    public RefreshResultDto refresh(RefreshRequest request) {
        if (request == null || request.amount() == null) {
            throw new InvalidQuotaRequestException("Refresh amount is required");
        }
        if (request.action() == RefreshAction.SET && request.amount() < 0) {
            throw new InvalidQuotaRequestException("Refresh cannot set a negative balance: " + request.amount());
        }
        RefreshTargetMatcher matcher = RefreshTargetMatcher.compile(request.targets());
        if (matcher.hasInvalidPattern()) {
            QuotaStructuredLogger.logRefresh(log, "warn",
                    "Refresh '{}' has an invalid username pattern '{}'; no account will match",
                    request.ruleName(), request.ruleName(), request.targets().usernamePattern());
        }

        int updated = 0;
        int skipped = 0;
        int failed = 0;
        long totalChange = 0L;

        sweepLock.lock();
        try {
            List<QuotaAccount> snapshot = accountRepository.findAllByOrderByUsernameAsc();
            for (QuotaAccount candidate : snapshot) {
                if (!matcher.matches(candidate)) {
                    skipped++;
                    continue;
                }
                String username = candidate.getUsername();
                try {
                    Long change = perAccount.execute(status -> applyRefresh(username, request, matcher));
                    if (change == null) {
                        skipped++;
                    } else {
                        updated++;
                        totalChange += change;
                    }
                } catch (RuntimeException ex) {
                    failed++;
                    QuotaStructuredLogger.logRefresh(log, "error", "Refresh '{}' failed for {}: {}",
                            request.ruleName(), request.ruleName(), username, ex.getMessage(), ex);
                }
            }
        } finally {
            sweepLock.unlock();
        }

        metricsService.incrementRefreshUpdated(request.ruleName(), updated);
        QuotaStructuredLogger.logRefresh(log, "info",
                "Refresh '{}' ({}): {} users updated, {} skipped, {} failed, change={}",
                request.ruleName(), request.ruleName(), request.action().getValue(),
                updated, skipped, failed, totalChange);
        return new RefreshResultDto(updated, totalChange, skipped, failed, request.action(), request.ruleName());
    }

    @Override
    public BatchSetResultDto batchSetBalances(List<BatchBalanceEntry> entries, String actor) {
        List<BatchSetResultDto.Detail> details = new ArrayList<>();
        int success = 0;
        int failed = 0;
        for (BatchBalanceEntry entry : entries == null ? List.<BatchBalanceEntry>of() : entries) {
            String username = entry.username();
            try {
                if (entry.amount() == null) {
                    throw new InvalidQuotaRequestException("Amount is required");
                }
                long balance = ledgerService.setBalance(username, entry.amount(), actor);
                details.add(BatchSetResultDto.Detail.ok(username, balance));
                success++;
            } catch (RuntimeException ex) {
                log.error("Batch set failed for {}: {}", username, ex.getMessage());
                details.add(BatchSetResultDto.Detail.failed(username, ex.getMessage()));
                failed++;
            }
        }
        log.info("Batch set by {}: {} succeeded, {} failed", actor, success, failed);
        return new BatchSetResultDto(success, failed, details);
    }

    /**
     * @return the applied change, or null when the account no longer matches or would not change
     */
    private Long applyRefresh(String username, RefreshRequest request, RefreshTargetMatcher matcher) {
        Optional<QuotaAccount> locked = accountRepository.findByUsernameForUpdate(username);
        if (locked.isEmpty() || !matcher.matches(locked.get())) {
            return null;
        }
        QuotaAccount account = locked.get();
        long current = account.getBalance();
        long target = computeBalance(current, request);
        if (target == current) {
            return null;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        account.setBalance(target);
        account.setUpdatedAt(now);

        long change = target - current;
        QuotaTransaction tx = new QuotaTransaction();
        tx.setUsername(username);
        tx.setAmount(change);
        tx.setTransactionType(QuotaTransactionType.AUTO_REFRESH);
        tx.setBalanceBefore(current);
        tx.setBalanceAfter(target);
        tx.setDescription("Auto " + request.action().getValue() + ": " + request.ruleName());
        tx.setCreatedAt(now);
        tx.setCreatedBy(request.triggeredBy());
        transactionRepository.save(tx);

        QuotaStructuredLogger.logLedgerWrite(log, "debug", "Refresh '{}' moved {} from {} to {}",
                username, QuotaTransactionType.AUTO_REFRESH, change, current, target, null,
                request.ruleName(), username, current, target);
        return change;
    }

    /**
     * A top-up is clamped to {@code maxBalance} and a negative adjustment to {@code minBalance}.
     * The clamp applies to the result, so a balance already past the bound is brought back to it.
     */
    static long computeBalance(long current, RefreshRequest request) {
        long amount = request.amount();
        if (request.action() == RefreshAction.SET) {
            return amount;
        }
        long next = current + amount;
        if (amount > 0 && request.maxBalance() != null) {
            return Math.min(next, request.maxBalance());
        }
        if (amount < 0) {
            return Math.max(next, request.effectiveMinBalance());
        }
        return next;
    }
}
