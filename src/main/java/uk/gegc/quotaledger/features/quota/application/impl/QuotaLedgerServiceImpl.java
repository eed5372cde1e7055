package uk.gegc.quotaledger.features.quota.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.quotaledger.features.quota.api.dto.AccountDto;
import uk.gegc.quotaledger.features.quota.api.dto.TransactionDto;
import uk.gegc.quotaledger.features.quota.api.dto.UsageDeductionResultDto;
import uk.gegc.quotaledger.features.quota.application.QuotaLedgerService;
import uk.gegc.quotaledger.features.quota.application.QuotaStructuredLogger;
import uk.gegc.quotaledger.features.quota.application.Usernames;
import uk.gegc.quotaledger.features.quota.domain.exception.InsufficientQuotaException;
import uk.gegc.quotaledger.features.quota.domain.exception.InvalidQuotaRequestException;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaAccount;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransaction;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransactionType;
import uk.gegc.quotaledger.features.quota.infra.mapping.QuotaAccountMapper;
import uk.gegc.quotaledger.features.quota.infra.mapping.QuotaTransactionMapper;
import uk.gegc.quotaledger.features.quota.infra.repository.QuotaAccountRepository;
import uk.gegc.quotaledger.features.quota.infra.repository.QuotaTransactionRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaLedgerServiceImpl implements QuotaLedgerService {

    private final QuotaAccountRepository accountRepository;
    private final QuotaTransactionRepository transactionRepository;
    private final AccountProvisioner accountProvisioner;
    private final QuotaAccountMapper accountMapper;
    private final QuotaTransactionMapper transactionMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public long getBalance(String username) {
        return accountRepository.findByUsername(Usernames.normalize(username))
                .map(QuotaAccount::getBalance)
                .orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isUnlimited(String username) {
        return accountRepository.findByUsername(Usernames.normalize(username))
                .map(QuotaAccount::isUnlimited)
                .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AccountDto> findAccount(String username) {
        return accountRepository.findByUsername(Usernames.normalize(username))
                .map(accountMapper::toDto);
    }

    @Override
    public long ensureAccount(String username, long defaultGrant) {
        String normalized = Usernames.normalize(username);
        accountProvisioner.createIfAbsent(normalized, defaultGrant);
        return accountRepository.findByUsername(normalized)
                .map(QuotaAccount::getBalance)
                .orElse(0L);
    }

    @Override
    @Transactional
    public long setBalance(String username, long newBalance, String actor) {
        if (newBalance < 0) {
            throw new InvalidQuotaRequestException("Balance cannot be negative: " + newBalance);
        }
        QuotaAccount account = lockOrCreate(Usernames.normalize(username));
        long before = account.getBalance();
        applyBalance(account, newBalance);
        record(account, QuotaTransactionType.SET, newBalance - before, before, newBalance,
                null, null, "Balance set to " + newBalance, actor);
        return newBalance;
    }

    @Override
    @Transactional
    public long addBalance(String username, long delta, String actor, String description) {
        QuotaAccount account = lockOrCreate(Usernames.normalize(username));
        long before = account.getBalance();
        long after = before + delta;
        if (after < 0) {
            throw new InsufficientQuotaException(
                    "Insufficient quota for " + account.getUsername() + ": balance " + before + ", requested " + (-delta),
                    before, -delta);
        }
        applyBalance(account, after);
        QuotaTransactionType type = delta >= 0 ? QuotaTransactionType.ADD : QuotaTransactionType.DEDUCT;
        String text = description != null && !description.isBlank()
                ? description
                : (delta >= 0 ? "Added " : "Deducted ") + Math.abs(delta) + " quota";
        record(account, type, delta, before, after, null, null, text, actor);
        return after;
    }

    @Override
    @Transactional
    public UsageDeductionResultDto deductForUsage(String username, long amount, String resourceType) {
        String description = resourceType != null && !resourceType.isBlank()
                ? "Usage: " + resourceType
                : "Usage deduction";
        return deductForUsage(username, amount, resourceType, null, description);
    }

    @Override
    @Transactional
    public UsageDeductionResultDto deductForUsage(String username, long amount, String resourceType,
                                                  Long sessionId, String description) {
        if (amount < 0) {
            throw new InvalidQuotaRequestException("Usage amount cannot be negative: " + amount);
        }
        String normalized = Usernames.normalize(username);
        Optional<QuotaAccount> locked = accountRepository.findByUsernameForUpdate(normalized);
        if (locked.isEmpty()) {
            log.debug("No quota account for {}, usage of {} not charged", normalized, amount);
            return new UsageDeductionResultDto(false, 0L, 0L);
        }
        QuotaAccount account = locked.get();
        if (account.isUnlimited()) {
            return new UsageDeductionResultDto(false, 0L, account.getBalance());
        }

        long before = account.getBalance();
        long after = Math.max(0L, before - amount);
        applyBalance(account, after);
        record(account, QuotaTransactionType.USAGE, after - before, before, after,
                resourceType, sessionId, description, null);
        if (before - after < amount) {
            log.info("Usage of {} for {} clamped at zero: charged {}", amount, normalized, before - after);
        }
        return new UsageDeductionResultDto(true, before - after, after);
    }

    @Override
    @Transactional
    public void setUnlimited(String username, boolean unlimited, String actor) {
        QuotaAccount account = lockOrCreate(Usernames.normalize(username));
        account.setUnlimited(unlimited);
        account.setUpdatedAt(LocalDateTime.now(clock));
        long balance = account.getBalance();
        record(account,
                unlimited ? QuotaTransactionType.SET_UNLIMITED : QuotaTransactionType.UNSET_UNLIMITED,
                0L, balance, balance, null, null,
                "Unlimited " + (unlimited ? "enabled" : "disabled"), actor);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AccountDto> getAllBalances() {
        return accountMapper.toDtos(accountRepository.findAllByOrderByUsernameAsc());
    }

    @Override
    @Transactional(readOnly = true)
    public Page<TransactionDto> listTransactions(String username,
                                                 QuotaTransactionType type,
                                                 LocalDateTime dateFrom,
                                                 LocalDateTime dateTo,
                                                 Pageable pageable) {
        return transactionRepository
                .findByFilters(Usernames.normalize(username), type, dateFrom, dateTo, pageable)
                .map(transactionMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TransactionDto> recentTransactions(String username, int limit) {
        int size = Math.max(1, Math.min(limit, 500));
        return transactionMapper.toDtos(transactionRepository
                .findByUsernameOrderByCreatedAtDescIdDesc(Usernames.normalize(username), PageRequest.of(0, size)));
    }

    /**
     * Creation happens before the row lock is taken: a locking read of a missing key holds a gap
     * lock that would block the provisioner's own insert.
     */
    private QuotaAccount lockOrCreate(String username) {
        accountProvisioner.createIfAbsent(username, 0L);
        return accountRepository.findByUsernameForUpdate(username)
                .orElseThrow(() -> new IllegalStateException("Quota account " + username + " missing after creation"));
    }

    private void applyBalance(QuotaAccount account, long newBalance) {
        account.setBalance(newBalance);
        account.setUpdatedAt(LocalDateTime.now(clock));
    }

    private void record(QuotaAccount account, QuotaTransactionType type, long amount,
                        long before, long after, String resourceType, Long sessionId,
                        String description, String actor) {
        QuotaTransaction tx = new QuotaTransaction();
        tx.setUsername(account.getUsername());
        tx.setAmount(amount);
        tx.setTransactionType(type);
        tx.setResourceType(resourceType);
        tx.setSessionId(sessionId);
        tx.setDescription(description);
        tx.setBalanceBefore(before);
        tx.setBalanceAfter(after);
        tx.setCreatedAt(LocalDateTime.now(clock));
        tx.setCreatedBy(actor);
        transactionRepository.save(tx);

        QuotaStructuredLogger.logLedgerWrite(log, "info",
                "Quota {} for {}: {} -> {}",
                account.getUsername(), type, amount, before, after, sessionId,
                type, account.getUsername(), before, after);
    }
}
