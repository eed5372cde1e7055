package uk.gegc.quotaledger.features.quota.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.quotaledger.features.quota.api.dto.UsageDeductionResultDto;
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
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("QuotaLedgerServiceImpl")
class QuotaLedgerServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Mock
    private QuotaAccountRepository accountRepository;
    @Mock
    private QuotaTransactionRepository transactionRepository;
    @Mock
    private AccountProvisioner accountProvisioner;
    @Mock
    private QuotaAccountMapper accountMapper;
    @Mock
    private QuotaTransactionMapper transactionMapper;

    private QuotaLedgerServiceImpl ledgerService;

    @BeforeEach
    void setUp() {
        ledgerService = new QuotaLedgerServiceImpl(accountRepository, transactionRepository, accountProvisioner,
                accountMapper, transactionMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("getBalance of an unknown user is 0 and creates nothing")
        void getBalance_whenNoAccount_thenZero() {
            when(accountRepository.findByUsername("ghost")).thenReturn(Optional.empty());

            assertThat(ledgerService.getBalance("Ghost")).isZero();
            verify(accountProvisioner, never()).createIfAbsent(anyString(), anyLong());
        }

        @Test
        @DisplayName("ensureAccount provisions with the grant and returns the stored balance")
        void ensureAccount_provisionsThenReads() {
            when(accountRepository.findByUsername("alice")).thenReturn(Optional.of(account("alice", 50L)));

            assertThat(ledgerService.ensureAccount("ALICE", 50L)).isEqualTo(50L);
            verify(accountProvisioner).createIfAbsent("alice", 50L);
        }

        @Test
        @DisplayName("blank usernames are rejected")
        void blankUsername_isRejected() {
            assertThatThrownBy(() -> ledgerService.getBalance("  "))
                    .isInstanceOf(InvalidQuotaRequestException.class);
        }
    }

    @Nested
    @DisplayName("setBalance")
    class SetBalance {

        @Test
        @DisplayName("records a SET row whose amount is new minus old")
        void setBalance_recordsDelta() {
            QuotaAccount bob = account("bob", 40L);
            when(accountRepository.findByUsernameForUpdate("bob")).thenReturn(Optional.of(bob));

            long result = ledgerService.setBalance("Bob", 100L, "admin");

            assertThat(result).isEqualTo(100L);
            assertThat(bob.getBalance()).isEqualTo(100L);
            assertThat(bob.getUpdatedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));

            QuotaTransaction tx = capturedTransaction();
            assertThat(tx.getTransactionType()).isEqualTo(QuotaTransactionType.SET);
            assertThat(tx.getAmount()).isEqualTo(60L);
            assertThat(tx.getBalanceBefore()).isEqualTo(40L);
            assertThat(tx.getBalanceAfter()).isEqualTo(100L);
            assertThat(tx.getCreatedBy()).isEqualTo("admin");
            assertThat(tx.getDescription()).isEqualTo("Balance set to 100");
            verify(accountProvisioner).createIfAbsent("bob", 0L);
        }

        @Test
        @DisplayName("negative balances are rejected before touching the store")
        void setBalance_whenNegative_thenThrows() {
            assertThatThrownBy(() -> ledgerService.setBalance("bob", -1L, "admin"))
                    .isInstanceOf(InvalidQuotaRequestException.class);
            verify(transactionRepository, never()).save(any());
            verify(accountRepository, never()).findByUsernameForUpdate(anyString());
        }
    }

    @Nested
    @DisplayName("addBalance")
    class AddBalance {

        @Test
        @DisplayName("positive delta records ADD with the caller's description")
        void addBalance_positive() {
            when(accountRepository.findByUsernameForUpdate("alice")).thenReturn(Optional.of(account("alice", 10L)));

            assertThat(ledgerService.addBalance("alice", 15L, "admin", "course bonus")).isEqualTo(25L);

            QuotaTransaction tx = capturedTransaction();
            assertThat(tx.getTransactionType()).isEqualTo(QuotaTransactionType.ADD);
            assertThat(tx.getAmount()).isEqualTo(15L);
            assertThat(tx.getDescription()).isEqualTo("course bonus");
        }

        @Test
        @DisplayName("negative delta records DEDUCT with a default description")
        void addBalance_negative() {
            when(accountRepository.findByUsernameForUpdate("alice")).thenReturn(Optional.of(account("alice", 50L)));

            assertThat(ledgerService.addBalance("alice", -30L, "admin", null)).isEqualTo(20L);

            QuotaTransaction tx = capturedTransaction();
            assertThat(tx.getTransactionType()).isEqualTo(QuotaTransactionType.DEDUCT);
            assertThat(tx.getAmount()).isEqualTo(-30L);
            assertThat(tx.getDescription()).isEqualTo("Deducted 30 quota");
        }

        @Test
        @DisplayName("a result below zero is refused with the shortfall")
        void addBalance_whenResultNegative_thenInsufficient() {
            when(accountRepository.findByUsernameForUpdate("alice")).thenReturn(Optional.of(account("alice", 10L)));

            assertThatThrownBy(() -> ledgerService.addBalance("alice", -25L, "admin", null))
                    .isInstanceOf(InsufficientQuotaException.class)
                    .satisfies(ex -> assertThat(((InsufficientQuotaException) ex).getShortfall()).isEqualTo(15L));
            verify(transactionRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("deductForUsage")
    class DeductForUsage {

        @Test
        @DisplayName("clamps at zero and records the applied delta")
        void deductForUsage_clampsAtZero() {
            QuotaAccount bob = account("bob", 5L);
            when(accountRepository.findByUsernameForUpdate("bob")).thenReturn(Optional.of(bob));

            UsageDeductionResultDto result = ledgerService.deductForUsage("bob", 20L, "gpu");

            assertThat(result).isEqualTo(new UsageDeductionResultDto(true, 5L, 0L));
            assertThat(bob.getBalance()).isZero();

            QuotaTransaction tx = capturedTransaction();
            assertThat(tx.getTransactionType()).isEqualTo(QuotaTransactionType.USAGE);
            assertThat(tx.getAmount()).isEqualTo(-5L);
            assertThat(tx.getBalanceAfter()).isZero();
            assertThat(tx.getResourceType()).isEqualTo("gpu");
            assertThat(tx.getDescription()).isEqualTo("Usage: gpu");
        }

        @Test
        @DisplayName("carries the session id and description")
        void deductForUsage_withSession() {
            when(accountRepository.findByUsernameForUpdate("bob")).thenReturn(Optional.of(account("bob", 100L)));

            UsageDeductionResultDto result = ledgerService.deductForUsage("bob", 30L, "gpu", 7L, "Session 7: 3 min @ 10/min");

            assertThat(result.newBalance()).isEqualTo(70L);
            QuotaTransaction tx = capturedTransaction();
            assertThat(tx.getSessionId()).isEqualTo(7L);
            assertThat(tx.getDescription()).isEqualTo("Session 7: 3 min @ 10/min");
            assertThat(tx.getAmount()).isEqualTo(-30L);
        }

        @Test
        @DisplayName("unknown user is not charged and no account is created")
        void deductForUsage_whenNoAccount_thenNoOp() {
            when(accountRepository.findByUsernameForUpdate("ghost")).thenReturn(Optional.empty());

            UsageDeductionResultDto result = ledgerService.deductForUsage("ghost", 10L, "cpu");

            assertThat(result).isEqualTo(new UsageDeductionResultDto(false, 0L, 0L));
            verify(accountProvisioner, never()).createIfAbsent(anyString(), anyLong());
            verify(transactionRepository, never()).save(any());
        }

        @Test
        @DisplayName("unlimited account keeps its balance and gets no transaction")
        void deductForUsage_whenUnlimited_thenNoCharge() {
            QuotaAccount carol = account("carol", 12L);
            carol.setUnlimited(true);
            when(accountRepository.findByUsernameForUpdate("carol")).thenReturn(Optional.of(carol));

            UsageDeductionResultDto result = ledgerService.deductForUsage("carol", 500L, "gpu");

            assertThat(result).isEqualTo(new UsageDeductionResultDto(false, 0L, 12L));
            assertThat(carol.getBalance()).isEqualTo(12L);
            verify(transactionRepository, never()).save(any());
        }

        @Test
        @DisplayName("negative usage is rejected")
        void deductForUsage_whenNegative_thenThrows() {
            assertThatThrownBy(() -> ledgerService.deductForUsage("bob", -1L, "cpu"))
                    .isInstanceOf(InvalidQuotaRequestException.class);
        }
    }

    @Test
    @DisplayName("setUnlimited records a row even when the flag is unchanged")
    void setUnlimited_alwaysRecords() {
        QuotaAccount carol = account("carol", 8L);
        carol.setUnlimited(true);
        when(accountRepository.findByUsernameForUpdate("carol")).thenReturn(Optional.of(carol));

        ledgerService.setUnlimited("carol", true, "admin");

        QuotaTransaction tx = capturedTransaction();
        assertThat(tx.getTransactionType()).isEqualTo(QuotaTransactionType.SET_UNLIMITED);
        assertThat(tx.getAmount()).isZero();
        assertThat(tx.getBalanceBefore()).isEqualTo(8L);
        assertThat(tx.getBalanceAfter()).isEqualTo(8L);
        assertThat(tx.getDescription()).isEqualTo("Unlimited enabled");
    }

    @Test
    @DisplayName("setUnlimited(false) records UNSET_UNLIMITED")
    void setUnlimited_false() {
        QuotaAccount carol = account("carol", 0L);
        carol.setUnlimited(true);
        when(accountRepository.findByUsernameForUpdate("carol")).thenReturn(Optional.of(carol));

        ledgerService.setUnlimited("carol", false, "admin");

        assertThat(carol.isUnlimited()).isFalse();
        assertThat(capturedTransaction().getTransactionType()).isEqualTo(QuotaTransactionType.UNSET_UNLIMITED);
    }

    private QuotaTransaction capturedTransaction() {
        ArgumentCaptor<QuotaTransaction> captor = ArgumentCaptor.forClass(QuotaTransaction.class);
        verify(transactionRepository).save(captor.capture());
        return captor.getValue();
    }

    private static QuotaAccount account(String username, long balance) {
        QuotaAccount account = new QuotaAccount();
        account.setId(1L);
        account.setUsername(username);
        account.setBalance(balance);
        account.setCreatedAt(LocalDateTime.of(2026, 1, 1, 0, 0));
        account.setUpdatedAt(LocalDateTime.of(2026, 1, 1, 0, 0));
        return account;
    }
}
