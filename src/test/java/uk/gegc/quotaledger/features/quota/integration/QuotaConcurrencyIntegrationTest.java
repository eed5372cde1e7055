package uk.gegc.quotaledger.features.quota.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshRequest;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshTargets;
import uk.gegc.quotaledger.features.quota.api.dto.ReclaimedSessionDto;
import uk.gegc.quotaledger.features.quota.api.dto.SessionCloseResultDto;
import uk.gegc.quotaledger.features.quota.application.QuotaLedgerService;
import uk.gegc.quotaledger.features.quota.application.QuotaRefreshService;
import uk.gegc.quotaledger.features.quota.application.StaleSessionReclaimer;
import uk.gegc.quotaledger.features.quota.application.UsageSessionService;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransaction;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransactionType;
import uk.gegc.quotaledger.features.quota.domain.model.RateTable;
import uk.gegc.quotaledger.features.quota.domain.model.UsageSession;
import uk.gegc.quotaledger.features.quota.domain.model.UsageSessionStatus;
import uk.gegc.quotaledger.features.quota.infra.repository.QuotaTransactionRepository;
import uk.gegc.quotaledger.features.quota.infra.repository.UsageSessionRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.quotaledger.features.quota.testutils.LedgerAsserts.assertAuditChain;
import static uk.gegc.quotaledger.features.quota.testutils.LedgerAsserts.assertNeverNegative;

/**
 * Runs the ledger against a real database with several threads hitting the same account or session.
 */
@SpringBootTest
@ActiveProfiles("test")
class QuotaConcurrencyIntegrationTest {

    private static final int THREADS = 6;

    @Autowired
    private QuotaLedgerService ledgerService;
    @Autowired
    private UsageSessionService sessionService;
    @Autowired
    private StaleSessionReclaimer reclaimer;
    @Autowired
    private QuotaRefreshService refreshService;
    @Autowired
    private QuotaTransactionRepository transactionRepository;
    @Autowired
    private UsageSessionRepository sessionRepository;
    @Autowired
    private Clock clock;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("concurrent top-ups are all applied and chain in the audit log")
    void concurrentAdds_noLostUpdates() throws Exception {
        String user = uniqueUser("adder");
        ledgerService.setBalance(user, 0L, "test");

        runConcurrently(THREADS * 5, () -> ledgerService.addBalance(user, 7L, "test", null));

        assertThat(ledgerService.getBalance(user)).isEqualTo(THREADS * 5 * 7L);
        List<QuotaTransaction> history = transactionRepository.findByUsernameOrderByIdAsc(user);
        assertThat(history).hasSize(1 + THREADS * 5);
        assertAuditChain(history, ledgerService.getBalance(user));
    }

    @Test
    @DisplayName("concurrent usage charges clamp at zero and never go negative")
    void concurrentUsage_clampsAtZero() throws Exception {
        String user = uniqueUser("burner");
        ledgerService.setBalance(user, 100L, "test");

        runConcurrently(THREADS * 3, () -> ledgerService.deductForUsage(user, 9L, "gpu"));

        assertThat(ledgerService.getBalance(user)).isZero();
        List<QuotaTransaction> history = transactionRepository.findByUsernameOrderByIdAsc(user);
        assertNeverNegative(history);
        assertAuditChain(history, 0L);
        long charged = history.stream()
                .filter(tx -> tx.getTransactionType() == QuotaTransactionType.USAGE)
                .mapToLong(QuotaTransaction::getAmount)
                .sum();
        assertThat(charged).isEqualTo(-100L);
    }

    @Test
    @DisplayName("concurrent first references create one account and one initial grant")
    void concurrentEnsureAccount_grantsOnce() throws Exception {
        String user = uniqueUser("newcomer");

        List<Long> balances = runConcurrently(THREADS, () -> ledgerService.ensureAccount(user, 50L));

        assertThat(balances).containsOnly(50L);
        assertThat(transactionRepository.countByUsernameAndTransactionType(user, QuotaTransactionType.INITIAL_GRANT))
                .isEqualTo(1L);
    }

    @Test
    @DisplayName("closing a session twice charges once")
    void endSessionTwice_chargesOnce() {
        String user = uniqueUser("closer");
        ledgerService.setBalance(user, 100L, "test");
        long sessionId = sessionService.startSession(user, "gpu");

        SessionCloseResultDto first = sessionService.endSession(sessionId, RateTable.of(Map.of("gpu", 10)));
        SessionCloseResultDto second = sessionService.endSession(sessionId, RateTable.of(Map.of("gpu", 10)));

        assertThat(first.closed()).isTrue();
        assertThat(first.durationMinutes()).isEqualTo(1);
        assertThat(first.quotaConsumed()).isEqualTo(10L);
        assertThat(second.closed()).isFalse();
        assertThat(transactionRepository.findBySessionId(sessionId)).hasSize(1);
        assertThat(ledgerService.getBalance(user)).isEqualTo(90L);
        assertAuditChain(transactionRepository.findByUsernameOrderByIdAsc(user), 90L);
    }

    @Test
    @DisplayName("session and account queries reflect the live state")
    void sessionAndAccountQueries() {
        String user = uniqueUser("viewer");
        ledgerService.setBalance(user, 40L, "test");
        long sessionId = sessionService.startSession(user.toUpperCase(), null);

        assertThat(sessionService.findActiveSession(user))
                .get()
                .satisfies(session -> {
                    assertThat(session.id()).isEqualTo(sessionId);
                    assertThat(session.resourceType()).isEqualTo("cpu");
                });
        assertThat(sessionService.countActiveSessions()).isGreaterThanOrEqualTo(1L);
        assertThat(sessionService.listActiveSessions()).anyMatch(session -> session.id() == sessionId);
        assertThat(ledgerService.findAccount(user)).get()
                .satisfies(account -> assertThat(account.balance()).isEqualTo(40L));
        assertThat(ledgerService.findAccount(uniqueUser("ghost"))).isEmpty();

        sessionService.endSession(sessionId);

        assertThat(sessionService.findActiveSession(user)).isEmpty();
        assertThat(sessionService.getSession(sessionId).status()).isEqualTo(UsageSessionStatus.COMPLETED);
    }

    @Test
    @DisplayName("a normal close racing the reclaimer: exactly one of them wins")
    void endSessionVersusReclaim_exactlyOneWins() throws Exception {
        String user = uniqueUser("racer");
        ledgerService.setBalance(user, 10_000L, "test");
        UsageSession stale = new UsageSession();
        stale.setUsername(user);
        stale.setResourceType("cpu");
        stale.setStartTime(LocalDateTime.now(clock).minusMinutes(600));
        stale.setCreatedAt(stale.getStartTime());
        stale.setStatus(UsageSessionStatus.ACTIVE);
        long sessionId = sessionRepository.saveAndFlush(stale).getId();

        CountDownLatch start = new CountDownLatch(1);
        Future<SessionCloseResultDto> closer = executor.submit(() -> {
            start.await();
            return sessionService.endSession(sessionId, RateTable.of(Map.of("cpu", 1)));
        });
        Future<List<ReclaimedSessionDto>> sweeper = executor.submit(() -> {
            start.await();
            return reclaimer.reclaim(480);
        });
        start.countDown();

        boolean closedNormally = closer.get(30, TimeUnit.SECONDS).closed();
        boolean reclaimed = sweeper.get(30, TimeUnit.SECONDS).stream()
                .anyMatch(r -> r.sessionId() == sessionId);

        assertThat(closedNormally ^ reclaimed).as("exactly one closer wins").isTrue();
        UsageSession stored = sessionRepository.findById(sessionId).orElseThrow();
        List<QuotaTransaction> charges = transactionRepository.findBySessionId(sessionId);
        if (closedNormally) {
            assertThat(stored.getStatus()).isEqualTo(UsageSessionStatus.COMPLETED);
            assertThat(charges).hasSize(1);
            assertThat(ledgerService.getBalance(user)).isEqualTo(10_000L - stored.getQuotaConsumed());
        } else {
            assertThat(stored.getStatus()).isEqualTo(UsageSessionStatus.CLEANED_UP);
            assertThat(stored.getDurationMinutes()).isEqualTo(480);
            assertThat(charges).isEmpty();
            assertThat(ledgerService.getBalance(user)).isEqualTo(10_000L);
        }
    }

    @Test
    @DisplayName("refresh tops up only the accounts that match its targets")
    void refresh_targetsByBalanceAndSkipsUnlimited() {
        String alice = uniqueUser("alice");
        String bob = uniqueUser("bob");
        String carol = uniqueUser("carol");
        ledgerService.setBalance(alice, 5L, "test");
        ledgerService.setBalance(bob, 50L, "test");
        ledgerService.setUnlimited(carol, true, "test");

        RefreshResultDto result = refreshService.refresh(new RefreshRequest(
                "low-balance-topup", null, 10L, null, null,
                new RefreshTargets(false, 20L, null, List.of(alice, bob, carol), null, null),
                "test"));

        assertThat(result.usersUpdated()).isEqualTo(1);
        assertThat(result.totalChange()).isEqualTo(10L);
        assertThat(result.skipped()).isGreaterThanOrEqualTo(2);
        assertThat(result.failed()).isZero();
        assertThat(ledgerService.getBalance(alice)).isEqualTo(15L);
        assertThat(ledgerService.getBalance(bob)).isEqualTo(50L);
        assertThat(ledgerService.getBalance(carol)).isZero();

        List<QuotaTransaction> aliceHistory = transactionRepository.findByUsernameOrderByIdAsc(alice);
        QuotaTransaction refreshRow = aliceHistory.get(aliceHistory.size() - 1);
        assertThat(refreshRow.getTransactionType()).isEqualTo(QuotaTransactionType.AUTO_REFRESH);
        assertThat(refreshRow.getDescription()).isEqualTo("Auto add: low-balance-topup");
        assertAuditChain(aliceHistory, 15L);
    }

    private <T> List<T> runConcurrently(int tasks, Callable<T> task) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < tasks; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(60, TimeUnit.SECONDS));
        }
        return results;
    }

    private static String uniqueUser(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
