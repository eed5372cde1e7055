package uk.gegc.quotaledger.features.quota.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.quotaledger.features.quota.api.dto.QuotaInfoResponse;
import uk.gegc.quotaledger.features.quota.api.dto.TransactionDto;
import uk.gegc.quotaledger.features.quota.application.QuotaGateService;
import uk.gegc.quotaledger.features.quota.application.QuotaLedgerService;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransactionType;
import uk.gegc.quotaledger.shared.config.SecurityConfig;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QuotaController.class)
@Import(SecurityConfig.class)
@DisplayName("QuotaController")
class QuotaControllerTest {

    private static final LocalDateTime AT = LocalDateTime.of(2026, 3, 2, 10, 0);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QuotaLedgerService ledgerService;

    @MockitoBean
    private QuotaGateService gateService;

    @Test
    @WithMockUser(username = "alice", authorities = "QUOTA_USER")
    @DisplayName("GET /me returns the caller's balance and recent history")
    void getMyQuota() throws Exception {
        when(ledgerService.getBalance("alice")).thenReturn(25L);
        when(ledgerService.isUnlimited("alice")).thenReturn(false);
        when(ledgerService.recentTransactions("alice", QuotaController.RECENT_TRANSACTIONS))
                .thenReturn(List.of(usage(7L)));

        mockMvc.perform(get("/api/v1/quota/me"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.balance").value(25))
                .andExpect(jsonPath("$.unlimited").value(false))
                .andExpect(jsonPath("$.recentTransactions[0].transactionType").value("USAGE"))
                .andExpect(jsonPath("$.recentTransactions[0].amount").value(-5));
    }

    @Test
    @DisplayName("anonymous callers get 401")
    void anonymous_isUnauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/quota/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.title").value("Unauthorized"));
    }

    @Test
    @WithMockUser(username = "alice", authorities = "QUOTA_USER")
    @DisplayName("a user may read their own account with any casing")
    void getUserQuota_self() throws Exception {
        when(ledgerService.getBalance("alice")).thenReturn(3L);
        when(ledgerService.recentTransactions("alice", QuotaController.RECENT_TRANSACTIONS)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/quota/ALICE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.balance").value(3));
    }

    @Test
    @WithMockUser(username = "alice", authorities = "QUOTA_USER")
    @DisplayName("a user may not read someone else's account")
    void getUserQuota_other_isForbidden() throws Exception {
        mockMvc.perform(get("/api/v1/quota/bob"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.title").value("Access Denied"));

        verifyNoInteractions(ledgerService);
    }

    @Test
    @WithMockUser(username = "admin", authorities = {"QUOTA_USER", "QUOTA_ADMIN"})
    @DisplayName("an admin may read any account")
    void getUserQuota_admin() throws Exception {
        when(ledgerService.getBalance("bob")).thenReturn(50L);
        when(ledgerService.isUnlimited("bob")).thenReturn(true);
        when(ledgerService.recentTransactions("bob", QuotaController.RECENT_TRANSACTIONS)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/quota/bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unlimited").value(true));
    }

    @Test
    @WithMockUser(username = "alice", authorities = "QUOTA_USER")
    @DisplayName("GET /rates describes the metering policy")
    void getRates() throws Exception {
        when(gateService.describePolicy())
                .thenReturn(new QuotaInfoResponse(true, Map.of("cpu", 1, "gpu", 10), 10L, 0L));

        mockMvc.perform(get("/api/v1/quota/rates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rates.gpu").value(10))
                .andExpect(jsonPath("$.minimumToStart").value(10));
    }

    @Test
    @WithMockUser(username = "alice", authorities = "QUOTA_USER")
    @DisplayName("transactions are filtered by type and paged")
    void getTransactions_filtered() throws Exception {
        when(ledgerService.listTransactions(eq("alice"), eq(QuotaTransactionType.USAGE), isNull(), isNull(), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(usage(9L)), PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/v1/quota/alice/transactions").param("type", "USAGE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].id").value(9))
                .andExpect(jsonPath("$.content[0].resourceType").value("gpu"));

        verify(ledgerService).listTransactions(eq("alice"), eq(QuotaTransactionType.USAGE), isNull(), isNull(), any(Pageable.class));
    }

    @Test
    @WithMockUser(username = "alice", authorities = "QUOTA_USER")
    @DisplayName("an unknown transaction type is a 400")
    void getTransactions_badType() throws Exception {
        mockMvc.perform(get("/api/v1/quota/alice/transactions").param("type", "REFUND"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("type"));
    }

    private static TransactionDto usage(long id) {
        return new TransactionDto(id, "alice", -5L, QuotaTransactionType.USAGE, "gpu", 12L,
                "Usage: gpu", 30L, 25L, AT, null);
    }
}
