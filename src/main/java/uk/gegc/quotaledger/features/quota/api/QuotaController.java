package uk.gegc.quotaledger.features.quota.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.quotaledger.features.quota.api.dto.QuotaInfoResponse;
import uk.gegc.quotaledger.features.quota.api.dto.TransactionDto;
import uk.gegc.quotaledger.features.quota.api.dto.UserQuotaResponse;
import uk.gegc.quotaledger.features.quota.application.QuotaGateService;
import uk.gegc.quotaledger.features.quota.application.QuotaLedgerService;
import uk.gegc.quotaledger.features.quota.application.Usernames;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransactionType;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1/quota")
@RequiredArgsConstructor
@Tag(name = "Quota", description = "Balances and history for the calling user")
@SecurityRequirement(name = "basicAuth")
public class QuotaController {

    static final int RECENT_TRANSACTIONS = 20;

    private final QuotaLedgerService ledgerService;
    private final QuotaGateService gateService;

    @Operation(summary = "Get my balance", description = "Balance, unlimited flag and the 20 most recent transactions of the caller.")
    @GetMapping("/me")
    public ResponseEntity<UserQuotaResponse> getMyQuota(Authentication authentication) {
        return ResponseEntity.ok(quotaOf(authentication.getName()));
    }

    @Operation(summary = "Get metering rates", description = "Cost per minute by resource type and the default grant.")
    @GetMapping("/rates")
    public ResponseEntity<QuotaInfoResponse> getRates() {
        return ResponseEntity.ok(gateService.describePolicy());
    }

    @Operation(summary = "Get a user's balance", description = "Allowed for the user themself or a QUOTA_ADMIN.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance returned; 0 when the user has no account"),
            @ApiResponse(responseCode = "403", description = "Not the caller's account and caller is not an admin")
    })
    @GetMapping("/{username}")
    @PreAuthorize("hasAuthority('QUOTA_ADMIN') or #username.equalsIgnoreCase(authentication.name)")
    public ResponseEntity<UserQuotaResponse> getUserQuota(@PathVariable String username) {
        return ResponseEntity.ok(quotaOf(username));
    }

    @Operation(summary = "List a user's transactions", description = "Newest first, optionally filtered by type and time range.")
    @GetMapping("/{username}/transactions")
    @PreAuthorize("hasAuthority('QUOTA_ADMIN') or #username.equalsIgnoreCase(authentication.name)")
    public ResponseEntity<Page<TransactionDto>> getTransactions(
            @PathVariable String username,
            @Parameter(description = "Transaction type, e.g. USAGE")
            @RequestParam(required = false) QuotaTransactionType type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateTo,
            @PageableDefault(size = 20) Pageable pageable) {
        return ResponseEntity.ok(ledgerService.listTransactions(username, type, dateFrom, dateTo, pageable));
    }

    private UserQuotaResponse quotaOf(String username) {
        String normalized = Usernames.normalize(username);
        return new UserQuotaResponse(
                normalized,
                ledgerService.getBalance(normalized),
                ledgerService.isUnlimited(normalized),
                ledgerService.recentTransactions(normalized, RECENT_TRANSACTIONS));
    }
}
