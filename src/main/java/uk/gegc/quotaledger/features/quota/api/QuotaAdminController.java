package uk.gegc.quotaledger.features.quota.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.quotaledger.features.quota.api.dto.AccountDto;
import uk.gegc.quotaledger.features.quota.api.dto.BatchSetRequest;
import uk.gegc.quotaledger.features.quota.api.dto.BatchSetResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.QuotaCheckRequest;
import uk.gegc.quotaledger.features.quota.api.dto.QuotaCheckResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.QuotaModifyRequest;
import uk.gegc.quotaledger.features.quota.api.dto.QuotaModifyResponse;
import uk.gegc.quotaledger.features.quota.api.dto.ReclaimedSessionDto;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshRequest;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.SessionCloseResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.StartSessionRequest;
import uk.gegc.quotaledger.features.quota.api.dto.UsageSessionDto;
import uk.gegc.quotaledger.features.quota.application.QuotaGateService;
import uk.gegc.quotaledger.features.quota.application.QuotaLedgerService;
import uk.gegc.quotaledger.features.quota.application.QuotaRefreshService;
import uk.gegc.quotaledger.features.quota.application.StaleSessionReclaimer;
import uk.gegc.quotaledger.features.quota.application.UsageSessionService;
import uk.gegc.quotaledger.features.quota.application.Usernames;

import java.util.List;

/**
 * Administrative and supervisor-facing operations. Everything under {@code /api/v1/admin}
 * requires the {@code QUOTA_ADMIN} authority.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/quota")
@RequiredArgsConstructor
@Tag(name = "Quota Admin", description = "Balance administration, batch refresh and usage sessions")
@SecurityRequirement(name = "basicAuth")
public class QuotaAdminController {

    private final QuotaLedgerService ledgerService;
    private final QuotaGateService gateService;
    private final UsageSessionService sessionService;
    private final QuotaRefreshService refreshService;
    private final StaleSessionReclaimer reclaimer;

    @Operation(summary = "List all balances")
    @GetMapping
    public ResponseEntity<List<AccountDto>> listBalances() {
        return ResponseEntity.ok(ledgerService.getAllBalances());
    }

    @Operation(summary = "Modify one user's quota", description = "Actions: set, add, deduct, set_unlimited.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance updated"),
            @ApiResponse(responseCode = "400", description = "Invalid action or amount"),
            @ApiResponse(responseCode = "409", description = "Deduction larger than the balance")
    })
    @PostMapping("/{username}")
    public ResponseEntity<QuotaModifyResponse> modifyQuota(@PathVariable String username,
                                                           @Valid @RequestBody QuotaModifyRequest request,
                                                           Authentication authentication) {
        String normalized = Usernames.normalize(username);
        String actor = authentication.getName();
        long balance = switch (request.action()) {
            case SET -> ledgerService.setBalance(normalized, request.amount(), actor);
            case ADD -> ledgerService.addBalance(normalized, request.amount(), actor, request.description());
            case DEDUCT -> ledgerService.addBalance(normalized, -request.amount(), actor, request.description());
            case SET_UNLIMITED -> {
                ledgerService.setUnlimited(normalized, Boolean.TRUE.equals(request.unlimited()), actor);
                yield ledgerService.getBalance(normalized);
            }
        };
        log.info("Admin {} applied {} to {}", actor, request.action().getValue(), normalized);
        return ResponseEntity.ok(new QuotaModifyResponse(
                normalized, balance, ledgerService.isUnlimited(normalized), request.action(), request.amount()));
    }

    @Operation(summary = "Set many balances", description = "Each user is updated independently; failures are reported per user.")
    @PostMapping("/batch")
    public ResponseEntity<BatchSetResultDto> batchSet(@Valid @RequestBody BatchSetRequest request,
                                                      Authentication authentication) {
        return ResponseEntity.ok(refreshService.batchSetBalances(request.users(), authentication.getName()));
    }

    @Operation(summary = "Run a batch refresh", description = "Adds to or sets the balance of every account selected by the targets.")
    @PostMapping("/refresh")
    public ResponseEntity<RefreshResultDto> refresh(@Valid @RequestBody RefreshRequest request,
                                                    Authentication authentication) {
        return ResponseEntity.ok(refreshService.refresh(request.withTriggeredBy(authentication.getName())));
    }

    @Operation(summary = "Check whether a user may start", description = "Read-only; nothing is deducted.")
    @PostMapping("/check")
    public ResponseEntity<QuotaCheckResultDto> check(@Valid @RequestBody QuotaCheckRequest request) {
        return ResponseEntity.ok(gateService.canStart(request.username(), request.resourceType(), request.minutes()));
    }

    @Operation(summary = "Start a usage session")
    @PostMapping("/sessions")
    public ResponseEntity<UsageSessionDto> startSession(@Valid @RequestBody StartSessionRequest request) {
        long sessionId = sessionService.startSession(request.username(), request.resourceType());
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.getSession(sessionId));
    }

    @Operation(summary = "End a usage session", description = "Charges the elapsed minutes. Ending an already closed session is a no-op.")
    @PostMapping("/sessions/{sessionId}/end")
    public ResponseEntity<SessionCloseResultDto> endSession(@PathVariable long sessionId) {
        return ResponseEntity.ok(sessionService.endSession(sessionId));
    }

    @Operation(summary = "List active sessions")
    @GetMapping("/sessions/active")
    public ResponseEntity<List<UsageSessionDto>> listActiveSessions() {
        return ResponseEntity.ok(sessionService.listActiveSessions());
    }

    @Operation(summary = "Get a usage session")
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<UsageSessionDto> getSession(@PathVariable long sessionId) {
        return ResponseEntity.ok(sessionService.getSession(sessionId));
    }

    @Operation(summary = "Reclaim stale sessions", description = "Closes sessions active for longer than the limit without charging them.")
    @PostMapping("/sessions/reclaim")
    public ResponseEntity<List<ReclaimedSessionDto>> reclaim(
            @RequestParam(required = false) @Min(1) @Max(10_080) Integer maxDurationMinutes) {
        List<ReclaimedSessionDto> reclaimed = maxDurationMinutes == null
                ? reclaimer.reclaim()
                : reclaimer.reclaim(maxDurationMinutes);
        return ResponseEntity.ok(reclaimed);
    }
}
