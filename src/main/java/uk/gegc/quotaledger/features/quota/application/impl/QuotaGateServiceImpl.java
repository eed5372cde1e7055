package uk.gegc.quotaledger.features.quota.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quotaledger.features.quota.api.dto.QuotaCheckResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.QuotaInfoResponse;
import uk.gegc.quotaledger.features.quota.application.QuotaGateService;
import uk.gegc.quotaledger.features.quota.application.QuotaLedgerService;
import uk.gegc.quotaledger.features.quota.application.QuotaMetricsService;
import uk.gegc.quotaledger.features.quota.application.QuotaProperties;
import uk.gegc.quotaledger.features.quota.domain.exception.InvalidQuotaRequestException;
import uk.gegc.quotaledger.features.quota.domain.model.RateTable;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaGateServiceImpl implements QuotaGateService {

    private final QuotaLedgerService ledgerService;
    private final QuotaMetricsService metricsService;
    private final QuotaProperties quotaProperties;

    @Override
    public QuotaCheckResultDto canStart(String username, String resourceType, int minutes,
                                        RateTable rates, long defaultGrant) {
        if (minutes < 0) {
            throw new InvalidQuotaRequestException("Requested minutes cannot be negative: " + minutes);
        }
        RateTable table = rates != null ? rates : RateTable.empty();

        long balance = ledgerService.ensureAccount(username, defaultGrant);
        if (ledgerService.isUnlimited(username)) {
            return QuotaCheckResultDto.allowed("Unlimited quota", 0L, balance);
        }

        int rate = table.rateFor(resourceType);
        long estimatedCost = (long) minutes * rate;

        if (balance <= 0) {
            log.debug("Start denied for {} on {}: balance {}", username, resourceType, balance);
            metricsService.incrementGateDenied(resourceType);
            return QuotaCheckResultDto.denied(
                    String.format("Insufficient quota (balance: %d)", balance),
                    estimatedCost, balance, null);
        }

        if (balance < estimatedCost) {
            long maxMinutes = rate > 0 ? balance / rate : 0L;
            log.debug("Start denied for {} on {}: need {} have {}", username, resourceType, estimatedCost, balance);
            metricsService.incrementGateDenied(resourceType);
            return QuotaCheckResultDto.denied(
                    String.format("Insufficient quota for %d min (balance: %d, need: %d, max: %d min)",
                            minutes, balance, estimatedCost, maxMinutes),
                    estimatedCost, balance, maxMinutes);
        }

        return QuotaCheckResultDto.allowed(
                String.format("OK (balance: %d, cost: %d)", balance, estimatedCost),
                estimatedCost, balance);
    }

    @Override
    public QuotaCheckResultDto canStart(String username, String resourceType, int minutes) {
        if (!quotaProperties.isEnabled()) {
            return QuotaCheckResultDto.allowed("Quota disabled", 0L, ledgerService.getBalance(username));
        }
        return canStart(username, resourceType, minutes,
                quotaProperties.rateTable(), quotaProperties.getDefaultGrant());
    }

    @Override
    public QuotaInfoResponse describePolicy() {
        return new QuotaInfoResponse(
                quotaProperties.isEnabled(),
                quotaProperties.rateTable().asMap(),
                quotaProperties.getMinimumToStart(),
                quotaProperties.getDefaultGrant());
    }
}
