package uk.gegc.quotaledger.features.quota.application;

import uk.gegc.quotaledger.features.quota.api.dto.BatchBalanceEntry;
import uk.gegc.quotaledger.features.quota.api.dto.BatchSetResultDto;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshRequest;
import uk.gegc.quotaledger.features.quota.api.dto.RefreshResultDto;

import java.util.List;

/**
 * Bulk balance operations. Each account is updated in its own database transaction so one
 * failing row does not undo or stop the others.
 */
public interface QuotaRefreshService {

    RefreshResultDto refresh(RefreshRequest request);

    BatchSetResultDto batchSetBalances(List<BatchBalanceEntry> entries, String actor);
}
