package uk.gegc.quotaledger.features.quota.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.quotaledger.features.quota.api.dto.TransactionDto;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaTransaction;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface QuotaTransactionMapper {
    TransactionDto toDto(QuotaTransaction entity);
    List<TransactionDto> toDtos(List<QuotaTransaction> entities);
}
