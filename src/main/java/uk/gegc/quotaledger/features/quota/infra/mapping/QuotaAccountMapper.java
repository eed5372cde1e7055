package uk.gegc.quotaledger.features.quota.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.quotaledger.features.quota.api.dto.AccountDto;
import uk.gegc.quotaledger.features.quota.domain.model.QuotaAccount;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface QuotaAccountMapper {
    AccountDto toDto(QuotaAccount entity);
    List<AccountDto> toDtos(List<QuotaAccount> entities);
}
