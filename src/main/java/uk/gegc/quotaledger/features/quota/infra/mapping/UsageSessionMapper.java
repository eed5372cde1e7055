package uk.gegc.quotaledger.features.quota.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.quotaledger.features.quota.api.dto.UsageSessionDto;
import uk.gegc.quotaledger.features.quota.domain.model.UsageSession;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface UsageSessionMapper {
    UsageSessionDto toDto(UsageSession entity);
    List<UsageSessionDto> toDtos(List<UsageSession> entities);
}
