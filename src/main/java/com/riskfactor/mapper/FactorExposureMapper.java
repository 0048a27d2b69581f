package com.riskfactor.mapper;

import com.riskfactor.domain.model.PortfolioFactorExposure;
import com.riskfactor.domain.model.PositionFactorExposure;
import com.riskfactor.entity.PortfolioFactorExposureEntity;
import com.riskfactor.entity.PositionFactorExposureEntity;
import java.util.List;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between exposure domain models and their entities.
 *
 * <p>Builders are disabled so that the {@code rSquared} property resolves through the
 * setters on both sides. UUID ids map to the 36-character string columns.
 */
@Mapper(builder = @Builder(disableBuilder = true))
public interface FactorExposureMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    PositionFactorExposureEntity toEntity(PositionFactorExposure exposure);

    PositionFactorExposure toDomain(PositionFactorExposureEntity entity);

    List<PositionFactorExposureEntity> toPositionEntityList(List<PositionFactorExposure> exposures);

    List<PositionFactorExposure> toPositionDomainList(List<PositionFactorExposureEntity> entities);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    PortfolioFactorExposureEntity toEntity(PortfolioFactorExposure exposure);

    PortfolioFactorExposure toDomain(PortfolioFactorExposureEntity entity);

    List<PortfolioFactorExposureEntity> toPortfolioEntityList(List<PortfolioFactorExposure> exposures);

    List<PortfolioFactorExposure> toPortfolioDomainList(List<PortfolioFactorExposureEntity> entities);
}
