package com.riskfactor.mapper;

import com.riskfactor.domain.model.Position;
import com.riskfactor.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from PositionEntity to the Position domain model.
 * Entry and exit dates are only used by the as-of query and are not carried over.
 */
@Mapper
public interface PositionMapper {

    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);
}
