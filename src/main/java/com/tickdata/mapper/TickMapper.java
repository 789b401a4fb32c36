package com.tickdata.mapper;

import com.tickdata.domain.model.Tick;
import com.tickdata.entity.TickEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the Tick domain model and TickEntity.
 * Prices are stored as DOUBLE PRECISION and surface as BigDecimal in the domain model.
 */
@Mapper
public interface TickMapper {

    @Mapping(target = "id", ignore = true)
    TickEntity toEntity(Tick tick);

    Tick toDomain(TickEntity entity);

    List<TickEntity> toEntityList(List<Tick> ticks);

    List<Tick> toDomainList(List<TickEntity> entities);
}
