package com.tickpipe.mapper;

import com.tickpipe.domain.model.DepthLevel;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.entity.DepthRowEntity;
import com.tickpipe.entity.TickRowEntity;
import org.mapstruct.Mapper;
import org.mapstruct.MappingConstants;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from domain ticks to durable rows.
 *
 * <p>Row identity, trade date and depth ownership (tick id, side, level) are assigned by the
 * writer, so they are ignored here.
 */
@Mapper(componentModel = MappingConstants.ComponentModel.SPRING)
public interface TickRowMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "tradeDate", ignore = true)
    @Mapping(target = "tickMode", source = "mode")
    TickRowEntity toEntity(Tick tick);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "tickId", ignore = true)
    @Mapping(target = "side", ignore = true)
    @Mapping(target = "level", ignore = true)
    DepthRowEntity toEntity(DepthLevel depthLevel);
}
