package com.tickdata.mapper;

import com.tickdata.api.dto.response.PlacedOrderResponse;
import com.tickdata.domain.model.PlacedOrder;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from PlacedOrder to its response DTO.
 */
@Mapper
public interface PlacedOrderMapper {

    PlacedOrderResponse toResponse(PlacedOrder order);

    List<PlacedOrderResponse> toResponseList(List<PlacedOrder> orders);
}
