package com.tickdata.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Acknowledged order kept by the {@link com.tickdata.oms.PlacedOrderStore}.
 */
@Value
@Builder
public class PlacedOrder {

    LocalDateTime placedAt;
    String symbol;
    BigDecimal price;
    int qty;
}
