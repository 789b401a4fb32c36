package com.tickdata.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * DTO for one acknowledged order.
 */
@Data
@Builder
public class PlacedOrderResponse {

    private LocalDateTime placedAt;
    private String symbol;
    private BigDecimal price;
    private int qty;
}
