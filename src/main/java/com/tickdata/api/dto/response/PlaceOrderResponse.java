package com.tickdata.api.dto.response;

import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Acknowledgement of a placed order together with the retained order history, oldest first.
 */
@Data
@Builder
public class PlaceOrderResponse {

    private String message;

    private List<PlacedOrderResponse> orders;
}
