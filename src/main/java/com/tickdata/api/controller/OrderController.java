package com.tickdata.api.controller;

import com.tickdata.api.dto.request.PlaceOrderRequest;
import com.tickdata.api.dto.response.PlaceOrderResponse;
import com.tickdata.domain.model.PlacedOrder;
import com.tickdata.mapper.PlacedOrderMapper;
import com.tickdata.oms.PlacedOrderStore;
import jakarta.validation.Valid;
import java.time.LocalDateTime;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint acknowledging simulated orders.
 *
 * <p>Orders are not routed anywhere. Each accepted order is kept in the bounded
 * {@link PlacedOrderStore} and the retained history is echoed back.
 *
 * <p>Endpoint:
 * <ul>
 *   <li>POST /api/orders -- acknowledge an order</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final PlacedOrderStore placedOrderStore;
    private final PlacedOrderMapper placedOrderMapper = Mappers.getMapper(PlacedOrderMapper.class);

    public OrderController(PlacedOrderStore placedOrderStore) {
        this.placedOrderStore = placedOrderStore;
    }

    @PostMapping
    public ResponseEntity<PlaceOrderResponse> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        PlacedOrder order = PlacedOrder.builder()
                .placedAt(LocalDateTime.now())
                .symbol(request.getSymbol().trim())
                .price(request.getPrice())
                .qty(request.getQty())
                .build();
        placedOrderStore.add(order);
        log.info("Order acknowledged: {} x{} @ {}", order.getSymbol(), order.getQty(), order.getPrice());

        PlaceOrderResponse response = PlaceOrderResponse.builder()
                .message(String.format(
                        "[SUCCESS] Symbol: %s, Price: %s, Quantity: %d",
                        order.getSymbol(),
                        order.getPrice().toPlainString(),
                        order.getQty()))
                .orders(placedOrderMapper.toResponseList(placedOrderStore.getOrders()))
                .build();
        return ResponseEntity.ok(response);
    }
}
