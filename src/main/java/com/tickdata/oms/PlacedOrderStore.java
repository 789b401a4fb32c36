package com.tickdata.oms;

import com.tickdata.domain.model.PlacedOrder;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded, thread-safe record of acknowledged orders, oldest first.
 *
 * <p>Orders are only acknowledged and remembered here; nothing is routed to a broker. Once the
 * configured capacity is reached each new order evicts the oldest one.
 */
@Component
public class PlacedOrderStore {

    private static final Logger log = LoggerFactory.getLogger(PlacedOrderStore.class);

    private final int capacity;
    private final Deque<PlacedOrder> orders = new ArrayDeque<>();

    public PlacedOrderStore(OrderConfig orderConfig) {
        if (orderConfig.getCapacity() < 1) {
            throw new IllegalArgumentException("tickdata.orders.capacity must be positive: " + orderConfig.getCapacity());
        }
        this.capacity = orderConfig.getCapacity();
    }

    public synchronized void add(PlacedOrder order) {
        if (orders.size() == capacity) {
            PlacedOrder evicted = orders.removeFirst();
            log.debug("Order store full ({}), evicted order placed at {}", capacity, evicted.getPlacedAt());
        }
        orders.addLast(order);
    }

    /** Snapshot of the retained orders, oldest first. */
    public synchronized List<PlacedOrder> getOrders() {
        return List.copyOf(orders);
    }

    public synchronized int size() {
        return orders.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
