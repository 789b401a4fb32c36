package com.tickdata.repository;

import com.tickdata.domain.model.DateRange;
import com.tickdata.domain.model.Tick;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Heap-backed tick store for development and tests ({@code tickdata.store.type=memory}).
 *
 * <p>Contents live as long as the bean; nothing is persisted.
 */
@Repository
@ConditionalOnProperty(prefix = "tickdata.store", name = "type", havingValue = "memory")
public class InMemoryTickStore implements TickStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTickStore.class);

    private final List<Tick> ticks = new ArrayList<>();

    @Override
    public void ensureSchema() {
        // nothing to create
    }

    @Override
    public synchronized void insertTicks(List<Tick> batch) {
        ticks.addAll(batch);
        log.debug("Stored {} ticks in memory (total={})", batch.size(), ticks.size());
    }

    @Override
    public synchronized List<Tick> fetchTicksInRange(DateRange range, String instrumentId) {
        boolean allInstruments = instrumentId == null || instrumentId.isBlank();
        List<Tick> matching = new ArrayList<>();
        for (Tick tick : ticks) {
            if (tick.getTimestamp() == null || !range.contains(tick.getTimestamp())) {
                continue;
            }
            if (allInstruments || instrumentId.equals(tick.getInstrumentId())) {
                matching.add(tick);
            }
        }
        matching.sort(Comparator.comparing(Tick::getTimestamp));
        return matching;
    }

    public synchronized int size() {
        return ticks.size();
    }
}
