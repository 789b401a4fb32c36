package com.tickdata.repository;

import com.tickdata.domain.model.DateRange;
import com.tickdata.domain.model.Tick;
import java.util.List;

/**
 * Storage capability the service needs from a tick backend.
 *
 * <p>The aggregation engine never sees a concrete backend, only the ticks this interface returns.
 * Implementations own their connections; callers never close anything obtained from here.
 */
public interface TickStore {

    /** Creates the tick table if it does not exist yet. Idempotent. */
    void ensureSchema();

    /**
     * Inserts a batch of ticks atomically: either all ticks are stored or none.
     *
     * @throws com.tickdata.exception.TickStoreException if the batch could not be written
     */
    void insertTicks(List<Tick> ticks);

    /**
     * Returns the ticks whose timestamp falls within {@code range}, ordered by timestamp.
     *
     * @param instrumentId instrument filter; null or blank selects all instruments
     * @throws com.tickdata.exception.TickStoreException if the backend could not be queried
     */
    List<Tick> fetchTicksInRange(DateRange range, String instrumentId);
}
