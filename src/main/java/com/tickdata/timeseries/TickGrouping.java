package com.tickdata.timeseries;

import com.tickdata.domain.model.Tick;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Group-by primitive shared by the aggregators.
 *
 * <p>Groups keep the order in which their keys were first seen, and ticks inside a group keep
 * their input order. Combined with a stable sort beforehand this makes "first" and "last"
 * well defined even when timestamps collide: ties fall back to arrival order.
 */
public final class TickGrouping {

    static final Comparator<Tick> BY_TIME = Comparator.comparing(Tick::getTimestamp);

    static final Comparator<Tick> BY_INSTRUMENT_THEN_TIME =
            Comparator.comparing(Tick::getInstrumentId).thenComparing(Tick::getTimestamp);

    private TickGrouping() {}

    public static <K> Map<K, List<Tick>> groupBy(Collection<Tick> ticks, Function<Tick, K> keyFunction) {
        Map<K, List<Tick>> groups = new LinkedHashMap<>();
        for (Tick tick : ticks) {
            groups.computeIfAbsent(keyFunction.apply(tick), key -> new ArrayList<>())
                    .add(tick);
        }
        return groups;
    }

    /** Returns a copy of {@code ticks} stably sorted by {@code comparator}. */
    public static List<Tick> stableSort(Collection<Tick> ticks, Comparator<Tick> comparator) {
        List<Tick> sorted = new ArrayList<>(ticks);
        // List.sort is a stable merge sort
        sorted.sort(comparator);
        return sorted;
    }
}
