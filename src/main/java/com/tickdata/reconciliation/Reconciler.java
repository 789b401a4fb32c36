package com.tickdata.reconciliation;

import com.tickdata.domain.enums.MismatchType;
import com.tickdata.domain.model.Bar;
import com.tickdata.domain.model.MismatchReport;
import com.tickdata.domain.model.MismatchRow;
import com.tickdata.domain.model.MismatchTable;
import com.tickdata.domain.model.ReferenceBar;
import com.tickdata.exception.IdentityNormalizationException;
import com.tickdata.timeseries.BucketKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Diffs bhavcopy bars against bars computed from stored ticks.
 *
 * <p>Steps:
 * <ol>
 *   <li>Normalize each reference row's (symbol, series) into an instrument id. Rows that cannot be
 *       normalized are excluded from the join and counted.</li>
 *   <li>Full outer join on (intervalStart, instrumentId); the reference trade date joins at
 *       midnight, which is where daily computed bars start. Rows present on one side only are
 *       kept with an empty other side.</li>
 *   <li>Classify each joined row:
 *     <ul>
 *       <li>VOLUME: volumes differ. A value against an absent value is a mismatch, two absent
 *           values are not.</li>
 *       <li>HIGH: both highs present and the reference high is below the computed high.</li>
 *       <li>LOW: both lows present and the reference low is above the computed low.</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>The reference is treated as ground truth for "at least this high / at most this low", so only
 * computed extrema that exceed it are flagged. Duplicate keys on either side pair up as a cross
 * product, like a relational outer join.
 *
 * <p>The reconciler only reads its inputs; it never closes or mutates the collections it is given.
 */
@Component
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    /**
     * Reconciles one day's (or any period's) reference rows against computed rows.
     *
     * @param referenceRows bhavcopy rows
     * @param computedRows  bars computed from ticks for the same period
     * @return the mismatch report; tables with no rows are null
     */
    public MismatchReport reconcile(Collection<ReferenceBar> referenceRows, Collection<Bar> computedRows) {
        Map<BucketKey, JoinedGroup> joined = new TreeMap<>(BucketKey.BY_TIME_THEN_INSTRUMENT);

        int unmapped = 0;
        for (ReferenceBar reference : referenceRows) {
            try {
                BucketKey key = referenceKey(reference);
                joined.computeIfAbsent(key, k -> new JoinedGroup()).references.add(reference);
            } catch (IdentityNormalizationException e) {
                unmapped++;
                log.warn("Excluding reference row from reconciliation: {}", e.getMessage());
            }
        }
        for (Bar computed : computedRows) {
            BucketKey key = new BucketKey(computed.getInstrumentId(), computed.getIntervalStart());
            joined.computeIfAbsent(key, k -> new JoinedGroup()).computed.add(computed);
        }

        List<MismatchRow> volumeRows = new ArrayList<>();
        List<MismatchRow> highRows = new ArrayList<>();
        List<MismatchRow> lowRows = new ArrayList<>();

        for (Map.Entry<BucketKey, JoinedGroup> entry : joined.entrySet()) {
            BucketKey key = entry.getKey();
            for (JoinedRow row : entry.getValue().rows()) {
                Long referenceVolume = row.reference != null ? row.reference.getVolume() : null;
                Long computedVolume = row.computed != null ? row.computed.getVolume() : null;
                if (!Objects.equals(referenceVolume, computedVolume)) {
                    volumeRows.add(mismatch(key, referenceVolume, computedVolume));
                }

                Double referenceHigh = row.reference != null ? row.reference.getHigh() : null;
                Double computedHigh = row.computed != null ? row.computed.getHigh() : null;
                if (referenceHigh != null && computedHigh != null && referenceHigh < computedHigh) {
                    highRows.add(mismatch(key, referenceHigh, computedHigh));
                }

                Double referenceLow = row.reference != null ? row.reference.getLow() : null;
                Double computedLow = row.computed != null ? row.computed.getLow() : null;
                if (referenceLow != null && computedLow != null && referenceLow > computedLow) {
                    lowRows.add(mismatch(key, referenceLow, computedLow));
                }
            }
        }

        MismatchReport report = MismatchReport.builder()
                .rowCountDifference(referenceRows.size() - computedRows.size())
                .unmappedReferenceRows(unmapped)
                .volumeMismatch(tableOrNull(MismatchType.VOLUME, volumeRows))
                .highMismatch(tableOrNull(MismatchType.HIGH, highRows))
                .lowMismatch(tableOrNull(MismatchType.LOW, lowRows))
                .build();

        log.debug(
                "Reconciled {} reference rows against {} computed rows: volume={}, high={}, low={}, unmapped={}",
                referenceRows.size(),
                computedRows.size(),
                volumeRows.size(),
                highRows.size(),
                lowRows.size(),
                unmapped);
        return report;
    }

    private static BucketKey referenceKey(ReferenceBar reference) {
        String instrumentId = InstrumentIdentity.normalize(reference.getSymbol(), reference.getSeries());
        if (reference.getTradeDate() == null) {
            throw new IdentityNormalizationException(reference.getSymbol(), reference.getSeries(), "missing trade date");
        }
        return new BucketKey(instrumentId, reference.getTradeDate().atStartOfDay());
    }

    private static MismatchRow mismatch(BucketKey key, Number referenceValue, Number computedValue) {
        return new MismatchRow(key.intervalStart(), key.instrumentId(), referenceValue, computedValue);
    }

    private static MismatchTable tableOrNull(MismatchType type, List<MismatchRow> rows) {
        return rows.isEmpty() ? null : MismatchTable.of(type, rows);
    }

    private static final class JoinedGroup {
        private final List<ReferenceBar> references = new ArrayList<>(1);
        private final List<Bar> computed = new ArrayList<>(1);

        List<JoinedRow> rows() {
            List<JoinedRow> rows = new ArrayList<>();
            if (references.isEmpty()) {
                computed.forEach(bar -> rows.add(new JoinedRow(null, bar)));
            } else if (computed.isEmpty()) {
                references.forEach(reference -> rows.add(new JoinedRow(reference, null)));
            } else {
                for (ReferenceBar reference : references) {
                    for (Bar bar : computed) {
                        rows.add(new JoinedRow(reference, bar));
                    }
                }
            }
            return rows;
        }
    }

    private record JoinedRow(ReferenceBar reference, Bar computed) {}
}
