package com.tickdata.reconciliation;

import com.tickdata.exception.IdentityNormalizationException;
import java.util.Locale;

/**
 * Derives canonical instrument ids from the bhavcopy's (symbol, series) pair.
 *
 * <p>Equity rows (series "EQ") use the bare symbol. Every other series is suffixed with the first
 * two letters of the upper-cased series code, which keeps e.g. futures apart from the equity
 * sharing their base symbol: ("TCS", "EQ") → "TCS", ("TCS", "FUTIDX") → "TCS.FU".
 */
public final class InstrumentIdentity {

    public static final String EQUITY_SERIES = "EQ";

    private InstrumentIdentity() {}

    /**
     * @throws IdentityNormalizationException if the symbol or the series is missing
     */
    public static String normalize(String symbol, String series) {
        if (symbol == null || symbol.isBlank()) {
            throw new IdentityNormalizationException(symbol, series, "missing symbol");
        }
        if (series == null || series.isBlank()) {
            throw new IdentityNormalizationException(symbol, series, "missing series");
        }
        String trimmedSymbol = symbol.trim();
        String trimmedSeries = series.trim();
        if (EQUITY_SERIES.equals(trimmedSeries)) {
            return trimmedSymbol;
        }
        String code = trimmedSeries.toUpperCase(Locale.ROOT);
        return trimmedSymbol + "." + code.substring(0, Math.min(2, code.length()));
    }
}
