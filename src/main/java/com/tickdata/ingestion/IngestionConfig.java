package com.tickdata.ingestion;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the daily archive readers.
 *
 * <p>Binds to the {@code tickdata.ingestion.*} prefix in application.properties.
 */
@Configuration
@ConfigurationProperties(prefix = "tickdata.ingestion")
@Getter
@Setter
public class IngestionConfig {

    /** Directory holding STOCK_TICK_ddMMyyyy.zip tick-by-tick archives. */
    private String tickDirectory = "data/tbt";

    /** Directory holding EODSNAPSHOT_ddMMMyyyybhav.csv.zip end-of-day snapshots. */
    private String bhavcopyDirectory = "data/bhavcopy";

    /** Exchange suffix stripped from tickers in the tick archive. */
    private String tickerSuffix = ".NSE";
}
