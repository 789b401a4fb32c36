package com.tickdata.timeseries;

import com.tickdata.domain.enums.MalformedTickPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for tick aggregation.
 *
 * <p>Binds to the {@code tickdata.aggregation.*} prefix in application.properties.
 */
@Configuration
@ConfigurationProperties(prefix = "tickdata.aggregation")
@Getter
@Setter
public class AggregationConfig {

    /** DROP_ROW keeps serving the rest of the data, STRICT fails the request on the first bad tick. */
    private MalformedTickPolicy malformedTickPolicy = MalformedTickPolicy.DROP_ROW;

    /** Bucket width of the computed bars compared against the bhavcopy. */
    private int endOfDayFrequencySeconds = 86_400;

    public boolean isStrict() {
        return malformedTickPolicy == MalformedTickPolicy.STRICT;
    }
}
