package com.tickdata.oms;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the placed-order store.
 */
@Configuration
@ConfigurationProperties(prefix = "tickdata.orders")
@Getter
@Setter
public class OrderConfig {

    /** Maximum number of acknowledged orders retained; the oldest is evicted first. */
    private int capacity = 1000;
}
