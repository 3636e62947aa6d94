package com.assetprice.infrastructure.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration properties for price lookups
 */
@ConfigMapping(prefix = "app.prices")
public interface PriceConfig {

    /**
     * User-Agent sent to price sources
     */
    @WithDefault("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36")
    String userAgent();

    Cache cache();

    Retry retry();

    Fx fx();

    interface Cache {
        /**
         * Upper bound on cached quotes
         */
        @WithDefault("1000")
        int maximumSize();

        Ttl ttl();
    }

    /**
     * Time-to-live of a cached quote per asset kind
     */
    interface Ttl {
        @WithDefault("PT5M")
        Duration jpStock();

        @WithDefault("PT5M")
        Duration usStock();

        @WithDefault("PT1H")
        Duration gold();

        @WithDefault("PT5M")
        Duration crypto();

        @WithDefault("PT1H")
        Duration fund();
    }

    interface Retry {
        /**
         * Total attempts for a lookup whose source is unreachable, first attempt included
         */
        @WithDefault("2")
        int maxAttempts();

        @WithDefault("PT0.5S")
        Duration initialBackoff();

        @WithDefault("PT2S")
        Duration maxBackoff();
    }

    interface Fx {
        /**
         * Rate used when USD/JPY cannot be fetched
         */
        @WithDefault("150.0")
        BigDecimal usdJpyFallback();
    }
}
