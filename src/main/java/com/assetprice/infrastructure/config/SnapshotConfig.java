package com.assetprice.infrastructure.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

@ConfigMapping(prefix = "app.snapshot")
public interface SnapshotConfig {
    /**
     * Local wall-clock time of the daily snapshot (HH:mm)
     */
    @WithDefault("23:58")
    String fireAt();

    /**
     * Time zone the fire time is expressed in
     */
    @WithDefault("Asia/Tokyo")
    String timeZone();

    /**
     * Number of concurrent price lookups during a run
     */
    @WithDefault("4")
    int parallelism();

    /**
     * Lookups not finished within this time are treated as failed for the run
     */
    @WithDefault("PT4M")
    Duration runTimeout();
}
