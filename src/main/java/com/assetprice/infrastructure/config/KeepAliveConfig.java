package com.assetprice.infrastructure.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "app.keep-alive")
public interface KeepAliveConfig {
    /**
     * Public base URL of this process; keep-alive is disabled when absent
     */
    Optional<String> url();

    @WithDefault("PT10M")
    Duration interval();

    @WithDefault("PT5S")
    Duration timeout();
}
