package com.assetprice.application.service;

import com.assetprice.domain.port.FxRateSource;
import com.assetprice.infrastructure.config.PriceConfig;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * USD/JPY conversion rate with a configured fallback
 */
@ApplicationScoped
@Slf4j
public class FxRateService {

    private final FxRateSource fxRateSource;
    private final PriceConfig config;

    public FxRateService(FxRateSource fxRateSource, PriceConfig config) {
        this.fxRateSource = fxRateSource;
        this.config = config;
    }

    /**
     * Gets the USD/JPY rate, or the fallback rate when the source fails or has no positive rate
     */
    public Uni<BigDecimal> getUsdJpyRate() {
        return Uni.createFrom().deferred(fxRateSource::fetchUsdJpyRate)
                .map(rate -> rate != null && rate.signum() > 0 ? rate : fallback("no positive rate"))
                .onFailure().recoverWithItem(throwable -> fallback(throwable.getMessage()));
    }

    private BigDecimal fallback(String reason) {
        BigDecimal fallback = config.fx().usdJpyFallback();
        log.warn("Using fallback USD/JPY rate {}: {}", fallback, reason);
        return fallback;
    }
}
