package com.assetprice.domain.port;

import io.smallrye.mutiny.Uni;

import java.math.BigDecimal;

/**
 * Port for currency exchange rates
 */
public interface FxRateSource {

    /**
     * Gets the current USD/JPY rate (yen per dollar)
     */
    Uni<BigDecimal> fetchUsdJpyRate();
}
