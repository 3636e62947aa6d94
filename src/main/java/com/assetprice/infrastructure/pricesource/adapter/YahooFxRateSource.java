package com.assetprice.infrastructure.pricesource.adapter;

import com.assetprice.domain.exception.Errors;
import com.assetprice.domain.exception.ServiceException;
import com.assetprice.domain.port.FxRateSource;
import io.quarkus.cache.CacheResult;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.math.BigDecimal;

/**
 * USD/JPY rate from Yahoo Finance, cached in the "fx-rates" cache
 */
@ApplicationScoped
public class YahooFxRateSource implements FxRateSource {

    static final String USD_JPY_SYMBOL = "USDJPY=X";

    @Inject
    YahooChartQuoteReader quoteReader;

    @Override
    @CacheResult(cacheName = "fx-rates")
    public Uni<BigDecimal> fetchUsdJpyRate() {
        return quoteReader.readMeta(USD_JPY_SYMBOL, USD_JPY_SYMBOL)
                .map(meta -> {
                    if (meta.regularMarketPrice().signum() <= 0) {
                        throw new ServiceException(Errors.FxRate.RATE_NOT_FOUND,
                                "No positive USD/JPY rate in response: " + meta.regularMarketPrice());
                    }
                    return meta.regularMarketPrice();
                });
    }
}
