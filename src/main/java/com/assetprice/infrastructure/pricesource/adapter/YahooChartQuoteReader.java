package com.assetprice.infrastructure.pricesource.adapter;

import com.assetprice.domain.model.Currency;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.infrastructure.pricesource.client.YahooChartClient;
import com.assetprice.infrastructure.pricesource.dto.YahooChartResponse;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Reads quotes from the Yahoo Finance chart endpoint, shared by the equity adapters and the FX source
 */
@ApplicationScoped
public class YahooChartQuoteReader {

    private static final Logger log = LoggerFactory.getLogger(YahooChartQuoteReader.class);
    static final String SOURCE = "yahoo-finance";
    private static final String INTERVAL = "1d";
    private static final String RANGE = "1d";

    @Inject
    @RestClient
    YahooChartClient yahooChartClient;

    @Inject
    Clock clock;

    /**
     * Gets the quote metadata of a symbol, failing when it carries no usable price
     * @param symbol Yahoo symbol
     * @param identifier Identifier as known to the caller, used in errors
     */
    public Uni<YahooChartResponse.Meta> readMeta(String symbol, String identifier) {
        log.debug("Fetching Yahoo chart for symbol: {}", symbol);

        return Uni.createFrom().deferred(() -> yahooChartClient.getChart(symbol, INTERVAL, RANGE))
                .onFailure().transform(failure -> SourceFailures.classify(failure, SOURCE, identifier))
                .map(response -> {
                    if (response == null) {
                        throw SourceFailures.parseFailure(SOURCE, identifier, "empty response", null);
                    }
                    if (response.isError()) {
                        YahooChartResponse.ErrorInfo error = response.chart() == null ? null : response.chart().error();
                        if (error != null && "Not Found".equalsIgnoreCase(error.code())) {
                            throw SourceFailures.unsupported(SOURCE, identifier);
                        }
                        throw SourceFailures.parseFailure(SOURCE, identifier, "error response", String.valueOf(response));
                    }
                    YahooChartResponse.Meta meta = response.firstMeta()
                            .orElseThrow(() -> SourceFailures.parseFailure(
                                    SOURCE, identifier, "no quote metadata", String.valueOf(response)));
                    if (meta.regularMarketPrice() == null || meta.regularMarketPrice().signum() < 0) {
                        throw SourceFailures.parseFailure(SOURCE, identifier, "no usable regularMarketPrice", String.valueOf(meta));
                    }
                    return meta;
                });
    }

    /**
     * Gets a normalized quote for a symbol
     * @param defaultCurrency Currency assumed when the response does not state one
     */
    public Uni<PriceQuote> readQuote(String symbol, String identifier, Currency defaultCurrency) {
        return readMeta(symbol, identifier)
                .map(meta -> new PriceQuote(
                        identifier,
                        meta.regularMarketPrice(),
                        positiveOrNull(meta.previousCloseOrNull()),
                        clock.instant(),
                        SOURCE,
                        meta.displayName(),
                        Currency.fromCode(meta.currency(), defaultCurrency)
                ));
    }

    private static BigDecimal positiveOrNull(BigDecimal value) {
        return value != null && value.signum() > 0 ? value : null;
    }
}
