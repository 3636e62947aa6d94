package com.assetprice.infrastructure.pricesource.adapter;

import com.assetprice.domain.model.AssetKind;
import com.assetprice.domain.model.Currency;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.domain.port.PriceSourceAdapter;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * US-listed equity quotes from Yahoo Finance
 */
@ApplicationScoped
public class UsStockPriceAdapter implements PriceSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(UsStockPriceAdapter.class);
    private static final Pattern TICKER = Pattern.compile("[A-Z][A-Z0-9.\\-]{0,9}");

    @Inject
    YahooChartQuoteReader quoteReader;

    @Override
    public AssetKind kind() {
        return AssetKind.US_STOCK;
    }

    @Override
    public Uni<PriceQuote> fetch(String identifier) {
        String ticker = identifier == null ? "" : identifier.trim().toUpperCase(Locale.ROOT);
        if (!TICKER.matcher(ticker).matches()) {
            return Uni.createFrom().failure(SourceFailures.unsupported(YahooChartQuoteReader.SOURCE, identifier));
        }

        log.debug("Fetching current price for US stock: {}", ticker);

        return quoteReader.readQuote(ticker, identifier.trim(), Currency.USD)
                .onItem().invoke(quote ->
                        log.info("Retrieved price {} for US stock {}", quote.currentPrice(), ticker))
                .onFailure().invoke(throwable ->
                        log.debug("Error fetching price for US stock {}: {}", ticker, throwable.getMessage()));
    }
}
