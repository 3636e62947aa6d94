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
 * Tokyo Stock Exchange quotes, looked up as "&lt;code&gt;.T" on Yahoo Finance
 */
@ApplicationScoped
public class JapanStockPriceAdapter implements PriceSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(JapanStockPriceAdapter.class);
    private static final Pattern SECURITIES_CODE = Pattern.compile("\\d{3}[0-9A-Z]");
    private static final String TOKYO_SUFFIX = ".T";

    @Inject
    YahooChartQuoteReader quoteReader;

    @Override
    public AssetKind kind() {
        return AssetKind.JP_STOCK;
    }

    @Override
    public Uni<PriceQuote> fetch(String identifier) {
        String code = identifier == null ? "" : identifier.trim().toUpperCase(Locale.ROOT);
        if (code.endsWith(TOKYO_SUFFIX)) {
            code = code.substring(0, code.length() - TOKYO_SUFFIX.length());
        }
        if (!SECURITIES_CODE.matcher(code).matches()) {
            return Uni.createFrom().failure(SourceFailures.unsupported(YahooChartQuoteReader.SOURCE, identifier));
        }

        String securitiesCode = code;
        log.debug("Fetching current price for JP stock: {}", securitiesCode);

        return quoteReader.readQuote(securitiesCode + TOKYO_SUFFIX, identifier.trim(), Currency.JPY)
                .onItem().invoke(quote ->
                        log.info("Retrieved price {} for JP stock {}", quote.currentPrice(), securitiesCode))
                .onFailure().invoke(throwable ->
                        log.debug("Error fetching price for JP stock {}: {}", securitiesCode, throwable.getMessage()));
    }
}
