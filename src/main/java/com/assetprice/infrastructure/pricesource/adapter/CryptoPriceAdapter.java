package com.assetprice.infrastructure.pricesource.adapter;

import com.assetprice.domain.model.AssetKind;
import com.assetprice.domain.model.Currency;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.domain.port.PriceSourceAdapter;
import com.assetprice.infrastructure.pricesource.client.MinkabuCryptoClient;
import com.assetprice.infrastructure.pricesource.parser.HtmlPriceExtractor;
import com.assetprice.infrastructure.pricesource.parser.PriceTextParser;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Yen price of a crypto asset scraped from Minkabu. Only a fixed set of coins is supported.
 */
@ApplicationScoped
public class CryptoPriceAdapter implements PriceSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(CryptoPriceAdapter.class);
    static final String SOURCE = "minkabu-crypto";
    static final Map<String, String> COIN_NAMES = Map.of(
            "BTC", "ビットコイン",
            "ETH", "イーサリアム",
            "XRP", "リップル",
            "DOGE", "ドージコイン"
    );
    static final List<String> PRICE_SELECTORS = List.of("div.md_price", "span.price", "div.pairPrice");
    static final List<String> CHANGE_SELECTORS = List.of("div.md_change", "span.change", "div.pairChange");

    @Inject
    @RestClient
    MinkabuCryptoClient minkabuCryptoClient;

    @Inject
    Clock clock;

    @Override
    public AssetKind kind() {
        return AssetKind.CRYPTO;
    }

    @Override
    public Uni<PriceQuote> fetch(String identifier) {
        String symbol = identifier == null ? "" : identifier.trim().toUpperCase(Locale.ROOT);
        if (!COIN_NAMES.containsKey(symbol)) {
            log.debug("Unsupported crypto symbol: {}", identifier);
            return Uni.createFrom().failure(SourceFailures.unsupported(SOURCE, identifier));
        }

        String pair = symbol.toLowerCase(Locale.ROOT) + "_jpy";
        log.debug("Fetching crypto price for pair: {}", pair);

        return Uni.createFrom().deferred(() -> minkabuCryptoClient.getPairPage(pair))
                .onFailure().transform(failure -> SourceFailures.classify(failure, SOURCE, symbol))
                .map(html -> toQuote(symbol, html))
                .onItem().invoke(quote ->
                        log.info("Retrieved price {} for crypto {}", quote.currentPrice(), symbol))
                .onFailure().invoke(throwable ->
                        log.debug("Error fetching price for crypto {}: {}", symbol, throwable.getMessage()));
    }

    private PriceQuote toQuote(String symbol, String html) {
        Document document = HtmlPriceExtractor.parse(html);
        String priceText = HtmlPriceExtractor.firstText(document, PRICE_SELECTORS)
                .orElseThrow(() -> SourceFailures.parseFailure(SOURCE, symbol, "price element not found", html));
        BigDecimal price = PriceTextParser.parseAmount(priceText)
                .orElseThrow(failed -> SourceFailures.parseFailure(SOURCE, symbol, failed.reason(), failed.rawText()));
        if (price.signum() < 0) {
            throw SourceFailures.parseFailure(SOURCE, symbol, "negative price", priceText);
        }

        BigDecimal previousClose = HtmlPriceExtractor.firstText(document, CHANGE_SELECTORS)
                .flatMap(changeText -> PriceTextParser.parsePercent(changeText).toOptional())
                .map(percent -> previousCloseFrom(price, percent))
                .orElse(null);

        return new PriceQuote(symbol, price, previousClose, clock.instant(), SOURCE, COIN_NAMES.get(symbol), Currency.JPY);
    }

    /**
     * Reverses a percent change: previous = current / (1 + percent / 100)
     */
    static BigDecimal previousCloseFrom(BigDecimal current, BigDecimal percent) {
        BigDecimal factor = BigDecimal.ONE.add(percent.movePointLeft(2));
        if (factor.signum() <= 0) {
            return null;
        }
        return current.divide(factor, 2, RoundingMode.HALF_UP);
    }
}
