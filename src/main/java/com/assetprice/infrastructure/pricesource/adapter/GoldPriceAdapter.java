package com.assetprice.infrastructure.pricesource.adapter;

import com.assetprice.domain.model.AssetKind;
import com.assetprice.domain.model.Currency;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.domain.port.PriceSourceAdapter;
import com.assetprice.infrastructure.pricesource.client.TanakaGoldClient;
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
import java.time.Clock;
import java.util.List;

/**
 * Per-gram gold retail price scraped from Tanaka Kikinzoku. The page has no previous close.
 */
@ApplicationScoped
public class GoldPriceAdapter implements PriceSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(GoldPriceAdapter.class);
    static final String SOURCE = "tanaka-kikinzoku";
    static final String DISPLAY_NAME = "金(Gold)";
    static final List<String> PRICE_SELECTORS = List.of(
            "table.table_main tr:nth-of-type(2) td:nth-of-type(3)",
            "#metal_price_sp td.retail_tax",
            "td.retail_tax"
    );

    @Inject
    @RestClient
    TanakaGoldClient tanakaGoldClient;

    @Inject
    Clock clock;

    @Override
    public AssetKind kind() {
        return AssetKind.GOLD;
    }

    @Override
    public Uni<PriceQuote> fetch(String identifier) {
        log.debug("Fetching gold retail price for: {}", identifier);

        return Uni.createFrom().deferred(() -> tanakaGoldClient.getGoldPricePage())
                .onFailure().transform(failure -> SourceFailures.classify(failure, SOURCE, identifier))
                .map(html -> toQuote(identifier, html))
                .onItem().invoke(quote ->
                        log.info("Retrieved gold price {} per gram", quote.currentPrice()))
                .onFailure().invoke(throwable ->
                        log.debug("Error fetching gold price: {}", throwable.getMessage()));
    }

    private PriceQuote toQuote(String identifier, String html) {
        Document document = HtmlPriceExtractor.parse(html);
        String priceText = HtmlPriceExtractor.firstText(document, PRICE_SELECTORS)
                .orElseThrow(() -> SourceFailures.parseFailure(SOURCE, identifier, "price cell not found", html));
        BigDecimal price = PriceTextParser.parseAmount(priceText)
                .orElseThrow(failed -> SourceFailures.parseFailure(SOURCE, identifier, failed.reason(), failed.rawText()));
        if (price.signum() <= 0) {
            throw SourceFailures.parseFailure(SOURCE, identifier, "non-positive price", priceText);
        }
        return new PriceQuote(identifier, price, null, clock.instant(), SOURCE, DISPLAY_NAME, Currency.JPY);
    }
}
