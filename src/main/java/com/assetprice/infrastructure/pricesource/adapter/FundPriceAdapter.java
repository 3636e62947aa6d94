package com.assetprice.infrastructure.pricesource.adapter;

import com.assetprice.domain.model.AssetKind;
import com.assetprice.domain.model.Currency;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.domain.port.PriceSourceAdapter;
import com.assetprice.infrastructure.pricesource.client.RakutenFundClient;
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
import java.util.Locale;
import java.util.Map;

/**
 * Net asset value of a mutual fund scraped from the Rakuten Securities fund page
 */
@ApplicationScoped
public class FundPriceAdapter implements PriceSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(FundPriceAdapter.class);
    static final String SOURCE = "rakuten-sec";

    // Keys are upper-cased identifiers; "オルカン" is the common name of the all-country fund
    static final Map<String, String> FUND_IDS = Map.of(
            "S&P500", "2558",
            "ALL-COUNTRY", "03311187",
            "オルカン", "03311187",
            "FANG+", "03312187"
    );
    static final List<String> NAV_SELECTORS = List.of("span.value", "dd.fund-detail-nav", "td.fund-nav");
    static final List<String> CHANGE_SELECTORS = List.of("span.change", "dd.fund-detail-change", "td.fund-change");

    @Inject
    @RestClient
    RakutenFundClient rakutenFundClient;

    @Inject
    Clock clock;

    @Override
    public AssetKind kind() {
        return AssetKind.FUND;
    }

    @Override
    public Uni<PriceQuote> fetch(String identifier) {
        String name = identifier == null ? "" : identifier.trim();
        String fundId = FUND_IDS.get(name.toUpperCase(Locale.ROOT));
        if (fundId == null) {
            log.debug("Unsupported fund: {}", identifier);
            return Uni.createFrom().failure(SourceFailures.unsupported(SOURCE, identifier));
        }

        log.debug("Fetching net asset value for fund {} (ID {})", name, fundId);

        return Uni.createFrom().deferred(() -> rakutenFundClient.getFundDetailPage(fundId))
                .onFailure().transform(failure -> SourceFailures.classify(failure, SOURCE, name))
                .map(html -> toQuote(name, html))
                .onItem().invoke(quote ->
                        log.info("Retrieved net asset value {} for fund {}", quote.currentPrice(), name))
                .onFailure().invoke(throwable ->
                        log.debug("Error fetching net asset value for fund {}: {}", name, throwable.getMessage()));
    }

    private PriceQuote toQuote(String name, String html) {
        Document document = HtmlPriceExtractor.parse(html);
        String navText = HtmlPriceExtractor.firstText(document, NAV_SELECTORS)
                .orElseThrow(() -> SourceFailures.parseFailure(SOURCE, name, "net asset value not found", html));
        BigDecimal nav = PriceTextParser.parseAmount(navText)
                .orElseThrow(failed -> SourceFailures.parseFailure(SOURCE, name, failed.reason(), failed.rawText()));
        if (nav.signum() <= 0) {
            throw SourceFailures.parseFailure(SOURCE, name, "non-positive net asset value", navText);
        }

        // Day change is reported as a signed yen amount
        BigDecimal previousClose = HtmlPriceExtractor.firstText(document, CHANGE_SELECTORS)
                .flatMap(changeText -> PriceTextParser.parseAmount(changeText).toOptional())
                .map(nav::subtract)
                .filter(value -> value.signum() > 0)
                .orElse(null);

        return new PriceQuote(name, nav, previousClose, clock.instant(), SOURCE, name, Currency.JPY);
    }
}
