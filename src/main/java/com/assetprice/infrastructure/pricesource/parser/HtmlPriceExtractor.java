package com.assetprice.infrastructure.pricesource.parser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;

/**
 * Locates price text in scraped pages. Sources change their markup, so each lookup tries
 * an ordered list of CSS selectors and keeps the first non-empty match.
 */
public final class HtmlPriceExtractor {

    private HtmlPriceExtractor() {
    }

    public static Document parse(String html) {
        return Jsoup.parse(html == null ? "" : html);
    }

    public static Optional<String> firstText(Document document, List<String> selectors) {
        for (String selector : selectors) {
            Element element = document.selectFirst(selector);
            if (element != null) {
                String text = element.text().trim();
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Shortens page text for log output
     */
    public static String excerpt(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String collapsed = text.replaceAll("\\s+", " ").trim();
        return collapsed.length() <= maxLength ? collapsed : collapsed.substring(0, maxLength) + "...";
    }
}
