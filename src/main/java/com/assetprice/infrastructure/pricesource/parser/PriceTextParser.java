package com.assetprice.infrastructure.pricesource.parser;

import java.math.BigDecimal;
import java.text.Normalizer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts numbers from scraped price text such as "¥9,812,345", "1,234円", "US$ 175.50" or "+1.25%".
 * Never throws: text without a usable number yields {@link ParseResult.Failed}.
 */
public final class PriceTextParser {

    private static final Pattern AMOUNT = Pattern.compile(
            "([+\\-−]?)\\s*(?:US\\$|[¥$])?\\s*(\\d{1,3}(?:,\\d{3})+|\\d+)(\\.\\d+)?");
    private static final Pattern PERCENT = Pattern.compile(
            "([+\\-−]?)\\s*(?<![\\d,.])(\\d{1,3}(?:,\\d{3})+|\\d+)(\\.\\d+)?\\s*%");
    private static final Pattern DANGLING_GROUP = Pattern.compile(",?\\d");

    private PriceTextParser() {
    }

    /**
     * Parses the first currency-formatted amount in the text, keeping its sign
     */
    public static ParseResult parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ParseResult.Failed("empty text", raw);
        }
        String text = normalize(raw);
        Matcher matcher = AMOUNT.matcher(text);
        if (!matcher.find()) {
            return new ParseResult.Failed("no amount found", raw);
        }
        if (continuesWithGroup(text, matcher.end())) {
            return new ParseResult.Failed("malformed thousands grouping", raw);
        }
        String digits = matcher.group(2).replace(",", "");
        String fraction = matcher.group(3) == null ? "" : matcher.group(3);
        return toDecimal(matcher.group(1), digits + fraction, raw);
    }

    /**
     * Parses the first signed percentage in the text, e.g. "-0.52%" gives -0.52
     */
    public static ParseResult parsePercent(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ParseResult.Failed("empty text", raw);
        }
        Matcher matcher = PERCENT.matcher(normalize(raw));
        if (!matcher.find()) {
            return new ParseResult.Failed("no percentage found", raw);
        }
        String digits = matcher.group(2).replace(",", "");
        String fraction = matcher.group(3) == null ? "" : matcher.group(3);
        return toDecimal(matcher.group(1), digits + fraction, raw);
    }

    // NFKC folds full-width digits, separators, ¥ and % into their ASCII forms
    private static String normalize(String raw) {
        return Normalizer.normalize(raw, Normalizer.Form.NFKC).trim();
    }

    private static boolean continuesWithGroup(String text, int end) {
        return DANGLING_GROUP.matcher(text).region(end, text.length()).lookingAt();
    }

    private static ParseResult toDecimal(String sign, String number, String raw) {
        try {
            BigDecimal value = new BigDecimal(number);
            return new ParseResult.Parsed(sign.isEmpty() || "+".equals(sign) ? value : value.negate());
        } catch (NumberFormatException e) {
            return new ParseResult.Failed("not a number: " + number, raw);
        }
    }
}
