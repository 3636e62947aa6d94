package com.assetprice.infrastructure.pricesource.parser;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of extracting a number from scraped text
 */
public sealed interface ParseResult {

    record Parsed(BigDecimal value) implements ParseResult {}

    record Failed(String reason, String rawText) implements ParseResult {}

    default boolean isParsed() {
        return this instanceof Parsed;
    }

    default Optional<BigDecimal> toOptional() {
        return this instanceof Parsed parsed ? Optional.of(parsed.value()) : Optional.empty();
    }

    default <X extends Throwable> BigDecimal orElseThrow(Function<Failed, X> failure) throws X {
        if (this instanceof Parsed parsed) {
            return parsed.value();
        }
        throw failure.apply((Failed) this);
    }
}
