package com.assetprice.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized current price of one asset as reported by one source.
 * previousClose is null when the source does not expose it.
 */
public record PriceQuote(
        String identifier,
        BigDecimal currentPrice,
        BigDecimal previousClose,
        Instant fetchedAt,
        String source,
        String name,
        Currency currency
) {

    public PriceQuote {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(currentPrice, "currentPrice");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(currency, "currency");
        if (currentPrice.signum() < 0) {
            throw new IllegalArgumentException("Current price cannot be negative: " + currentPrice);
        }
        if (previousClose != null && previousClose.signum() < 0) {
            throw new IllegalArgumentException("Previous close cannot be negative: " + previousClose);
        }
        if (name == null || name.isBlank()) {
            name = identifier;
        }
    }

    public boolean hasPreviousClose() {
        return previousClose != null;
    }

    /**
     * Absolute change against the previous close
     */
    public Optional<BigDecimal> change() {
        if (previousClose == null) {
            return Optional.empty();
        }
        return Optional.of(currentPrice.subtract(previousClose));
    }

    /**
     * Change against the previous close in percent, two decimals
     */
    public Optional<BigDecimal> changePercent() {
        if (previousClose == null || previousClose.signum() == 0) {
            return Optional.empty();
        }
        return change().map(change -> change
                .multiply(BigDecimal.valueOf(100))
                .divide(previousClose, 2, RoundingMode.HALF_UP));
    }
}
