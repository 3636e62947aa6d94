package com.assetprice.domain.model;

import java.time.Instant;

public record CacheEntry(PriceQuery query, PriceQuote quote, Instant expiresAt) {

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
