package com.assetprice.domain.model;

import java.util.Objects;

/**
 * Identity of a price lookup, used as cache key
 */
public record PriceQuery(AssetKind kind, String identifier) {

    public PriceQuery {
        Objects.requireNonNull(kind, "kind");
        if (identifier == null || identifier.trim().isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        identifier = identifier.trim();
    }

    public static PriceQuery of(AssetKind kind, String identifier) {
        return new PriceQuery(kind, identifier);
    }

    @Override
    public String toString() {
        return kind + ":" + identifier;
    }
}
