package com.assetprice.domain.model;

import java.util.Locale;

public enum Currency {
    JPY,
    USD;

    /**
     * Resolves an ISO code, returning the fallback for unknown or missing codes
     */
    public static Currency fromCode(String code, Currency fallback) {
        if (code == null || code.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
