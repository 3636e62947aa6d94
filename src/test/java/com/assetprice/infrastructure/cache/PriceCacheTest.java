package com.assetprice.infrastructure.cache;

import com.assetprice.domain.model.AssetKind;
import com.assetprice.domain.model.Currency;
import com.assetprice.domain.model.PriceQuery;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PriceCacheTest {

    private static final PriceQuery BTC = PriceQuery.of(AssetKind.CRYPTO, "BTC");

    private MutableClock clock;
    private PriceCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-03T05:00:00Z"));
        cache = new PriceCache(clock, 100);
    }

    @Test
    void testGet_EmptyCache_Miss() {
        assertTrue(cache.get(BTC).isEmpty());
    }

    @Test
    void testGet_BeforeExpiry_Hit() {
        // Given
        PriceQuote quote = quote("9800000");
        cache.put(BTC, quote, Duration.ofMinutes(5));

        // When
        clock.advance(Duration.ofMinutes(5).minusMillis(1));

        // Then
        assertEquals(quote, cache.get(BTC).orElseThrow());
    }

    @Test
    void testGet_AtExpiry_Miss() {
        // Given
        cache.put(BTC, quote("9800000"), Duration.ofMinutes(5));

        // When
        clock.advance(Duration.ofMinutes(5));

        // Then
        assertTrue(cache.get(BTC).isEmpty());
    }

    @Test
    void testPut_ReplacesExpiredEntry() {
        // Given
        cache.put(BTC, quote("9800000"), Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(10));

        // When
        PriceQuote fresh = quote("9900000");
        cache.put(BTC, fresh, Duration.ofMinutes(5));

        // Then
        assertEquals(fresh, cache.get(BTC).orElseThrow());
    }

    @Test
    void testPut_ReplacesLiveEntry_WithNewExpiry() {
        // Given
        cache.put(BTC, quote("9800000"), Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(4));
        PriceQuote fresh = quote("9900000");

        // When
        cache.put(BTC, fresh, Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(4));

        // Then
        assertEquals(fresh, cache.get(BTC).orElseThrow());
    }

    @Test
    void testPut_NonPositiveTtl_Ignored() {
        cache.put(BTC, quote("1"), Duration.ZERO);
        cache.put(BTC, quote("1"), Duration.ofSeconds(-1));
        cache.put(BTC, quote("1"), null);

        assertTrue(cache.get(BTC).isEmpty());
    }

    @Test
    void testEntries_AreKeyedByKindAndIdentifier() {
        // Given
        PriceQuery eth = PriceQuery.of(AssetKind.CRYPTO, "ETH");
        cache.put(BTC, quote("9800000"), Duration.ofMinutes(5));

        // Then
        assertTrue(cache.get(eth).isEmpty());
        assertTrue(cache.get(PriceQuery.of(AssetKind.CRYPTO, " BTC")).isPresent());
    }

    private PriceQuote quote(String price) {
        return new PriceQuote("BTC", new BigDecimal(price), null, clock.instant(), "minkabu-crypto", "ビットコイン", Currency.JPY);
    }
}
