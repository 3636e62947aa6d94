package com.assetprice.infrastructure.pricesource.adapter;

import com.assetprice.domain.exception.Errors;
import com.assetprice.domain.exception.ServiceException;
import com.assetprice.domain.model.AssetKind;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.infrastructure.pricesource.client.MinkabuCryptoClient;
import com.assetprice.support.LogCapture;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CryptoPriceAdapterTest {

    private MinkabuCryptoClient minkabuCryptoClient;
    private CryptoPriceAdapter adapter;

    @BeforeEach
    void setUp() {
        minkabuCryptoClient = mock(MinkabuCryptoClient.class);
        adapter = new CryptoPriceAdapter();
        adapter.minkabuCryptoClient = minkabuCryptoClient;
        adapter.clock = Clock.fixed(Instant.parse("2024-06-03T01:00:00Z"), ZoneOffset.UTC);
    }

    @Test
    void testKind() {
        assertEquals(AssetKind.CRYPTO, adapter.kind());
    }

    @Test
    void testFetch_PriceWithoutChange_NoPreviousClose() {
        // Given
        when(minkabuCryptoClient.getPairPage("btc_jpy")).thenReturn(Uni.createFrom().item(
                "<html><body><div class=\"md_price\">9,800,000円</div></body></html>"));

        // When
        PriceQuote quote = adapter.fetch("btc")
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();

        // Then
        assertEquals("BTC", quote.identifier());
        assertEquals(new BigDecimal("9800000"), quote.currentPrice());
        assertNull(quote.previousClose());
        assertEquals("ビットコイン", quote.name());
    }

    @Test
    void testFetch_PercentChange_DerivesPreviousClose() {
        // Given
        when(minkabuCryptoClient.getPairPage("eth_jpy")).thenReturn(Uni.createFrom().item("""
                <html><body>
                  <span class="price">¥550,000</span>
                  <span class="change">+50,000 (+10.00%)</span>
                </body></html>
                """));

        // When
        PriceQuote quote = adapter.fetch("ETH")
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();

        // Then
        assertEquals(new BigDecimal("550000"), quote.currentPrice());
        assertEquals(new BigDecimal("500000.00"), quote.previousClose());
        assertEquals("イーサリアム", quote.name());
    }

    @ParameterizedTest
    @ValueSource(strings = {"LTC", "SOL", "bitcoin"})
    void testFetch_UnsupportedSymbol_FailsBeforeHttpCall(String symbol) {
        // When
        Throwable failure = adapter.fetch(symbol)
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertFailed()
                .getFailure();

        // Then
        assertInstanceOf(ServiceException.class, failure);
        assertEquals(Errors.PriceSource.UNSUPPORTED_ASSET, ((ServiceException) failure).getError());
        verifyNoInteractions(minkabuCryptoClient);
    }

    @Test
    void testFetch_Unsupported_NotLoggedAsWarning() {
        // When
        try (LogCapture logs = LogCapture.of(CryptoPriceAdapter.class)) {
            adapter.fetch("LTC")
                    .subscribe()
                    .withSubscriber(UniAssertSubscriber.create())
                    .assertFailed();

            // Then
            assertTrue(logs.atLeast(Level.WARNING).isEmpty());
        }
    }

    @Test
    void testFetch_NoPriceElement_ParseFailure() {
        // Given
        when(minkabuCryptoClient.getPairPage("xrp_jpy")).thenReturn(Uni.createFrom().item("<html><body></body></html>"));

        // When
        Throwable failure = adapter.fetch("XRP")
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertFailed()
                .getFailure();

        // Then
        assertEquals(Errors.PriceSource.PARSE_FAILURE, ((ServiceException) failure).getError());
    }

    @Test
    void testPreviousCloseFrom() {
        assertEquals(new BigDecimal("100.00"), CryptoPriceAdapter.previousCloseFrom(new BigDecimal("95"), new BigDecimal("-5")));
        assertNull(CryptoPriceAdapter.previousCloseFrom(BigDecimal.TEN, new BigDecimal("-100")));
    }
}
