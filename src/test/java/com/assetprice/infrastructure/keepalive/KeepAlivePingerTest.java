package com.assetprice.infrastructure.keepalive;

import com.assetprice.infrastructure.config.KeepAliveConfig;
import com.assetprice.support.TestConfigs;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;

import static org.mockito.Mockito.*;

class KeepAlivePingerTest {

    private KeepAliveClient client;
    private KeepAlivePinger pinger;

    @BeforeEach
    void setUp() {
        client = mock(KeepAliveClient.class);
        pinger = new KeepAlivePinger();
        pinger.config = TestConfigs.keepAliveConfig("https://assets.example.com");
        pinger.client = client;
    }

    @Test
    void testPing_Success() {
        // Given
        when(client.ping()).thenReturn(Uni.createFrom().item("pong"));

        // When
        pinger.ping()
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertCompleted();

        // Then
        verify(client).ping();
    }

    @Test
    void testPing_Failure_Swallowed() {
        // Given
        when(client.ping()).thenReturn(Uni.createFrom().failure(new ConnectException("Connection refused")));

        // When / Then
        pinger.ping()
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertCompleted();
    }

    @Test
    void testPing_NoAnswer_TimesOutQuietly() {
        // Given
        KeepAliveConfig config = TestConfigs.keepAliveConfig("https://assets.example.com");
        when(config.timeout()).thenReturn(Duration.ofMillis(50));
        pinger.config = config;
        when(client.ping()).thenReturn(Uni.createFrom().nothing());

        // When / Then
        pinger.ping()
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .awaitItem(Duration.ofSeconds(5));
    }

    @Test
    void testPing_NoUrl_DoesNothing() {
        // Given
        pinger.config = TestConfigs.keepAliveConfig(null);

        // When
        pinger.ping()
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertCompleted();

        // Then
        verifyNoInteractions(client);
    }
}
