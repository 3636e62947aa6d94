package com.assetprice.infrastructure.keepalive;

import com.assetprice.infrastructure.config.KeepAliveConfig;
import io.quarkus.rest.client.reactive.QuarkusRestClientBuilder;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * Pings the public URL of this process so hosting platforms do not idle it
 */
@ApplicationScoped
public class KeepAlivePinger {

    private static final Logger log = LoggerFactory.getLogger(KeepAlivePinger.class);

    @Inject
    KeepAliveConfig config;

    KeepAliveClient client;

    /**
     * Sends one ping. Never fails: errors are logged and dropped.
     */
    public Uni<Void> ping() {
        if (config.url().filter(url -> !url.isBlank()).isEmpty()) {
            return Uni.createFrom().voidItem();
        }

        return Uni.createFrom().deferred(() -> client().ping())
                .ifNoItem().after(config.timeout()).fail()
                .onItem().invoke(body -> log.debug("Keep-alive ping answered: {}", body))
                .onFailure().invoke(throwable -> log.warn("Keep-alive ping to {} failed: {}",
                        config.url().orElse(""), throwable.getMessage()))
                .onFailure().recoverWithNull()
                .replaceWithVoid();
    }

    private synchronized KeepAliveClient client() {
        if (client == null) {
            long timeoutMillis = config.timeout().toMillis();
            client = QuarkusRestClientBuilder.newBuilder()
                    .baseUri(URI.create(config.url().orElseThrow().trim()))
                    .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                    .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                    .build(KeepAliveClient.class);
        }
        return client;
    }
}
