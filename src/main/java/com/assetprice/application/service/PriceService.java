package com.assetprice.application.service;

import com.assetprice.domain.exception.Errors;
import com.assetprice.domain.exception.PriceUnavailableException;
import com.assetprice.domain.exception.ServiceException;
import com.assetprice.domain.model.AssetKind;
import com.assetprice.domain.model.PriceQuery;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.domain.port.PriceSourceAdapter;
import com.assetprice.infrastructure.cache.PriceCache;
import com.assetprice.infrastructure.config.PriceConfig;
import io.quarkus.arc.All;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Single entry point for current prices.
 * Serves from the cache while an entry is fresh, otherwise routes to the one adapter registered for the kind,
 * retrying only while the source is unreachable.
 */
@ApplicationScoped
@Slf4j
public class PriceService {

    private final Map<AssetKind, PriceSourceAdapter> adapters;
    private final PriceCache priceCache;
    private final PriceConfig config;

    public PriceService(@All List<PriceSourceAdapter> adapters, PriceCache priceCache, PriceConfig config) {
        this.adapters = index(adapters);
        this.priceCache = priceCache;
        this.config = config;
    }

    /**
     * Gets the current price of an asset
     * @param kind Asset kind
     * @param identifier Ticker, code or name as understood by the kind's source
     * @return Quote, or a failed Uni with {@link PriceUnavailableException}
     */
    public Uni<PriceQuote> getPrice(AssetKind kind, String identifier) {
        PriceQuery query;
        try {
            query = PriceQuery.of(kind, identifier);
        } catch (IllegalArgumentException | NullPointerException e) {
            return Uni.createFrom().failure(new ServiceException(Errors.Price.INVALID_INPUT, e.getMessage(), e));
        }
        return getPrice(query);
    }

    public Uni<PriceQuote> getPrice(PriceQuery query) {
        Optional<PriceQuote> cached = priceCache.get(query);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", query);
            return Uni.createFrom().item(cached.get());
        }

        PriceSourceAdapter adapter = adapters.get(query.kind());
        if (adapter == null) {
            log.warn("No price source for {}", query);
            return Uni.createFrom().failure(new PriceUnavailableException(query,
                    new ServiceException(Errors.PriceSource.UNSUPPORTED_ASSET, "No price source for kind " + query.kind())));
        }

        log.debug("Cache miss for {}, fetching from source", query);

        Uni<PriceQuote> fetch = Uni.createFrom().deferred(() -> adapter.fetch(query.identifier()))
                .onItem().ifNull().failWith(() -> new ServiceException(Errors.PriceSource.PARSE_FAILURE,
                        "Price source returned no quote for " + query));

        int retries = config.retry().maxAttempts() - 1;
        if (retries > 0) {
            fetch = fetch
                    .onFailure(this::isUnreachable).invoke(throwable ->
                            log.warn("Price source unreachable for {}: {}", query, throwable.getMessage()))
                    .onFailure(this::isUnreachable).retry()
                    .withBackOff(config.retry().initialBackoff(), config.retry().maxBackoff())
                    .atMost(retries);
        }

        return fetch
                .onItem().invoke(quote -> priceCache.put(query, quote, ttlFor(query.kind())))
                .onFailure().transform(throwable -> new PriceUnavailableException(query, throwable))
                .onFailure().invoke(throwable -> log.debug("Price unavailable for {}: {}", query, throwable.getMessage()));
    }

    /**
     * Kinds with a registered price source
     */
    public Set<AssetKind> supportedKinds() {
        return Collections.unmodifiableSet(adapters.keySet());
    }

    Duration ttlFor(AssetKind kind) {
        PriceConfig.Ttl ttl = config.cache().ttl();
        return switch (kind) {
            case JP_STOCK -> ttl.jpStock();
            case US_STOCK -> ttl.usStock();
            case GOLD -> ttl.gold();
            case CRYPTO -> ttl.crypto();
            case FUND -> ttl.fund();
            case CASH, INSURANCE -> Duration.ZERO;
        };
    }

    private boolean isUnreachable(Throwable throwable) {
        return ServiceException.hasError(throwable, Errors.PriceSource.SOURCE_UNREACHABLE);
    }

    private static Map<AssetKind, PriceSourceAdapter> index(List<PriceSourceAdapter> adapters) {
        Map<AssetKind, PriceSourceAdapter> index = new EnumMap<>(AssetKind.class);
        for (PriceSourceAdapter adapter : adapters) {
            AssetKind kind = adapter.kind();
            if (kind.isManuallyValued()) {
                throw new IllegalStateException("Price source registered for manually valued kind " + kind);
            }
            PriceSourceAdapter previous = index.putIfAbsent(kind, adapter);
            if (previous != null) {
                throw new IllegalStateException("Two price sources registered for " + kind + ": "
                        + previous.getClass().getSimpleName() + " and " + adapter.getClass().getSimpleName());
            }
        }
        log.info("Price sources registered for {}", index.keySet());
        return index;
    }
}
