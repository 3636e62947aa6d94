package com.assetprice.infrastructure.cache;

import com.assetprice.domain.model.CacheEntry;
import com.assetprice.domain.model.PriceQuery;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.infrastructure.config.PriceConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Time-bounded memoization of quotes keyed by {@link PriceQuery}.
 * Each entry carries its own expiry; expired entries read as a miss and are replaced by the next put.
 */
@ApplicationScoped
public class PriceCache {

    private static final Logger log = LoggerFactory.getLogger(PriceCache.class);

    private final Clock clock;
    private final Cache<PriceQuery, CacheEntry> entries;

    @Inject
    public PriceCache(Clock clock, PriceConfig config) {
        this(clock, config.cache().maximumSize());
    }

    public PriceCache(Clock clock, int maximumSize) {
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Gets the cached quote while its entry has not expired
     */
    public Optional<PriceQuote> get(PriceQuery query) {
        CacheEntry entry = entries.getIfPresent(query);
        if (entry == null || !entry.isValidAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.quote());
    }

    /**
     * Stores a quote, replacing any previous entry for the same query
     */
    public void put(PriceQuery query, PriceQuote quote, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            log.debug("Not caching quote for {} with non-positive ttl {}", query, ttl);
            return;
        }
        entries.put(query, new CacheEntry(query, quote, clock.instant().plus(ttl)));
        log.debug("Cached quote for {} for {}", query, ttl);
    }

    private final class EntryExpiry implements Expiry<PriceQuery, CacheEntry> {

        @Override
        public long expireAfterCreate(PriceQuery key, CacheEntry value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(PriceQuery key, CacheEntry value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(PriceQuery key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry entry) {
            return Math.max(0L, Duration.between(clock.instant(), entry.expiresAt()).toNanos());
        }
    }
}
