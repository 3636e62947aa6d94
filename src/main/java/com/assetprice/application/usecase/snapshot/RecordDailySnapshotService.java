package com.assetprice.application.usecase.snapshot;

import com.assetprice.application.service.PriceService;
import com.assetprice.domain.exception.Errors;
import com.assetprice.domain.exception.ServiceException;
import com.assetprice.domain.model.PriceQuery;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.domain.model.SnapshotRecord;
import com.assetprice.domain.model.TrackedAsset;
import com.assetprice.domain.port.AssetSnapshotRepository;
import com.assetprice.domain.usecase.RecordDailySnapshotUseCase;
import com.assetprice.infrastructure.config.SnapshotConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Service for recording the daily price snapshot of every tracked asset
 */
@ApplicationScoped
public class RecordDailySnapshotService implements RecordDailySnapshotUseCase {

    private static final Logger log = LoggerFactory.getLogger(RecordDailySnapshotService.class);

    static final String RECORDS_METRIC = "price.snapshot.records";
    static final String RUN_METRIC = "price.snapshot.run";

    private final AssetSnapshotRepository repository;
    private final PriceService priceService;
    private final SnapshotConfig config;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Counter writtenCounter;
    private final Counter failedCounter;
    private final Timer runTimer;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<LocalDate> lastCompletedRunDate = new AtomicReference<>();

    public RecordDailySnapshotService(AssetSnapshotRepository repository,
                                      PriceService priceService,
                                      SnapshotConfig config,
                                      Clock clock,
                                      MeterRegistry meterRegistry) {
        this.repository = repository;
        this.priceService = priceService;
        this.config = config;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.writtenCounter = Counter.builder(RECORDS_METRIC)
                .description("Snapshot records by outcome")
                .tag("outcome", "written")
                .register(meterRegistry);
        this.failedCounter = Counter.builder(RECORDS_METRIC)
                .description("Snapshot records by outcome")
                .tag("outcome", "failed")
                .register(meterRegistry);
        this.runTimer = Timer.builder(RUN_METRIC)
                .description("Duration of daily snapshot runs")
                .register(meterRegistry);
    }

    @Override
    public Uni<Result> execute(Command command) {
        return Uni.createFrom().deferred(() -> {
            if (!running.compareAndSet(false, true)) {
                log.info("Snapshot run already in progress, skipping trigger for {}", command.runDate());
                return Uni.createFrom().item(new Result.Skipped("Snapshot run already in progress"));
            }
            if (command.runDate().equals(lastCompletedRunDate.get())) {
                running.set(false);
                log.info("Snapshot already recorded for {}, skipping", command.runDate());
                return Uni.createFrom().item(new Result.Skipped("Snapshot already recorded for " + command.runDate()));
            }
            return runSnapshot(command.runDate());
        });
    }

    private Uni<Result> runSnapshot(LocalDate runDate) {
        UUID runId = UUID.randomUUID();
        Instant takenAt = clock.instant();
        Instant deadline = takenAt.plus(config.runTimeout());
        Timer.Sample sample = Timer.start(meterRegistry);

        log.info("Starting snapshot run: runId={}, runDate={}, takenAt={}", runId, runDate, takenAt);

        return beforeDeadline(deadline, "listing tracked assets", repository::listTrackedAssets)
                .onFailure().transform(throwable -> throwable instanceof ServiceException
                        ? throwable
                        : new ServiceException(Errors.Snapshot.STORAGE_ERROR, "Failed to list tracked assets", throwable))
                .flatMap(assets -> snapshot(runId, takenAt, deadline, assets))
                .map(tally -> {
                    lastCompletedRunDate.set(runDate);
                    writtenCounter.increment(tally.written());
                    failedCounter.increment(tally.failed());
                    log.info("Snapshot run finished: runId={}, written={}, failed={}",
                            runId, tally.written(), tally.failed());
                    return (Result) new Result.Completed(runId, takenAt, tally.written(), tally.failed());
                })
                .onFailure().invoke(throwable -> log.error("Snapshot run {} failed", runId, throwable))
                .onTermination().invoke(() -> {
                    sample.stop(runTimer);
                    running.set(false);
                });
    }

    private Uni<Tally> snapshot(UUID runId, Instant takenAt, Instant deadline, List<TrackedAsset> assets) {
        Map<PriceQuery, List<TrackedAsset>> holdersByQuery = new LinkedHashMap<>();
        int invalid = 0;
        for (TrackedAsset asset : assets == null ? List.<TrackedAsset>of() : assets) {
            if (asset.kind() == null || asset.kind().isManuallyValued()) {
                continue;
            }
            try {
                holdersByQuery.computeIfAbsent(asset.toQuery(), query -> new ArrayList<>()).add(asset);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping tracked asset {} with invalid identifier: {}", asset.userAssetId(), e.getMessage());
                invalid++;
            }
        }

        log.info("Snapshot run {}: {} distinct price lookups for {} tracked assets",
                runId, holdersByQuery.size(), assets == null ? 0 : assets.size());

        Tally initial = new Tally(0, invalid);
        if (holdersByQuery.isEmpty()) {
            return Uni.createFrom().item(initial);
        }

        return Multi.createFrom().iterable(holdersByQuery.entrySet())
                .onItem().transformToUni(entry -> snapshotQuery(runId, takenAt, deadline, entry.getKey(), entry.getValue()))
                .merge(Math.max(1, config.parallelism()))
                .collect().asList()
                .map(tallies -> tallies.stream().reduce(initial, Tally::plus));
    }

    private Uni<Tally> snapshotQuery(UUID runId, Instant takenAt, Instant deadline,
                                     PriceQuery query, List<TrackedAsset> holders) {
        return lookup(query, deadline)
                .flatMap(quote -> writeAll(runId, takenAt, deadline, quote, holders))
                .onFailure().recoverWithItem(throwable -> {
                    log.warn("Skipping {} tracked asset(s) for {}: {}", holders.size(), query, throwable.getMessage());
                    return new Tally(0, holders.size());
                });
    }

    private Uni<PriceQuote> lookup(PriceQuery query, Instant deadline) {
        return beforeDeadline(deadline, "looking up " + query, () -> priceService.getPrice(query));
    }

    /**
     * Bounds an operation by the time left until the run deadline; a pending operation fails with RUN_TIMEOUT
     */
    private <T> Uni<T> beforeDeadline(Instant deadline, String operation, Supplier<Uni<T>> action) {
        return Uni.createFrom().deferred(() -> {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return Uni.createFrom().failure(new ServiceException(Errors.Snapshot.RUN_TIMEOUT,
                        "Run timeout reached before " + operation));
            }
            return action.get()
                    .ifNoItem().after(remaining)
                    .failWith(() -> new ServiceException(Errors.Snapshot.RUN_TIMEOUT, "Run timeout reached " + operation));
        });
    }

    private Uni<Tally> writeAll(UUID runId, Instant takenAt, Instant deadline, PriceQuote quote, List<TrackedAsset> holders) {
        List<Uni<Boolean>> writes = holders.stream()
                .map(asset -> write(new SnapshotRecord(runId, asset.userAssetId(), quote, takenAt), deadline))
                .toList();
        return Uni.join().all(writes).andFailFast()
                .map(outcomes -> {
                    int written = (int) outcomes.stream().filter(Boolean::booleanValue).count();
                    return new Tally(written, outcomes.size() - written);
                });
    }

    private Uni<Boolean> write(SnapshotRecord record, Instant deadline) {
        return beforeDeadline(deadline, "writing snapshot record for asset " + record.userAssetId(),
                () -> repository.writeSnapshot(record))
                .replaceWith(Boolean.TRUE)
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Failed to write snapshot record for asset {} in run {}",
                            record.userAssetId(), record.runId(), throwable);
                    return Boolean.FALSE;
                });
    }

    private record Tally(int written, int failed) {
        Tally plus(Tally other) {
            return new Tally(written + other.written, failed + other.failed);
        }
    }
}
