package com.assetprice.domain.usecase;

import io.smallrye.mutiny.Uni;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Use case for capturing the daily portfolio-wide price snapshot
 */
public interface RecordDailySnapshotUseCase {

    /**
     * Run the snapshot for the given day, unless a run is in progress or the day is already recorded
     */
    Uni<Result> execute(Command command);

    /**
     * Result of a snapshot trigger
     */
    sealed interface Result {
        record Completed(UUID runId, Instant takenAt, int written, int failed) implements Result {}
        record Skipped(String reason) implements Result {}
    }

    /**
     * Command for a snapshot trigger
     */
    record Command(LocalDate runDate) {}
}
