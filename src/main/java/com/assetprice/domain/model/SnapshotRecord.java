package com.assetprice.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Price of one tracked asset captured by a daily snapshot run.
 * All records of one run share runId and takenAt.
 */
public record SnapshotRecord(UUID runId, long userAssetId, PriceQuote quote, Instant takenAt) {

    public SnapshotRecord {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(quote, "quote");
        Objects.requireNonNull(takenAt, "takenAt");
    }
}
