package com.assetprice.infrastructure.persistence;

import com.assetprice.domain.exception.Errors;
import com.assetprice.domain.exception.ServiceException;
import com.assetprice.domain.model.Currency;
import com.assetprice.domain.model.PriceQuote;
import com.assetprice.domain.model.SnapshotRecord;
import com.assetprice.domain.model.TrackedAsset;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UnconfiguredAssetSnapshotRepositoryTest {

    private final UnconfiguredAssetSnapshotRepository repository = new UnconfiguredAssetSnapshotRepository();

    @Test
    void testListTrackedAssets_Empty() {
        List<TrackedAsset> assets = repository.listTrackedAssets()
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();

        assertTrue(assets.isEmpty());
    }

    @Test
    void testWriteSnapshot_StorageError() {
        // Given
        Instant now = Instant.now();
        SnapshotRecord record = new SnapshotRecord(UUID.randomUUID(), 7L,
                new PriceQuote("AAPL", BigDecimal.ONE, null, now, "yahoo-finance", "Apple Inc.", Currency.USD), now);

        // When
        Throwable failure = repository.writeSnapshot(record)
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertFailed()
                .getFailure();

        // Then
        assertEquals(Errors.Snapshot.STORAGE_ERROR, ((ServiceException) failure).getError());
    }
}
