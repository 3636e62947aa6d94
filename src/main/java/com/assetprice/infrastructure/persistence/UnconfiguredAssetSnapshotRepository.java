package com.assetprice.infrastructure.persistence;

import com.assetprice.domain.exception.Errors;
import com.assetprice.domain.exception.ServiceException;
import com.assetprice.domain.model.SnapshotRecord;
import com.assetprice.domain.model.TrackedAsset;
import com.assetprice.domain.port.AssetSnapshotRepository;
import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Repository used when the host application provides no storage: tracks nothing and rejects writes
 */
@DefaultBean
@ApplicationScoped
@Slf4j
public class UnconfiguredAssetSnapshotRepository implements AssetSnapshotRepository {

    @Override
    public Uni<List<TrackedAsset>> listTrackedAssets() {
        log.warn("No asset snapshot storage configured, no assets are tracked");
        return Uni.createFrom().item(List.of());
    }

    @Override
    public Uni<Void> writeSnapshot(SnapshotRecord record) {
        return Uni.createFrom().failure(new ServiceException(Errors.Snapshot.STORAGE_ERROR,
                "No asset snapshot storage configured, cannot write record for asset " + record.userAssetId()));
    }
}
