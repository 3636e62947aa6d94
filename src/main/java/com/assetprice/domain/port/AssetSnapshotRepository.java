package com.assetprice.domain.port;

import com.assetprice.domain.model.SnapshotRecord;
import com.assetprice.domain.model.TrackedAsset;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Storage collaborator owning tracked assets and snapshot history
 */
public interface AssetSnapshotRepository {

    Uni<List<TrackedAsset>> listTrackedAssets();

    Uni<Void> writeSnapshot(SnapshotRecord record);
}
