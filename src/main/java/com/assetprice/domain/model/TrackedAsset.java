package com.assetprice.domain.model;

/**
 * A user's holding as enumerated by the storage collaborator
 */
public record TrackedAsset(long userAssetId, AssetKind kind, String identifier) {

    public PriceQuery toQuery() {
        return new PriceQuery(kind, identifier);
    }
}
