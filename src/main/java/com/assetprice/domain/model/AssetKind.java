package com.assetprice.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Asset classes a user can hold. Cash and insurance are valued manually and never priced by a source.
 */
public enum AssetKind {
    JP_STOCK(false),
    US_STOCK(false),
    CASH(true),
    GOLD(false),
    CRYPTO(false),
    FUND(false),
    INSURANCE(true);

    private final boolean manuallyValued;

    AssetKind(boolean manuallyValued) {
        this.manuallyValued = manuallyValued;
    }

    public boolean isManuallyValued() {
        return manuallyValued;
    }

    /**
     * Kinds whose price comes from an external source
     */
    public static Set<AssetKind> fetchable() {
        EnumSet<AssetKind> kinds = EnumSet.noneOf(AssetKind.class);
        for (AssetKind kind : values()) {
            if (!kind.manuallyValued) {
                kinds.add(kind);
            }
        }
        return kinds;
    }
}
