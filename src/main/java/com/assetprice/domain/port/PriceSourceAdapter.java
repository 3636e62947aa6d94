package com.assetprice.domain.port;

import com.assetprice.domain.model.AssetKind;
import com.assetprice.domain.model.PriceQuote;
import io.smallrye.mutiny.Uni;

/**
 * Port for fetching the current price of one asset kind from one external source.
 * Implementations never retry and never swallow errors: failures are
 * {@link com.assetprice.domain.exception.ServiceException}s with a
 * {@link com.assetprice.domain.exception.Errors.PriceSource} code.
 */
public interface PriceSourceAdapter {

    /**
     * Asset kind served by this source
     */
    AssetKind kind();

    /**
     * Fetches the current price
     * @param identifier Ticker, code or symbol as registered by the user (e.g., "7203", "AAPL", "BTC")
     */
    Uni<PriceQuote> fetch(String identifier);
}
