package com.assetprice.domain.exception;

import com.assetprice.domain.model.AssetKind;
import com.assetprice.domain.model.PriceQuery;

/**
 * Terminal failure of a price lookup: the cache had no entry and the price source failed.
 * The failure of the last attempt is kept as the cause.
 */
public class PriceUnavailableException extends ServiceException {

    private final AssetKind kind;
    private final String identifier;

    public PriceUnavailableException(PriceQuery query, Throwable lastError) {
        super(Errors.Price.PRICE_UNAVAILABLE,
                "Price unavailable for " + query.kind() + " " + query.identifier() + ": " + describe(lastError),
                lastError);
        this.kind = query.kind();
        this.identifier = query.identifier();
    }

    public AssetKind getKind() {
        return kind;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Throwable getLastError() {
        return getCause();
    }

    /**
     * Error code of the last source failure, or null when it was not a {@link ServiceException}
     */
    public Error getLastErrorCode() {
        return getCause() instanceof ServiceException serviceException ? serviceException.getError() : null;
    }

    private static String describe(Throwable lastError) {
        if (lastError == null) {
            return "unknown error";
        }
        return lastError.getMessage() != null ? lastError.getMessage() : lastError.getClass().getSimpleName();
    }
}
