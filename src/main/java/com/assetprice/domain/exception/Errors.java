package com.assetprice.domain.exception;

public interface Errors {

    interface Price {
        String errorCode = "01";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error PRICE_UNAVAILABLE = new Error(errorCode + "02");
    }

    interface PriceSource {
        String errorCode = "02";

        Error SOURCE_UNREACHABLE = new Error(errorCode + "01");
        Error PARSE_FAILURE = new Error(errorCode + "02");
        Error UNSUPPORTED_ASSET = new Error(errorCode + "03");
    }

    interface Snapshot {
        String errorCode = "03";

        Error STORAGE_ERROR = new Error(errorCode + "01");
        Error RUN_TIMEOUT = new Error(errorCode + "02");
    }

    interface FxRate {
        String errorCode = "04";

        Error RATE_NOT_FOUND = new Error(errorCode + "01");
    }

}
