package com.assetprice.infrastructure.pricesource.adapter;

import com.assetprice.domain.exception.Errors;
import com.assetprice.domain.exception.ServiceException;
import com.assetprice.infrastructure.pricesource.parser.HtmlPriceExtractor;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps source failures onto the {@link Errors.PriceSource} codes
 */
final class SourceFailures {

    private static final Logger log = LoggerFactory.getLogger(SourceFailures.class);
    private static final int RAW_TEXT_EXCERPT = 300;

    private SourceFailures() {
    }

    /**
     * Classifies a transport-level failure. HTTP 404 means the source does not know the identifier,
     * undecodable bodies are parse failures, everything else is treated as unreachable.
     */
    static ServiceException classify(Throwable failure, String source, String identifier) {
        if (failure instanceof ServiceException serviceException) {
            return serviceException;
        }
        if (failure instanceof WebApplicationException webException) {
            int status = webException.getResponse() == null ? 0 : webException.getResponse().getStatus();
            if (status == 404) {
                return new ServiceException(Errors.PriceSource.UNSUPPORTED_ASSET,
                        source + " has no price for " + identifier, failure);
            }
            return new ServiceException(Errors.PriceSource.SOURCE_UNREACHABLE,
                    source + " returned HTTP " + status + " for " + identifier, failure);
        }
        if (hasCause(failure, JsonProcessingException.class)) {
            log.warn("Undecodable response from {} for {}: {}", source, identifier, failure.getMessage());
            return new ServiceException(Errors.PriceSource.PARSE_FAILURE,
                    source + " response for " + identifier + " could not be decoded", failure);
        }
        return new ServiceException(Errors.PriceSource.SOURCE_UNREACHABLE,
                source + " unreachable for " + identifier + ": " + messageOf(failure), failure);
    }

    /**
     * Builds a parse failure, logging the offending text
     */
    static ServiceException parseFailure(String source, String identifier, String reason, String rawText) {
        log.warn("Unexpected response shape from {} for {}: {}. Raw text: {}",
                source, identifier, reason, HtmlPriceExtractor.excerpt(rawText, RAW_TEXT_EXCERPT));
        return new ServiceException(Errors.PriceSource.PARSE_FAILURE,
                source + " response for " + identifier + " could not be parsed: " + reason);
    }

    static ServiceException unsupported(String source, String identifier) {
        return new ServiceException(Errors.PriceSource.UNSUPPORTED_ASSET,
                source + " does not support identifier: " + identifier);
    }

    private static boolean hasCause(Throwable failure, Class<? extends Throwable> type) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
        }
        return false;
    }

    private static String messageOf(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}
