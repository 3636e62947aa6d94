package com.assetprice.infrastructure.pricesource.adapter;

import com.assetprice.domain.exception.Errors;
import com.assetprice.domain.exception.ServiceException;
import com.fasterxml.jackson.core.JsonParseException;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class SourceFailuresTest {

    @Test
    void testClassify_NotFound_IsUnsupported() {
        ServiceException ex = SourceFailures.classify(
                YahooChartFixtures.httpError(Response.Status.NOT_FOUND), "yahoo-finance", "ZZZZ");

        assertEquals(Errors.PriceSource.UNSUPPORTED_ASSET, ex.getError());
    }

    @Test
    void testClassify_ServerErrorAndRateLimit_AreUnreachable() {
        assertEquals(Errors.PriceSource.SOURCE_UNREACHABLE, SourceFailures.classify(
                YahooChartFixtures.httpError(Response.Status.SERVICE_UNAVAILABLE), "yahoo-finance", "AAPL").getError());
        assertEquals(Errors.PriceSource.SOURCE_UNREACHABLE, SourceFailures.classify(
                YahooChartFixtures.httpError(Response.Status.TOO_MANY_REQUESTS), "yahoo-finance", "AAPL").getError());
    }

    @Test
    void testClassify_TransportErrors_AreUnreachable() {
        assertEquals(Errors.PriceSource.SOURCE_UNREACHABLE,
                SourceFailures.classify(new ConnectException("Connection refused"), "s", "id").getError());
        assertEquals(Errors.PriceSource.SOURCE_UNREACHABLE,
                SourceFailures.classify(new TimeoutException(), "s", "id").getError());
        assertEquals(Errors.PriceSource.SOURCE_UNREACHABLE,
                SourceFailures.classify(new ProcessingException(new IOException("reset")), "s", "id").getError());
    }

    @Test
    void testClassify_UndecodableBody_IsParseFailure() {
        ProcessingException failure = new ProcessingException(new JsonParseException(null, "Unexpected character '<'"));

        ServiceException ex = SourceFailures.classify(failure, "yahoo-finance", "AAPL");

        assertEquals(Errors.PriceSource.PARSE_FAILURE, ex.getError());
        assertSame(failure, ex.getCause());
    }

    @Test
    void testClassify_ServiceException_PassesThrough() {
        ServiceException original = new ServiceException(Errors.PriceSource.PARSE_FAILURE, "bad");

        assertSame(original, SourceFailures.classify(original, "s", "id"));
    }
}
