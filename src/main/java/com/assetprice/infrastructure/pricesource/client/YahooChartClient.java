package com.assetprice.infrastructure.pricesource.client;

import com.assetprice.infrastructure.pricesource.dto.YahooChartResponse;
import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the Yahoo Finance chart API
 */
@RegisterRestClient(configKey = "yahoo-chart")
@ClientHeaderParam(name = "User-Agent", value = "${app.prices.user-agent}")
public interface YahooChartClient {

    /**
     * Get the latest session for a symbol
     * @param symbol Yahoo symbol (e.g., "7203.T", "AAPL", "USDJPY=X")
     * @param interval Bar interval (e.g., "1d")
     * @param range Range to return (e.g., "1d")
     * @return Chart response whose meta block holds the quote
     */
    @GET
    @Path("/v8/finance/chart/{symbol}")
    @Produces(MediaType.APPLICATION_JSON)
    Uni<YahooChartResponse> getChart(
        @PathParam("symbol") String symbol,
        @QueryParam("interval") String interval,
        @QueryParam("range") String range
    );
}
