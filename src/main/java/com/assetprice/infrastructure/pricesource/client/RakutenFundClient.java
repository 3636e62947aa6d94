package com.assetprice.infrastructure.pricesource.client;

import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the Rakuten Securities fund detail pages
 */
@RegisterRestClient(configKey = "rakuten-fund")
@ClientHeaderParam(name = "User-Agent", value = "${app.prices.user-agent}")
public interface RakutenFundClient {

    /**
     * Get the detail page of a fund
     * @param fundId Brokerage fund ID (e.g., "03311187")
     * @return Raw HTML
     */
    @GET
    @Path("/web/fund/detail/")
    @Produces(MediaType.TEXT_HTML)
    Uni<String> getFundDetailPage(@QueryParam("ID") String fundId);
}
