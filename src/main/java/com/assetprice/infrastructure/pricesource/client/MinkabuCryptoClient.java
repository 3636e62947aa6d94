package com.assetprice.infrastructure.pricesource.client;

import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the Minkabu crypto-asset pair pages
 */
@RegisterRestClient(configKey = "minkabu-crypto")
@ClientHeaderParam(name = "User-Agent", value = "${app.prices.user-agent}")
public interface MinkabuCryptoClient {

    /**
     * Get the page of a currency pair
     * @param pair Lower-case pair (e.g., "btc_jpy")
     * @return Raw HTML
     */
    @GET
    @Path("/pair/{pair}")
    @Produces(MediaType.TEXT_HTML)
    Uni<String> getPairPage(@PathParam("pair") String pair);
}
