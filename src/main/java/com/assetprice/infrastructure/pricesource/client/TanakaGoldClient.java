package com.assetprice.infrastructure.pricesource.client;

import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the Tanaka Kikinzoku precious-metal price page
 */
@RegisterRestClient(configKey = "tanaka-gold")
@ClientHeaderParam(name = "User-Agent", value = "${app.prices.user-agent}")
public interface TanakaGoldClient {

    /**
     * Get the gold retail/buy-back price page
     * @return Raw HTML
     */
    @GET
    @Path("/commodity/souba/m-gold.php")
    @Produces(MediaType.TEXT_HTML)
    Uni<String> getGoldPricePage();
}
