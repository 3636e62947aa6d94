package com.assetprice.infrastructure.keepalive;

import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Client for this process's own ping endpoint. Built programmatically from the keep-alive URL.
 */
@Path("/ping")
public interface KeepAliveClient {

    @GET
    @Produces(MediaType.TEXT_PLAIN)
    Uni<String> ping();
}
