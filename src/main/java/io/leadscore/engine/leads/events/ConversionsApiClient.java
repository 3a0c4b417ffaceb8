package io.leadscore.engine.leads.events;

import jakarta.ws.rs.*;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;

@Path("")
@RegisterRestClient(configKey = "conversion-events")
public interface ConversionsApiClient {

    @POST
    @Path("/{version}/{pixelId}/events")
    @Consumes(APPLICATION_JSON)
    @Produces(APPLICATION_JSON)
    Response sendEvents(@PathParam("version") String version,
                        @PathParam("pixelId") String pixelId,
                        @QueryParam("access_token") String accessToken,
                        ConversionEventPayload payload);
}
