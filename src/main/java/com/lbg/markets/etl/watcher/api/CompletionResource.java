package com.lbg.markets.etl.watcher.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.etl.watcher.domain.CompletionNotice;
import com.lbg.markets.etl.watcher.orchestration.CompletionListener;
import com.lbg.markets.etl.watcher.orchestration.CompletionListener.Outcome;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Callback endpoint workers post to when they finish a file.
 */
@Path("/processing_complete")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class CompletionResource {

    private static final Logger LOG = Logger.getLogger(CompletionResource.class);

    @Inject
    CompletionListener listener;

    @Inject
    ObjectMapper mapper;

    @POST
    public Response complete(String body) {
        CompletionNotice notice;
        try {
            notice = body == null || body.isBlank() ? null : mapper.readValue(body, CompletionNotice.class);
        } catch (JsonProcessingException e) {
            LOG.warnf("Malformed completion payload: %s", e.getOriginalMessage());
            return badRequest("Malformed completion payload");
        }
        if (notice == null) {
            LOG.warn("Empty completion payload");
            return badRequest("Empty completion payload");
        }

        Outcome outcome;
        try {
            outcome = listener.onCompletion(notice);
        } catch (IllegalArgumentException e) {
            LOG.warnf("Rejected completion payload: %s", e.getMessage());
            return badRequest(e.getMessage());
        }

        LOG.infof("Processing complete for %s: %s (%s)", notice.filename(), notice.status(), outcome);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Processing completion recorded");
        result.put("filename", notice.filename());
        result.put("status", notice.status());
        result.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
        return Response.ok(result).build();
    }

    private static Response badRequest(String error) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of("error", error))
                .build();
    }
}
