package com.lbg.markets.etl.watcher.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;
import java.util.Map;

/**
 * Celery Flower task API. Flower serializes the message for the broker, so callers only deal in
 * task names and arguments.
 */
@RegisterRestClient(configKey = "flower")
@Path("/api/task")
public interface FlowerApi {

    @POST
    @Path("/async-apply/{taskName}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    AsyncApplyResponse asyncApply(@PathParam("taskName") String taskName, AsyncApplyRequest request);

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AsyncApplyRequest(
            @JsonProperty("args") List<Object> args,
            @JsonProperty("kwargs") Map<String, Object> kwargs,
            @JsonProperty("task_id") String taskId,
            @JsonProperty("queue") String queue
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AsyncApplyResponse(
            @JsonProperty("task-id") String taskId,
            @JsonProperty("state") String state
    ) {
    }
}
