package com.lbg.markets.etl.watcher.dispatch;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * Structured enqueue through the Flower HTTP API.
 * Timeouts come from the {@code quarkus.rest-client.flower.*} settings.
 */
public class FlowerTaskQueueClient implements TaskQueueClient {

    private static final Logger LOG = Logger.getLogger(FlowerTaskQueueClient.class);

    private final FlowerApi flower;
    private final String queue;

    public FlowerTaskQueueClient(FlowerApi flower, String queue) {
        this.flower = flower;
        this.queue = queue;
    }

    @Override
    public String enqueue(String taskName, List<Object> args, Map<String, Object> kwargs, String taskId)
            throws DispatchException {
        FlowerApi.AsyncApplyResponse response;
        try {
            response = flower.asyncApply(taskName, new FlowerApi.AsyncApplyRequest(args, kwargs, taskId, queue));
        } catch (WebApplicationException e) {
            throw new DispatchException("Flower rejected task " + taskName + " with HTTP "
                    + e.getResponse().getStatus(), e);
        } catch (ProcessingException e) {
            throw new DispatchException("Flower unreachable: " + e.getMessage(), e);
        }

        if (response == null || response.taskId() == null) {
            throw new DispatchException("Flower returned no task id for " + taskName);
        }
        LOG.debugf("Flower accepted %s as %s (state %s)", taskName, response.taskId(), response.state());
        return response.taskId();
    }
}
