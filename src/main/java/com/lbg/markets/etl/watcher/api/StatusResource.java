package com.lbg.markets.etl.watcher.api;

import com.lbg.markets.etl.watcher.config.ConfigurationException;
import com.lbg.markets.etl.watcher.config.WatchConfig;
import com.lbg.markets.etl.watcher.dispatch.DispatchLog;
import com.lbg.markets.etl.watcher.domain.DispatchRecord;
import com.lbg.markets.etl.watcher.orchestration.ConfigReloader;
import com.lbg.markets.etl.watcher.orchestration.WatcherHealth;
import com.lbg.markets.etl.watcher.orchestration.WatcherStatus;
import com.lbg.markets.etl.watcher.orchestration.WatcherStatusService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class StatusResource {

    private static final Logger LOG = Logger.getLogger(StatusResource.class);
    static final int HISTORY_LIMIT = 50;

    @Inject
    WatcherStatusService statusService;

    @Inject
    DispatchLog dispatchLog;

    @Inject
    ConfigReloader reloader;

    @GET
    @Path("status")
    public WatcherStatus status() {
        return statusService.status();
    }

    @GET
    @Path("health")
    public Response health() {
        try {
            WatcherHealth health = statusService.health();
            Response.Status code = health.isHealthy() ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE;
            return Response.status(code).entity(health).build();
        } catch (IOException e) {
            LOG.errorf("Health check failed: %s", e.getMessage());
            return Response.serverError()
                    .entity(Map.of("status", WatcherHealth.UNHEALTHY, "error", String.valueOf(e.getMessage()),
                            "timestamp", Instant.now().toString()))
                    .build();
        }
    }

    @GET
    @Path("processing_history")
    public List<DispatchRecord> history() {
        return dispatchLog.recent(HISTORY_LIMIT);
    }

    @POST
    @Path("config/reload")
    public Response reload() {
        try {
            WatchConfig config = reloader.reload();
            return Response.ok(Map.of(
                    "message", "Configuration reloaded",
                    "source", config.source(),
                    "pattern_rules", config.patternRules().size()
            )).build();
        } catch (ConfigurationException e) {
            LOG.errorf("Configuration reload failed, keeping previous configuration: %s", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Configuration reload failed", "details", e.errors()))
                    .build();
        }
    }
}
