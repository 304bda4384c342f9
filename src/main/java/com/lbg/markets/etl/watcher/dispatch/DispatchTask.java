package com.lbg.markets.etl.watcher.dispatch;

import com.lbg.markets.etl.watcher.config.DispatchSettings;
import com.lbg.markets.etl.watcher.domain.DispatchRequest;
import com.lbg.markets.etl.watcher.util.FileIdentity;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task name and arguments sent to the worker, identical for every dispatch strategy.
 */
public record DispatchTask(
        String taskName,
        List<Object> args,
        Map<String, Object> kwargs
) {
    public DispatchTask {
        args = args != null ? List.copyOf(args) : List.of();
        kwargs = kwargs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(kwargs)) : Map.of();
    }

    /**
     * The worker receives the file name positionally; everything else goes in keyword arguments.
     * {@code auto_triggered} makes the worker post its completion callback. Destination keywords
     * are only sent when the configured task declares them.
     */
    public static DispatchTask forFile(DispatchRequest request, DispatchSettings settings, Instant now, ZoneId zone) {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("auto_triggered", true);
        kwargs.put("filepath", request.path());
        if (settings.destinationKwargs()) {
            kwargs.put("table_name", request.destination().table());
            if (request.destination().schema() != null) {
                kwargs.put("schema", request.destination().schema());
            }
            kwargs.put("source_name", FileIdentity.sourceName(request.fileName(), now, zone));
            kwargs.put("source", settings.sourceTag());
        }
        return new DispatchTask(settings.taskName(), List.of(request.fileName()), kwargs);
    }
}
