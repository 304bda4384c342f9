package com.lbg.markets.etl.watcher.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lbg.markets.etl.watcher.util.PythonRepr;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the message a Celery worker reads from a Redis list: Celery task protocol 2
 * inside a Kombu transport envelope.
 * <p>
 * Every field below is read by the consumer. A missing header or property makes the worker
 * drop the message or fail to deserialize it.
 */
public class CeleryEnvelope {

    public static final String CONTENT_TYPE = "application/json";
    public static final String CONTENT_ENCODING = "utf-8";
    public static final String BODY_ENCODING = "base64";

    private final ObjectMapper mapper;
    private final String origin;

    public CeleryEnvelope(ObjectMapper mapper) {
        this(mapper, defaultOrigin());
    }

    public CeleryEnvelope(ObjectMapper mapper, String origin) {
        this.mapper = mapper;
        this.origin = origin;
    }

    /**
     * Serialized envelope ready to be pushed onto {@code queue}.
     */
    public String encode(DispatchTask task, String taskId, String queue) throws DispatchException {
        try {
            return mapper.writeValueAsString(build(task, taskId, queue));
        } catch (JsonProcessingException e) {
            throw new DispatchException("Failed to serialize envelope for task " + taskId, e);
        }
    }

    public ObjectNode build(DispatchTask task, String taskId, String queue) throws JsonProcessingException {
        // body: [args, kwargs, embed]; an empty embed means no callbacks, errbacks, chain or chord
        byte[] body = mapper.writeValueAsBytes(List.of(task.args(), task.kwargs(), Map.of()));

        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("body", Base64.getEncoder().encodeToString(body));
        envelope.put("content-encoding", CONTENT_ENCODING);
        envelope.put("content-type", CONTENT_TYPE);
        envelope.set("headers", headers(task, taskId));
        envelope.set("properties", properties(taskId, queue));
        return envelope;
    }

    private ObjectNode headers(DispatchTask task, String taskId) {
        ObjectNode headers = mapper.createObjectNode();
        headers.put("lang", "py");
        headers.put("task", task.taskName());
        headers.put("id", taskId);
        headers.putNull("shadow");
        headers.putNull("eta");
        headers.putNull("expires");
        headers.putNull("group");
        headers.putNull("group_index");
        headers.put("retries", 0);
        ArrayNode timelimit = headers.putArray("timelimit");
        timelimit.addNull();
        timelimit.addNull();
        headers.put("root_id", taskId);
        headers.putNull("parent_id");
        headers.put("argsrepr", PythonRepr.of(task.args()));
        headers.put("kwargsrepr", PythonRepr.of(task.kwargs()));
        headers.put("origin", origin);
        headers.put("ignore_result", true);
        return headers;
    }

    private ObjectNode properties(String taskId, String queue) {
        ObjectNode properties = mapper.createObjectNode();
        properties.put("correlation_id", taskId);
        properties.put("reply_to", "");
        properties.put("delivery_mode", 2);
        ObjectNode deliveryInfo = properties.putObject("delivery_info");
        deliveryInfo.put("exchange", "");
        deliveryInfo.put("routing_key", queue);
        properties.put("priority", 0);
        properties.put("body_encoding", BODY_ENCODING);
        properties.put("delivery_tag", UUID.randomUUID().toString());
        return properties;
    }

    private static String defaultOrigin() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "localhost";
        }
        return "gen" + ProcessHandle.current().pid() + "@" + host;
    }
}
