package com.lbg.markets.etl.watcher.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lbg.markets.etl.watcher.InMemoryBrokerTransport;
import com.lbg.markets.etl.watcher.TestFiles;
import com.lbg.markets.etl.watcher.domain.CompletionNotice;
import com.lbg.markets.etl.watcher.domain.WatchedFile.FileStatus;
import com.lbg.markets.etl.watcher.tracker.Tracker;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Scanner, raw dispatch and completion wired together by CDI, with the broker replaced
 * by an in-memory list.
 */
@QuarkusTest
class WatcherPipelineTest {

    @Inject
    FileScanner scanner;

    @Inject
    CompletionListener completionListener;

    @Inject
    Tracker tracker;

    @Inject
    InMemoryBrokerTransport broker;

    @Inject
    ObjectMapper mapper;

    @Test
    void shouldDispatchNewFileAndApplyCompletion() throws Exception {
        String fileName = "pipeline-" + UUID.randomUUID() + ".csv";
        Path file = TestFiles.write(Paths.get("target/test-watch/customer_data").resolve(fileName),
                "id,name\n1,alice\n", System.currentTimeMillis() - 60_000);

        scanner.tick();
        assertTrue(messagesFor(fileName).isEmpty());

        scanner.tick();
        List<JsonNode> messages = messagesFor(fileName);
        assertEquals(1, messages.size());

        JsonNode kwargs = body(messages.get(0)).get(1);
        assertTrue(kwargs.path("auto_triggered").asBoolean());
        assertTrue(kwargs.path("filepath").asText().endsWith("/customer_data/" + fileName));
        assertTrue(kwargs.path("table_name").isMissingNode());
        assertEquals(FileStatus.DISPATCHED, tracker.find(TestFiles.key(file)).orElseThrow().status());

        CompletionListener.Outcome outcome = completionListener.onCompletion(
                new CompletionNotice(fileName, "success", null, "worker-1", null));
        assertEquals(CompletionListener.Outcome.APPLIED, outcome);
        assertEquals(FileStatus.COMPLETED, tracker.find(TestFiles.key(file)).orElseThrow().status());
    }

    private List<JsonNode> messagesFor(String fileName) throws IOException {
        List<JsonNode> matching = new ArrayList<>();
        for (String raw : broker.messages()) {
            JsonNode message = mapper.readTree(raw);
            if (body(message).get(0).get(0).asText().equals(fileName)) {
                matching.add(message);
            }
        }
        return matching;
    }

    private JsonNode body(JsonNode message) throws IOException {
        return mapper.readTree(Base64.getDecoder().decode(message.path("body").asText()));
    }
}
