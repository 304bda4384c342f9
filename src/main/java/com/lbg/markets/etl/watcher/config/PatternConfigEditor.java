package com.lbg.markets.etl.watcher.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Adds and removes pattern rules in a watch configuration file.
 * <p>
 * Edits are made on the parsed document so other sections survive, and the result is validated
 * before it is written back. A running watcher picks the change up on its next reload.
 */
public class PatternConfigEditor {

    private static final Logger LOG = Logger.getLogger(PatternConfigEditor.class);

    private final ConfigLoader loader;

    public PatternConfigEditor(ConfigLoader loader) {
        this.loader = loader;
    }

    /**
     * Add a rule, or replace the one with the same pattern (compared ignoring case) in place.
     * Files written in the list form get a list entry; everything else gets a mapping entry.
     */
    public WatchConfig addPattern(Path file, String pattern, String table, String schema, String description) {
        ObjectNode root = loader.readTree(file);
        JsonNode list = root.get("pattern_rules");
        JsonNode mappings = root.get("pattern_mappings");

        int listIndex = list instanceof ArrayNode rules ? indexOf(rules, pattern) : -1;
        String mappingKey = mappings instanceof ObjectNode map ? keyOf(map, pattern) : null;

        if (listIndex >= 0) {
            ((ArrayNode) list).set(listIndex, listEntry(root, pattern, table, schema, description));
        } else if (mappingKey != null) {
            ((ObjectNode) mappings).set(mappingKey, mappingEntry(root, table, schema, description));
        } else if (list instanceof ArrayNode rules && mappings == null) {
            rules.add(listEntry(root, pattern, table, schema, description));
        } else if (mappings == null || mappings.isNull()) {
            root.putObject("pattern_mappings").set(pattern, mappingEntry(root, table, schema, description));
        } else if (mappings instanceof ObjectNode map) {
            map.set(pattern, mappingEntry(root, table, schema, description));
        } else {
            throw new ConfigurationException("pattern_mappings in " + file + " is not a mapping");
        }

        WatchConfig config = save(file, root);
        LOG.infof("Added pattern mapping: %s -> %s", pattern, table);
        return config;
    }

    /**
     * @throws ConfigurationException if no rule has this pattern
     */
    public WatchConfig removePattern(Path file, String pattern) {
        ObjectNode root = loader.readTree(file);
        boolean removed = false;

        if (root.get("pattern_rules") instanceof ArrayNode rules) {
            int index = indexOf(rules, pattern);
            if (index >= 0) {
                rules.remove(index);
                removed = true;
            }
        }
        if (root.get("pattern_mappings") instanceof ObjectNode map) {
            String key = keyOf(map, pattern);
            if (key != null) {
                map.remove(key);
                removed = true;
            }
        }
        if (!removed) {
            throw new ConfigurationException("Pattern not found: " + pattern);
        }

        WatchConfig config = save(file, root);
        LOG.infof("Removed pattern mapping: %s", pattern);
        return config;
    }

    private WatchConfig save(Path file, ObjectNode root) {
        WatchConfig config = loader.parse(root, file.toString());
        loader.write(file, root);
        return config;
    }

    private static int indexOf(ArrayNode rules, String pattern) {
        for (int i = 0; i < rules.size(); i++) {
            if (pattern.equalsIgnoreCase(rules.get(i).path("pattern").asText())) {
                return i;
            }
        }
        return -1;
    }

    private static String keyOf(ObjectNode mappings, String pattern) {
        Iterator<Map.Entry<String, JsonNode>> fields = mappings.fields();
        while (fields.hasNext()) {
            String key = fields.next().getKey();
            if (key.equalsIgnoreCase(pattern)) {
                return key;
            }
        }
        return null;
    }

    private static ObjectNode listEntry(ObjectNode root, String pattern, String table, String schema, String description) {
        ObjectNode entry = root.objectNode();
        entry.put("pattern", pattern);
        entry.put("destination", table);
        putOptional(entry, schema, description);
        return entry;
    }

    private static ObjectNode mappingEntry(ObjectNode root, String table, String schema, String description) {
        ObjectNode entry = root.objectNode();
        entry.put("table", table);
        putOptional(entry, schema, description);
        return entry;
    }

    private static void putOptional(ObjectNode entry, String schema, String description) {
        if (schema != null && !schema.isBlank()) {
            entry.put("schema", schema);
        }
        if (description != null && !description.isBlank()) {
            entry.put("description", description);
        }
    }
}
