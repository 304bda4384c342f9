package com.lbg.markets.etl.watcher.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.lbg.markets.etl.watcher.domain.Destination;
import com.lbg.markets.etl.watcher.domain.PatternRule;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Locates, reads and validates the watch configuration file (YAML or JSON).
 * A missing file is replaced by the bundled default before loading.
 */
public class ConfigLoader {

    private static final Logger LOG = Logger.getLogger(ConfigLoader.class);

    static final String DEFAULT_RESOURCE = "default-pattern-config.yaml";
    static final List<String> DEFAULT_EXTENSIONS = List.of(".csv", ".xlsx", ".xls", ".xlsm");

    private final Path workingDir;
    private final Path homeDir;
    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    public ConfigLoader() {
        this(Paths.get("").toAbsolutePath(), Paths.get(System.getProperty("user.home", ".")));
    }

    public ConfigLoader(Path workingDir, Path homeDir) {
        this.workingDir = workingDir;
        this.homeDir = homeDir;
    }

    /**
     * Load the configuration from an explicit file, or from the first standard location that exists.
     */
    public WatchConfig load(Optional<String> explicitFile) {
        return load(locate(explicitFile));
    }

    public WatchConfig load(Path file) {
        WatchConfig config = parse(readTree(file), file.toString());
        LOG.infof("Loaded watch configuration from %s (%d pattern rules)", file, config.patternRules().size());
        return config;
    }

    /**
     * Raw document, for editing in place before {@link #write}.
     */
    ObjectNode readTree(Path file) {
        JsonNode root;
        try {
            root = mapperFor(file).readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file " + file + ": " + e.getMessage(), e);
        }
        if (!(root instanceof ObjectNode document)) {
            throw new ConfigurationException("Config file " + file + " is empty or not a mapping");
        }
        return document;
    }

    void write(Path file, JsonNode root) {
        try {
            mapperFor(file).writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to save config file " + file + ": " + e.getMessage(), e);
        }
        LOG.infof("Configuration saved to %s", file);
    }

    /**
     * Resolve the config file to use, writing the default configuration if none exists.
     */
    public Path locate(Optional<String> explicitFile) {
        if (explicitFile.isPresent() && !explicitFile.get().isBlank()) {
            Path explicit = workingDir.resolve(explicitFile.get());
            if (!Files.exists(explicit)) {
                LOG.warnf("Config file %s does not exist, writing default configuration", explicit);
                writeDefault(explicit);
            }
            return explicit;
        }

        for (Path candidate : standardLocations()) {
            if (Files.exists(candidate)) {
                LOG.infof("Found config file: %s", candidate);
                return candidate;
            }
        }

        Path target = workingDir.resolve("config").resolve("pattern_config.yaml");
        writeDefault(target);
        return target;
    }

    List<Path> standardLocations() {
        return List.of(
                workingDir.resolve("pattern_config.yaml"),
                workingDir.resolve("pattern_config.json"),
                workingDir.resolve("config").resolve("pattern_config.yaml"),
                workingDir.resolve("config").resolve("pattern_config.json"),
                homeDir.resolve(".etl").resolve("pattern_config.yaml")
        );
    }

    void writeDefault(Path target) {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("Bundled default configuration " + DEFAULT_RESOURCE + " is missing");
            }
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(in, target);
            LOG.infof("Created default config file: %s", target);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to write default config to " + target + ": " + e.getMessage(), e);
        }
    }

    private ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return yamlMapper;
        }
        if (name.endsWith(".json")) {
            return jsonMapper;
        }
        throw new ConfigurationException("Unsupported config file format: " + file);
    }

    /**
     * Validate a parsed configuration tree. All problems are collected before failing.
     */
    WatchConfig parse(JsonNode root, String source) {
        List<String> errors = new ArrayList<>();

        JsonNode watcherNode = root.path("watcher_settings");
        if (!watcherNode.isObject()) {
            errors.add("Missing required section: watcher_settings");
        }
        WatcherSettings watcher = parseWatcher(watcherNode, root.path("data_quality"), errors);
        DispatchSettings dispatch = parseDispatch(root.path("celery_settings"), errors);
        List<PatternRule> rules = parseRules(root, errors);

        if (!errors.isEmpty()) {
            throw new ConfigurationException(source, errors);
        }
        if (rules.isEmpty()) {
            LOG.warnf("Config %s defines no pattern rules; every file will be ignored", source);
        }
        return new WatchConfig(watcher, dispatch, rules, source);
    }

    private WatcherSettings parseWatcher(JsonNode node, JsonNode quality, List<String> errors) {
        List<String> watchPaths = new ArrayList<>();
        JsonNode paths = node.path("watch_paths");
        if (paths.isArray()) {
            paths.forEach(p -> watchPaths.add(p.asText()));
        } else if (!paths.isMissingNode()) {
            errors.add("watch_paths must be a list");
        }
        if (node.path("watch_path").isTextual()) {
            watchPaths.add(node.path("watch_path").asText());
        }
        String backup = node.path("backup_watch_path").isTextual() ? node.path("backup_watch_path").asText() : null;
        if (watchPaths.isEmpty() && backup == null && node.isObject()) {
            errors.add("watcher_settings must define watch_paths or backup_watch_path");
        }

        Duration poll = seconds(node, "poll_interval", 10, false, errors);
        Duration stability = seconds(node, "stability_delay", 2, true, errors);
        Duration process = seconds(node, "process_delay", 0, true, errors);

        boolean baseline = true;
        JsonNode baselineNode = node.path("initial_scan_baseline");
        if (baselineNode.isBoolean()) {
            baseline = baselineNode.asBoolean();
        } else if (!baselineNode.isMissingNode()) {
            errors.add("initial_scan_baseline must be true or false");
        }

        Set<String> extensions = new LinkedHashSet<>();
        JsonNode extNode = node.path("supported_extensions");
        if (extNode.isArray()) {
            extNode.forEach(e -> {
                if (e.asText().isBlank()) {
                    errors.add("supported_extensions contains a blank entry");
                } else {
                    extensions.add(e.asText());
                }
            });
            if (extensions.isEmpty()) {
                errors.add("supported_extensions cannot be empty");
            }
        } else if (extNode.isMissingNode()) {
            extensions.addAll(DEFAULT_EXTENSIONS);
        } else {
            errors.add("supported_extensions must be a list");
        }

        long maxBytes = 100 * WatcherSettings.BYTES_PER_MB;
        JsonNode maxNode = quality.path("max_file_size_mb");
        if (maxNode.isNumber() && maxNode.asDouble() > 0) {
            maxBytes = (long) (maxNode.asDouble() * WatcherSettings.BYTES_PER_MB);
        } else if (!maxNode.isMissingNode()) {
            errors.add("max_file_size_mb must be a positive number");
        }

        if (poll == null || stability == null || process == null) {
            return null;
        }
        try {
            return new WatcherSettings(watchPaths, backup, poll, stability, process, baseline, extensions, maxBytes);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
            return null;
        }
    }

    private Duration seconds(JsonNode node, String field, double defaultSeconds, boolean allowZero, List<String> errors) {
        JsonNode value = node.path(field);
        if (value.isMissingNode()) {
            return Duration.ofMillis(Math.round(defaultSeconds * 1000));
        }
        if (!value.isNumber()) {
            errors.add(field + " must be a number of seconds");
            return null;
        }
        double seconds = value.asDouble();
        if (seconds < 0 || (!allowZero && seconds == 0)) {
            errors.add(field + (allowZero ? " cannot be negative" : " must be positive"));
            return null;
        }
        long millis = Math.round(seconds * 1000);
        if (!allowZero && millis == 0) {
            errors.add(field + " must be at least 0.001 seconds");
            return null;
        }
        return Duration.ofMillis(millis);
    }

    private DispatchSettings parseDispatch(JsonNode node, List<String> errors) {
        DispatchMode mode = DispatchMode.RAW;
        if (node.path("dispatch_mode").isTextual()) {
            try {
                mode = DispatchMode.parse(node.path("dispatch_mode").asText());
            } catch (IllegalArgumentException e) {
                errors.add("dispatch_mode must be 'raw' or 'structured', got '" + node.path("dispatch_mode").asText() + "'");
            }
        }
        String queue = node.path("queue").asText(DispatchSettings.DEFAULT_QUEUE);
        String task = node.path("task_name").asText(DispatchSettings.DEFAULT_TASK);
        String sourceTag = node.path("source_tag").asText(DispatchSettings.DEFAULT_SOURCE_TAG);
        boolean destinationKwargs = false;
        JsonNode destinationNode = node.path("destination_kwargs");
        if (destinationNode.isBoolean()) {
            destinationKwargs = destinationNode.asBoolean();
        } else if (!destinationNode.isMissingNode()) {
            errors.add("destination_kwargs must be true or false");
        }
        try {
            return new DispatchSettings(mode, queue, task, sourceTag, destinationKwargs);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
            return null;
        }
    }

    private List<PatternRule> parseRules(JsonNode root, List<String> errors) {
        List<PatternRule> rules = new ArrayList<>();
        JsonNode list = root.path("pattern_rules");
        JsonNode mappings = root.path("pattern_mappings");

        if (list.isMissingNode() && mappings.isMissingNode()) {
            errors.add("Missing required section: pattern_mappings or pattern_rules");
            return rules;
        }

        if (list.isArray()) {
            int index = 0;
            for (JsonNode entry : list) {
                addRule(rules, entry.path("pattern").asText(null), entry, "destination", "pattern_rules[" + index + "]", errors);
                index++;
            }
        } else if (!list.isMissingNode()) {
            errors.add("pattern_rules must be a list");
        }

        if (mappings.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = mappings.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                addRule(rules, field.getKey(), field.getValue(), "table", "pattern_mappings." + field.getKey(), errors);
            }
        } else if (!mappings.isMissingNode()) {
            errors.add("pattern_mappings must be a mapping of pattern to table");
        }

        Set<String> seen = new HashSet<>();
        for (PatternRule rule : rules) {
            if (!seen.add(rule.pattern().toLowerCase(Locale.ROOT))) {
                errors.add("Duplicate pattern '" + rule.pattern() + "'");
            }
        }
        return rules;
    }

    private void addRule(List<PatternRule> rules, String pattern, JsonNode entry, String tableField,
                         String where, List<String> errors) {
        String table;
        String schema = null;
        String description = null;
        if (entry.isTextual()) {
            table = entry.asText();
        } else if (entry.isObject()) {
            table = entry.path(tableField).isTextual() ? entry.path(tableField).asText() : entry.path("table").asText(null);
            schema = entry.path("schema").asText(null);
            description = entry.path("description").asText(null);
        } else {
            errors.add(where + " must be a table name or a mapping");
            return;
        }

        try {
            rules.add(new PatternRule(pattern, new Destination(table, schema, description)));
        } catch (IllegalArgumentException e) {
            errors.add(where + ": " + e.getMessage());
        }
    }
}
