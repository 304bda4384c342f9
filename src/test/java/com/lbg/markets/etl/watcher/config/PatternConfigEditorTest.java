package com.lbg.markets.etl.watcher.config;

import com.lbg.markets.etl.watcher.TestFiles;
import com.lbg.markets.etl.watcher.domain.PatternRule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternConfigEditorTest {

    private Path workDir;
    private ConfigLoader loader;
    private PatternConfigEditor editor;

    @BeforeEach
    void setup() throws IOException {
        workDir = Files.createTempDirectory("config-edit-");
        loader = new ConfigLoader(workDir, workDir);
        editor = new PatternConfigEditor(loader);
    }

    @AfterEach
    void cleanup() throws IOException {
        TestFiles.deleteRecursively(workDir);
    }

    private static List<String> patterns(WatchConfig config) {
        return config.patternRules().stream().map(PatternRule::pattern).toList();
    }

    private Path mappingsFile() throws IOException {
        Path file = workDir.resolve("pattern_config.yaml");
        Files.writeString(file, """
                watcher_settings:
                  watch_path: /data/incoming
                  poll_interval: 5
                celery_settings:
                  queue: etl
                pattern_mappings:
                  tel_list: dim_numbers
                  customer_data: {table: dim_customers, schema: public}
                """);
        return file;
    }

    @Test
    void shouldAppendMappingAndKeepOtherSections() throws IOException {
        Path file = mappingsFile();

        WatchConfig returned = editor.addPattern(file, "inventory", "dim_inventory", "stock", "Stock levels");

        WatchConfig reloaded = loader.load(file);
        assertEquals(List.of("tel_list", "customer_data", "inventory"), patterns(reloaded));
        assertEquals("stock.dim_inventory", reloaded.patternRules().get(2).destination().qualifiedName());
        assertEquals("Stock levels", reloaded.patternRules().get(2).destination().description());
        assertEquals("etl", reloaded.dispatch().queue());
        assertEquals(List.of("/data/incoming"), reloaded.watcher().watchPaths());
        assertEquals(patterns(reloaded), patterns(returned));
    }

    @Test
    void shouldReplaceExistingPatternInPlace() throws IOException {
        Path file = mappingsFile();

        editor.addPattern(file, "TEL_LIST", "dim_phone_numbers", null, null);

        WatchConfig reloaded = loader.load(file);
        assertEquals(List.of("tel_list", "customer_data"), patterns(reloaded));
        assertEquals("dim_phone_numbers", reloaded.patternRules().get(0).destination().table());
    }

    @Test
    void shouldEditListFormInJson() throws IOException {
        Path file = workDir.resolve("pattern_config.json");
        Files.writeString(file, """
                {
                  "watcher_settings": {"watch_paths": ["/a"]},
                  "pattern_rules": [{"pattern": "sales_data", "destination": "fact_sales"}]
                }
                """);

        editor.addPattern(file, "reports", "staging_reports", "staging", null);
        assertEquals(List.of("sales_data", "reports"), patterns(loader.load(file)));

        WatchConfig afterRemove = editor.removePattern(file, "Sales_Data");
        assertEquals(List.of("reports"), patterns(afterRemove));
        assertTrue(Files.readString(file).contains("\"pattern_rules\""));
    }

    @Test
    void shouldRemoveMapping() throws IOException {
        Path file = mappingsFile();

        editor.removePattern(file, "tel_list");

        assertEquals(List.of("customer_data"), patterns(loader.load(file)));
    }

    @Test
    void shouldRejectUnknownPattern() throws IOException {
        Path file = mappingsFile();
        String before = Files.readString(file);

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> editor.removePattern(file, "missing"));

        assertEquals(List.of("Pattern not found: missing"), e.errors());
        assertEquals(before, Files.readString(file));
    }

    @Test
    void shouldNotWriteInvalidResult() throws IOException {
        Path file = mappingsFile();
        String before = Files.readString(file);

        assertThrows(ConfigurationException.class, () -> editor.addPattern(file, "  ", "dim_blank", null, null));

        assertEquals(before, Files.readString(file));
    }
}
