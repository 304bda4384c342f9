package com.lbg.markets.etl.watcher.cli;

import com.lbg.markets.etl.watcher.TestFiles;
import com.lbg.markets.etl.watcher.config.ConfigLoader;
import com.lbg.markets.etl.watcher.config.WatchConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternsCommandTest {

    private Path workDir;
    private Path configFile;
    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setup() throws IOException {
        workDir = Files.createTempDirectory("patterns-cli-");
        configFile = workDir.resolve("pattern_config.yaml");
        Files.writeString(configFile, """
                watcher_settings:
                  watch_path: /data/incoming
                pattern_mappings:
                  sales_data: fact_sales
                """);
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new PatternsCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void cleanup() throws IOException {
        TestFiles.deleteRecursively(workDir);
    }

    private WatchConfig reload() {
        return new ConfigLoader(workDir, workDir).load(configFile);
    }

    @Test
    void shouldAddPatternToFile() {
        int exit = commandLine.execute("add", "--config", configFile.toString(),
                "--schema", "public", "--description", "Customer master data", "customer_data", "dim_customers");

        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().contains("Added pattern customer_data -> dim_customers"));
        WatchConfig config = reload();
        assertEquals(2, config.patternRules().size());
        assertEquals("public.dim_customers", config.patternRules().get(1).destination().qualifiedName());
    }

    @Test
    void shouldRemovePatternFromFile() {
        int exit = commandLine.execute("remove", "-c", configFile.toString(), "sales_data");

        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().contains("No pattern rules defined"));
        assertTrue(reload().patternRules().isEmpty());
    }

    @Test
    void shouldListPatternsInMatchOrder() {
        commandLine.execute("add", "--config", configFile.toString(), "reports", "staging_reports");
        out.getBuffer().setLength(0);

        int exit = commandLine.execute("list", "--config", configFile.toString());

        assertEquals(0, exit, err.toString());
        String text = out.toString();
        assertTrue(text.indexOf("sales_data") < text.indexOf("reports"), text);
        assertTrue(text.contains("fact_sales"));
    }

    @Test
    void shouldFailForUnknownPattern() {
        int exit = commandLine.execute("remove", "--config", configFile.toString(), "inventory");

        assertEquals(1, exit);
        assertTrue(err.toString().contains("Pattern not found: inventory"));
    }

    @Test
    void shouldRequireSubcommand() {
        assertNotEquals(0, commandLine.execute());
    }
}
