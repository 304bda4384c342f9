package com.lbg.markets.etl.watcher.cli;

import com.lbg.markets.etl.watcher.domain.TrackerSnapshot;
import com.lbg.markets.etl.watcher.domain.WatchedFile.FileStatus;
import com.lbg.markets.etl.watcher.orchestration.WatcherStatus;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatusCommandTest {

    @Test
    void shouldPrintConfigurationAndCounts() {
        Map<String, String> mappings = new LinkedHashMap<>();
        mappings.put("customer_data", "public.dim_customers");
        mappings.put("reports", "staging.staging_reports");
        TrackerSnapshot files = new TrackerSnapshot(2, 3, 9, Map.of(
                FileStatus.DISPATCHED, 2, FileStatus.COMPLETED, 3, FileStatus.IGNORED, 4));
        WatcherStatus status = new WatcherStatus("config/pattern_config.yaml", List.of("Z:\\", "/mnt/share"),
                10, 2, 0, true, true, 100, List.of(".csv"), mappings, "raw", "celery",
                "etl_processor.tasks.process_excel_file", false, 1, files);

        StringWriter out = new StringWriter();
        StatusCommand.print(status, new PrintWriter(out));
        String text = out.toString();

        assertTrue(text.contains("config/pattern_config.yaml"));
        assertTrue(text.contains("Z:\\, /mnt/share"));
        assertTrue(text.contains("raw -> celery (etl_processor.tasks.process_excel_file)"));
        assertTrue(text.contains("customer_data"));
        assertTrue(text.contains("public.dim_customers"));
        assertTrue(text.contains("9 tracked, 2 queued, 3 processed, 1 pending"));
        assertTrue(text.contains("IGNORED"));
        assertFalse(text.contains("CANDIDATE"));
    }
}
