package com.lbg.markets.etl.watcher.routing;

import com.lbg.markets.etl.watcher.domain.Destination;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.lbg.markets.etl.watcher.TestConfigs.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternRouterTest {

    private final PatternRouter router = new PatternRouter(List.of(
            rule("sales", "fact_sales"),
            rule("sales_data", "fact_sales_detail"),
            rule("Customer_Data", "dim_customers", "public"),
            rule("archive/reports", "staging_reports")
    ));

    @Test
    void shouldUseFirstMatchingRule() {
        Optional<Destination> destination = router.classify("/watch/sales_data/q1.csv");

        assertEquals("fact_sales", destination.orElseThrow().table());
    }

    @Test
    void shouldMatchCaseInsensitively() {
        assertEquals("public.dim_customers",
                router.classify("/watch/CUSTOMER_DATA/jan.csv").orElseThrow().qualifiedName());
        assertEquals("dim_customers",
                router.classify("/watch/exports/customer_data_2025.xlsx").orElseThrow().table());
    }

    @Test
    void shouldNormalizeWindowsSeparators() {
        assertEquals("staging_reports",
                router.classify("Z:\\Archive\\Reports\\q1.xlsx").orElseThrow().table());
        assertEquals("staging_reports",
                router.classify("//fileserver/share/archive/reports/q1.xlsx").orElseThrow().table());
    }

    @Test
    void shouldReturnEmptyWhenNothingMatches() {
        assertTrue(router.classify("/watch/inventory/stock.csv").isEmpty());
        assertTrue(new PatternRouter(List.of()).classify("/watch/sales/q1.csv").isEmpty());
    }

    @Test
    void shouldMatchAnywhereInPath() {
        // Directory names count, not only the file name
        assertEquals("fact_sales", router.classify("/mnt/sales/2025/jan.csv").orElseThrow().table());
    }
}
