package com.tio.report;

import com.tio.pluginconfig.PluginKind;
import com.tio.pluginconfig.PluginRef;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryReportStoreTest {

    private final InMemoryReportStore store = new InMemoryReportStore();

    @Test
    void save_replacesReportOfSamePlugin() {
        PluginReport pending = PluginReport.pending("job-1", PluginRef.of(PluginKind.ANALYZER, "Whois"), "tok");
        store.save(pending);
        store.save(pending.running(Instant.now()).succeeded(Map.of("ok", true), Instant.now()));

        assertEquals(ReportStatus.SUCCESS, store.find("job-1", "Whois").orElseThrow().getStatus());
        assertEquals(1, store.forJob("job-1").size());
    }

    @Test
    void forJob_keepsFirstSaveOrderAndIsolatesJobs() {
        store.save(PluginReport.pending("job-1", PluginRef.of(PluginKind.ANALYZER, "B"), "t1"));
        store.save(PluginReport.pending("job-1", PluginRef.of(PluginKind.CONNECTOR, "A"), "t2"));
        store.save(PluginReport.pending("job-2", PluginRef.of(PluginKind.ANALYZER, "C"), "t3"));

        assertEquals(List.of("B", "A"), store.forJob("job-1").stream()
                .map(r -> r.getPlugin().getName()).collect(Collectors.toList()));
        assertTrue(store.find("job-2", "B").isEmpty());
        assertTrue(store.forJob("missing").isEmpty());
    }
}
