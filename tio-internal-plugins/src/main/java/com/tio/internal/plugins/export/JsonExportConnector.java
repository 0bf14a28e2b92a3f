package com.tio.internal.plugins.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Connector that appends one JSON line per job to {@code <output_dir>/tio-export.jsonl}.
 * Parameter: {@code output_dir} (required).
 */
public final class JsonExportConnector implements PluginHandler {

    static final String PARAM_OUTPUT_DIR = "output_dir";
    static final String FILE_NAME = "tio-export.jsonl";

    private static final Logger log = LoggerFactory.getLogger(JsonExportConnector.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public Map<String, Object> run(PluginInvocation invocation) throws Exception {
        String dir = Objects.toString(invocation.getParameter(PARAM_OUTPUT_DIR), "").trim();
        if (dir.isEmpty()) {
            throw new IllegalArgumentException("JsonExport requires " + PARAM_OUTPUT_DIR);
        }
        Path target = Paths.get(dir).resolve(FILE_NAME);
        Files.createDirectories(target.getParent());

        Map<String, Object> line = new LinkedHashMap<>();
        line.put("job_id", invocation.getJobId());
        line.put("observable", invocation.getObservableName());
        line.put("classification", invocation.getClassification() != null
                ? invocation.getClassification().name().toLowerCase(Locale.ROOT) : null);
        line.put("user", invocation.getUserId());
        line.put("exported_at", Instant.now().toString());
        String json = MAPPER.writeValueAsString(line) + "\n";
        synchronized (JsonExportConnector.class) {
            Files.write(target, json.getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }
        log.info("Exported job {} to {}", invocation.getJobId(), target);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("file", target.toString());
        out.put("bytes", json.getBytes(StandardCharsets.UTF_8).length);
        return out;
    }
}
