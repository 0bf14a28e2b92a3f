package com.tio.internal.plugins.validin;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tio.plugin.PluginHandler;
import com.tio.plugin.PluginInvocation;
import com.tio.pluginconfig.ObservableClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Analyzer that queries the Validin API for DNS history of a domain or IP.
 * <p>
 * Parameters: {@code api_key_name} (secret, required), {@code scan_choice} (optional; {@code default} runs
 * every query supported for the observable type). Output: one entry per query, keyed by scan choice.
 */
public final class ValidinAnalyzer implements PluginHandler {

    static final String PARAM_API_KEY = "api_key_name";
    static final String PARAM_SCAN_CHOICE = "scan_choice";
    static final String DEFAULT_SCAN = "default";
    private static final String DEFAULT_BASE_URL = "https://app.validin.com";

    private static final Logger log = LoggerFactory.getLogger(ValidinAnalyzer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final Map<String, String> DOMAIN_ENDPOINTS = orderedMap(
            "all_records", "/api/axon/domain/dns/history/%s",
            "a_records", "/api/axon/domain/dns/history/%s/A",
            "aaaa_records", "/api/axon/domain/dns/history/%s/AAAA",
            "ns_records", "/api/axon/domain/dns/history/%s/NS",
            "ns_for", "/api/axon/domain/dns/history/%s/NS_FOR",
            "ptr_records", "/api/axon/domain/dns/hostname/%s",
            "live_dns_query", "/api/axon/domain/dns/live/%s");

    private static final Map<String, String> IP_ENDPOINTS = orderedMap(
            "dns_history_reverse_ip", "/api/axon/ip/dns/history/%s",
            "ptr_records", "/api/axon/ip/dns/hostname/%s",
            "cidr_dns_history", "/api/axon/ip/dns/history/%s/cidr",
            "ptr_records_for_cidr", "/api/axon/ip/dns/hostname/%s/cidr");

    private final String baseUrl;
    private final HttpClient httpClient;

    public ValidinAnalyzer() {
        this(DEFAULT_BASE_URL);
    }

    /** Creates the analyzer against another API host (e.g. a staging instance). */
    public ValidinAnalyzer(String baseUrl) {
        this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : DEFAULT_BASE_URL;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public Map<String, Object> run(PluginInvocation invocation) throws Exception {
        String apiKey = Objects.toString(invocation.getParameter(PARAM_API_KEY), "").trim();
        if (apiKey.isEmpty()) {
            throw new IllegalArgumentException("Validin requires " + PARAM_API_KEY);
        }
        Object choiceParam = invocation.getParameter(PARAM_SCAN_CHOICE);
        String choice = choiceParam != null ? choiceParam.toString().trim() : DEFAULT_SCAN;
        Map<String, String> endpoints = endpointsFor(invocation.getClassification());
        List<String> scans = queriesFor(choice, endpoints, invocation.getClassification());

        Map<String, Object> out = new LinkedHashMap<>();
        String observable = URLEncoder.encode(invocation.getObservableName(), StandardCharsets.UTF_8);
        for (String scan : scans) {
            out.put(scan, get(String.format(endpoints.get(scan), observable), apiKey));
        }
        log.debug("Validin ran {} quer(ies) for job {}", scans.size(), invocation.getJobId());
        return out;
    }

    static Map<String, String> endpointsFor(ObservableClassification classification) {
        if (classification == ObservableClassification.DOMAIN) return DOMAIN_ENDPOINTS;
        if (classification == ObservableClassification.IP) return IP_ENDPOINTS;
        throw new IllegalArgumentException("Validin supports ip and domain observables, not " + classification);
    }

    /**
     * Queries to run for a scan choice: every supported query for {@code default}, otherwise the named one.
     *
     * @throws IllegalArgumentException if the choice does not apply to the observable type
     */
    static List<String> queriesFor(String choice, Map<String, String> endpoints, ObservableClassification type) {
        if (DEFAULT_SCAN.equals(choice)) {
            return List.copyOf(endpoints.keySet());
        }
        if (!endpoints.containsKey(choice)) {
            throw new IllegalArgumentException("Scan choice " + choice + " is not available for " + type);
        }
        return List.of(choice);
    }

    private Map<String, Object> get(String path, String apiKey) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Authorization", "BEARER " + apiKey)
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() != 200) {
            throw new IllegalStateException("Validin API error: " + response.statusCode() + " on " + path);
        }
        String body = response.body();
        return body == null || body.isBlank() ? Map.of() : MAPPER.readValue(body, MAP_TYPE);
    }

    private static Map<String, String> orderedMap(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return Collections.unmodifiableMap(m);
    }
}
