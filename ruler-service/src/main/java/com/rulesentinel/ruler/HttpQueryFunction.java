package com.rulesentinel.ruler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulesentinel.core.engine.QueryException;
import com.rulesentinel.core.engine.QueryFunction;
import com.rulesentinel.core.engine.QueryFunctionFactory;
import com.rulesentinel.core.engine.Sample;
import com.rulesentinel.core.model.PartialResponseStrategy;
import com.rulesentinel.core.wire.SampleValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link QueryFunction} backed by a Prometheus-compatible HTTP query API.
 *
 * <h3>Partial responses</h3>
 * <p>
 * {@link PartialResponseStrategy#ABORT} asks the API to fail on partial
 * data; {@code WARN} and {@code NONE} accept partial data. Warnings returned
 * with a result are logged under {@code WARN} and ignored under {@code NONE}.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpQueryFunction implements QueryFunction {

    private static final Logger LOG = LoggerFactory.getLogger(HttpQueryFunction.class);

    static final String QUERY_PATH = "/api/v1/query";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final Duration timeout;
    private final PartialResponseStrategy strategy;

    /**
     * @param client   shared HTTP client
     * @param mapper   JSON mapper used to read responses
     * @param baseUrl  base URL of the query API
     * @param timeout  per-request timeout
     * @param strategy strategy the function is bound to
     */
    public HttpQueryFunction(HttpClient client, ObjectMapper mapper, URI baseUrl, Duration timeout,
            PartialResponseStrategy strategy) {
        this.client = Objects.requireNonNull(client, "HttpClient must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        String base = Objects.requireNonNull(baseUrl, "baseUrl must not be null").toString();
        this.endpoint = URI.create(stripTrailingSlash(base) + QUERY_PATH);
    }

    /**
     * One function per strategy, all sharing a single client.
     *
     * @param config process configuration
     * @param mapper JSON mapper
     * @return factory for the engine pool
     */
    public static QueryFunctionFactory factory(RulerConfig config, ObjectMapper mapper) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(config.getQueryTimeout())
                .build();
        return strategy -> new HttpQueryFunction(
                client, mapper, config.getQueryUrl(), config.getQueryTimeout(), strategy);
    }

    @Override
    public List<Sample> query(String query, Instant time) throws QueryException {
        HttpRequest request = HttpRequest.newBuilder(requestUri(query, time))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new QueryException("query request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryException("query interrupted", e);
        }

        JsonNode root;
        try {
            root = mapper.readTree(response.body());
        } catch (IOException e) {
            throw new QueryException("HTTP " + response.statusCode() + ": unreadable response: "
                    + e.getMessage(), e);
        }
        if (root == null || !"success".equals(root.path("status").asText())) {
            String error = root == null ? "empty response" : root.path("error").asText("unknown error");
            throw new QueryException("HTTP " + response.statusCode() + ": " + error);
        }

        handleWarnings(query, root.path("warnings"));
        return toSamples(root.path("data"));
    }

    public PartialResponseStrategy getStrategy() {
        return strategy;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    URI requestUri(String query, Instant time) {
        String seconds = BigDecimal.valueOf(time.toEpochMilli(), 3).toPlainString();
        boolean partial = strategy != PartialResponseStrategy.ABORT;
        return URI.create(endpoint
                + "?query=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&time=" + seconds
                + "&partial_response=" + partial);
    }

    private void handleWarnings(String query, JsonNode warnings) {
        if (!warnings.isArray() || warnings.isEmpty() || strategy != PartialResponseStrategy.WARN) {
            return;
        }
        for (JsonNode warning : warnings) {
            LOG.warn("[{}] Partial response for query {}: {}", strategy, query, warning.asText());
        }
    }

    private static List<Sample> toSamples(JsonNode data) throws QueryException {
        String resultType = data.path("resultType").asText();
        JsonNode result = data.path("result");
        List<Sample> samples = new ArrayList<>();
        switch (resultType) {
            case "vector":
                for (JsonNode entry : result) {
                    samples.add(new Sample(labels(entry.path("metric")), value(entry.path("value"))));
                }
                return samples;
            case "scalar":
                samples.add(new Sample(Map.of(), value(result)));
                return samples;
            default:
                throw new QueryException("unsupported result type \"" + resultType + "\"");
        }
    }

    private static Map<String, String> labels(JsonNode metric) {
        Map<String, String> labels = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = metric.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            labels.put(field.getKey(), field.getValue().asText());
        }
        return labels;
    }

    private static double value(JsonNode pair) throws QueryException {
        if (!pair.isArray() || pair.size() != 2) {
            throw new QueryException("malformed sample value: " + pair);
        }
        try {
            return SampleValues.parse(pair.get(1).asText());
        } catch (NumberFormatException e) {
            throw new QueryException("malformed sample value: " + pair, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
