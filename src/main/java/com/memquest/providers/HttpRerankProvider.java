package com.memquest.providers;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Client for a {@code /rerank} endpoint (Cohere/Jina style). The semantic
 * configuration name is sent as the model.
 */
public class HttpRerankProvider implements RerankProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String apiKey;
    private final HttpClient httpClient;

    public HttpRerankProvider(String baseUrl, String apiKey) {
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.apiKey = apiKey;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public List<RerankScore> rerank(String query, List<String> documents, String configName) throws Exception {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", configName);
        body.put("query", query);
        body.put("documents", documents);
        body.put("top_n", documents.size());

        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/rerank"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(10))
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        var resp = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new RuntimeException("Rerank API error " + resp.statusCode() + ": " + resp.body());
        }

        var scores = new ArrayList<RerankScore>();
        for (var item : MAPPER.readTree(resp.body()).path("results")) {
            int index = item.path("index").asInt(-1);
            if (index < 0 || index >= documents.size()) continue;
            scores.add(new RerankScore(index, item.path("relevance_score").asDouble(0.0)));
        }
        scores.sort(Comparator.comparingDouble(RerankScore::relevanceScore).reversed());
        return scores;
    }
}
