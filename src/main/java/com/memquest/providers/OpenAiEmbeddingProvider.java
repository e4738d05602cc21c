package com.memquest.providers;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Batched client for an OpenAI-compatible {@code /embeddings} endpoint.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int dimensions;
    private final HttpClient httpClient;

    public OpenAiEmbeddingProvider(String baseUrl, String apiKey, String model, int dimensions) {
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.apiKey = apiKey;
        this.model = model;
        this.dimensions = dimensions;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public String baseUrl() { return baseUrl; }

    @Override
    public List<float[]> embed(List<String> texts) throws Exception {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", model);
        body.put("input", texts);
        if (dimensions > 0) body.put("dimensions", dimensions);

        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/embeddings"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        var resp = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            var retryAfter = resp.headers().firstValue("retry-after").map(v -> " retry-after: " + v).orElse("");
            throw new RuntimeException("Embedding API error " + resp.statusCode() + retryAfter + ": " + resp.body());
        }

        var data = MAPPER.readTree(resp.body()).path("data");
        var vectors = new ArrayList<float[]>(texts.size());
        for (int i = 0; i < data.size(); i++) vectors.add(null);
        for (int i = 0; i < data.size(); i++) {
            var item = data.get(i);
            var arr = item.path("embedding");
            var vec = new float[arr.size()];
            for (int j = 0; j < arr.size(); j++) {
                vec[j] = (float) arr.get(j).asDouble();
            }
            int index = item.path("index").asInt(i);
            if (index < 0 || index >= vectors.size()) index = i;
            vectors.set(index, vec);
        }
        if (vectors.size() != texts.size() || vectors.contains(null)) {
            throw new IllegalStateException("Embedding API returned " + data.size()
                    + " vectors for " + texts.size() + " inputs");
        }
        return vectors;
    }
}
