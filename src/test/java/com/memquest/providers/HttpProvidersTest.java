package com.memquest.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpProvidersTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/";
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            send(exchange, status, body);
        });
    }

    private static void send(HttpExchange exchange, int status, String body) throws IOException {
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (var out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void embeddingsAreReturnedInInputOrder() throws Exception {
        respond("/v1/embeddings", 200, """
            {"data": [
              {"index": 1, "embedding": [0.0, 1.0]},
              {"index": 0, "embedding": [1.0, 0.0]}
            ]}
            """);
        var provider = new OpenAiEmbeddingProvider(baseUrl, "sk-test", "text-embedding-3-large", 2);
        var vectors = provider.embed(List.of("first", "second"));

        assertEquals(1f, vectors.get(0)[0]);
        assertEquals(1f, vectors.get(1)[1]);
        var request = MAPPER.readTree(lastBody.get());
        assertEquals("text-embedding-3-large", request.path("model").asText());
        assertEquals(2, request.path("dimensions").asInt());
        assertEquals("second", request.path("input").get(1).asText());
        assertEquals("Bearer sk-test", lastAuth.get());
    }

    @Test
    void embeddingErrorCarriesStatusCode() {
        respond("/v1/embeddings", 429, "{\"error\": \"slow down\"}");
        var provider = new OpenAiEmbeddingProvider(baseUrl, "", "m", 0);
        var ex = assertThrows(RuntimeException.class, () -> provider.embed(List.of("x")));
        assertTrue(ex.getMessage().contains("429"));
        assertNull(lastAuth.get());
    }

    @Test
    void shortEmbeddingResponseIsRejected() {
        respond("/v1/embeddings", 200, "{\"data\": [{\"index\": 0, \"embedding\": [1.0]}]}");
        var provider = new OpenAiEmbeddingProvider(baseUrl, "", "m", 1);
        assertThrows(IllegalStateException.class, () -> provider.embed(List.of("a", "b")));
    }

    @Test
    void rerankScoresAreSortedBestFirst() throws Exception {
        respond("/v1/rerank", 200, """
            {"results": [
              {"index": 0, "relevance_score": 0.2},
              {"index": 2, "relevance_score": 0.9},
              {"index": 9, "relevance_score": 0.99}
            ]}
            """);
        var provider = new HttpRerankProvider(baseUrl, "key");
        var scores = provider.rerank("tea", List.of("a", "b", "c"), "bge-reranker");

        assertEquals(2, scores.size());
        assertEquals(2, scores.get(0).index());
        assertEquals(0, scores.get(1).index());
        var request = MAPPER.readTree(lastBody.get());
        assertEquals("bge-reranker", request.path("model").asText());
        assertEquals(3, request.path("top_n").asInt());
    }

    @Test
    void rerankErrorThrows() {
        respond("/v1/rerank", 503, "unavailable");
        var provider = new HttpRerankProvider(baseUrl, "");
        var ex = assertThrows(RuntimeException.class, () -> provider.rerank("q", List.of("a"), "cfg"));
        assertTrue(ex.getMessage().contains("503"));
    }

    @Test
    void chatCompletionReturnsFirstChoice() throws Exception {
        respond("/v1/chat/completions", 200, """
            {"choices": [{"message": {"role": "assistant", "content": "STORE DURABLE"}}]}
            """);
        var client = new ChatCompletionClient(baseUrl, "k", "gpt-4o-mini");
        assertEquals("STORE DURABLE", client.complete("system", "User is vegan"));
        var request = MAPPER.readTree(lastBody.get());
        assertEquals("gpt-4o-mini", request.path("model").asText());
        assertEquals("User is vegan", request.path("messages").get(1).path("content").asText());
    }
}
