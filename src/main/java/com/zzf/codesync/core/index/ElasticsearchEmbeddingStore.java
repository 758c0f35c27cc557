package com.zzf.codesync.core.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import com.zzf.codesync.model.TransientNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stores encrypted embeddings as Elasticsearch documents whose id is the chunk hash. The
 * cipher text and nonce are mapped as {@code binary}, so the index never sees a usable vector.
 */
public final class ElasticsearchEmbeddingStore implements EmbeddingStore {
    private static final Logger logger = LoggerFactory.getLogger(ElasticsearchEmbeddingStore.class);
    private static final String MAPPING_RESOURCE = "/es/code_sync_embeddings.json";

    private final HttpClient http;
    private final URI baseUri;
    private final String indexName;
    private final ObjectMapper mapper;
    private final Duration timeout;
    private final AtomicBoolean indexReady = new AtomicBoolean(false);

    public ElasticsearchEmbeddingStore(HttpClient http, URI baseUri, String indexName, ObjectMapper mapper, Duration timeout) {
        this.http = http;
        this.baseUri = baseUri;
        this.indexName = indexName;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    public void ensureIndexExists() {
        if (indexReady.get()) {
            return;
        }
        long t0 = System.nanoTime();
        HttpResponse<String> head = send(request("/" + indexName).method("HEAD", HttpRequest.BodyPublishers.noBody()).build(), "indexExists");
        if (head.statusCode() == 200) {
            indexReady.set(true);
            logger.info("es.index.ensure.skip index={}", indexName);
            return;
        }
        if (head.statusCode() != 404) {
            throw unexpected("indexExists", head);
        }
        HttpResponse<String> resp = send(request("/" + indexName)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(loadResource(MAPPING_RESOURCE), StandardCharsets.UTF_8))
                .build(), "createIndex");
        // 400 resource_already_exists when another node created it first
        if (!isOk(resp) && !(resp.statusCode() == 400 && resp.body() != null && resp.body().contains("resource_already_exists"))) {
            throw unexpected("createIndex", resp);
        }
        indexReady.set(true);
        logger.info("es.index.ensure.ok index={} tookMs={}", indexName, (System.nanoTime() - t0) / 1_000_000L);
    }

    @Override
    public boolean upsert(EmbeddingRecord record) {
        ensureIndexExists();
        String body;
        try {
            body = mapper.writeValueAsString(record);
        } catch (IOException e) {
            throw new SyncException(SyncErrorCode.INTERNAL, "cannot serialize record chunkHash=" + record.getChunkHash(), e);
        }
        HttpResponse<String> resp = send(request("/" + indexName + "/_create/" + encode(record.getChunkHash()))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build(), "upsert");
        if (resp.statusCode() == 409) {
            return false;
        }
        if (!isOk(resp)) {
            throw unexpected("upsert", resp);
        }
        return true;
    }

    @Override
    public boolean contains(String chunkHash) {
        ensureIndexExists();
        HttpResponse<String> resp = send(request("/" + indexName + "/_doc/" + encode(chunkHash))
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build(), "contains");
        if (resp.statusCode() == 404) {
            return false;
        }
        if (!isOk(resp)) {
            throw unexpected("contains", resp);
        }
        return true;
    }

    @Override
    public Optional<EmbeddingRecord> get(String chunkHash) {
        ensureIndexExists();
        HttpResponse<String> resp = send(request("/" + indexName + "/_doc/" + encode(chunkHash))
                .header("Accept", "application/json")
                .GET()
                .build(), "get");
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (!isOk(resp)) {
            throw unexpected("get", resp);
        }
        try {
            JsonNode root = mapper.readTree(resp.body());
            if (!root.path("found").asBoolean(false)) {
                return Optional.empty();
            }
            return Optional.of(mapper.treeToValue(root.path("_source"), EmbeddingRecord.class));
        } catch (IOException e) {
            throw new SyncException(SyncErrorCode.INTERNAL, "cannot parse record chunkHash=" + chunkHash, e);
        }
    }

    @Override
    public int delete(Collection<String> chunkHashes) {
        if (chunkHashes == null || chunkHashes.isEmpty()) {
            return 0;
        }
        ensureIndexExists();
        StringBuilder sb = new StringBuilder();
        for (String h : chunkHashes) {
            sb.append("{\"delete\":{\"_index\":\"").append(indexName).append("\",\"_id\":\"").append(h).append("\"}}\n");
        }
        long t0 = System.nanoTime();
        HttpResponse<String> resp = send(request("/_bulk")
                .header("Content-Type", "application/x-ndjson")
                .POST(HttpRequest.BodyPublishers.ofString(sb.toString(), StandardCharsets.UTF_8))
                .build(), "delete");
        if (!isOk(resp)) {
            throw unexpected("delete", resp);
        }
        int deleted = 0;
        try {
            for (JsonNode item : mapper.readTree(resp.body()).path("items")) {
                if ("deleted".equals(item.path("delete").path("result").asText())) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            throw new SyncException(SyncErrorCode.INTERNAL, "cannot parse bulk delete response", e);
        }
        logger.info("es.bulk.delete ok index={} requested={} deleted={} tookMs={}", indexName, chunkHashes.size(), deleted, (System.nanoTime() - t0) / 1_000_000L);
        return deleted;
    }

    @Override
    public String name() {
        return "elasticsearch:" + indexName;
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(baseUri.resolve(path)).timeout(timeout);
    }

    private HttpResponse<String> send(HttpRequest req, String action) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (resp.statusCode() >= 500) {
                throw new TransientNetworkException("Elasticsearch " + action + " failed status=" + resp.statusCode() + " index=" + indexName);
            }
            return resp;
        } catch (IOException e) {
            throw new TransientNetworkException("Elasticsearch " + action + " failed es=" + baseUri + " cause=" + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientNetworkException("Elasticsearch " + action + " interrupted", e);
        }
    }

    private static boolean isOk(HttpResponse<String> resp) {
        return resp.statusCode() >= HttpURLConnection.HTTP_OK && resp.statusCode() < 300;
    }

    private SyncException unexpected(String action, HttpResponse<String> resp) {
        return new SyncException(SyncErrorCode.INTERNAL, "Elasticsearch " + action + " unexpected status=" + resp.statusCode()
                + " index=" + indexName + " body=" + truncate(resp.body(), 400));
    }

    private static String encode(String id) {
        return URLEncoder.encode(id == null ? "" : id, StandardCharsets.UTF_8);
    }

    private static String loadResource(String path) {
        try (InputStream in = ElasticsearchEmbeddingStore.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("cannot read resource " + path, e);
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }
}
