package com.zzf.codesync.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.codesync.model.EncryptionException;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import com.zzf.codesync.model.TransientNetworkException;
import com.zzf.codesync.protocol.CommitRequest;
import com.zzf.codesync.protocol.CommitResponse;
import com.zzf.codesync.protocol.NegotiateRequest;
import com.zzf.codesync.protocol.NegotiateResponse;
import com.zzf.codesync.protocol.ProbeRequest;
import com.zzf.codesync.protocol.ProbeResponse;
import com.zzf.codesync.protocol.PushChangesRequest;
import com.zzf.codesync.protocol.PushChangesResponse;
import com.zzf.codesync.protocol.PushRemovalsRequest;
import com.zzf.codesync.protocol.PushRemovalsResponse;
import com.zzf.codesync.protocol.SyncTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * JSON over HTTP against the server's {@code /api/sync} endpoints. Connection failures and 5xx
 * replies become {@link TransientNetworkException}, except a server-side encryption failure,
 * which is fatal.
 */
public final class HttpSyncTransport implements SyncTransport {
    private static final Logger logger = LoggerFactory.getLogger(HttpSyncTransport.class);

    private final HttpClient http;
    private final URI baseUri;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public HttpSyncTransport(HttpClient http, URI baseUri, ObjectMapper mapper, Duration timeout) {
        this.http = http;
        this.baseUri = baseUri;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    @Override
    public ProbeResponse probe(ProbeRequest request) {
        return post("/api/sync/probe", request, ProbeResponse.class);
    }

    @Override
    public NegotiateResponse negotiate(NegotiateRequest request) {
        return post("/api/sync/negotiate", request, NegotiateResponse.class);
    }

    @Override
    public PushChangesResponse pushChanges(PushChangesRequest request) {
        return post("/api/sync/push", request, PushChangesResponse.class);
    }

    @Override
    public PushRemovalsResponse pushRemovals(PushRemovalsRequest request) {
        return post("/api/sync/remove", request, PushRemovalsResponse.class);
    }

    @Override
    public CommitResponse commit(CommitRequest request) {
        return post("/api/sync/commit", request, CommitResponse.class);
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new SyncException(SyncErrorCode.INVALID_REQUEST, "cannot serialize request for " + path, e);
        }
        HttpRequest.Builder req = HttpRequest.newBuilder(baseUri.resolve(path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        String traceId = MDC.get("traceId");
        if (traceId != null) {
            req.header("X-Trace-Id", traceId);
        }
        long t0 = System.nanoTime();
        HttpResponse<String> resp;
        try {
            resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransientNetworkException("request failed path=" + path + " server=" + baseUri + " cause=" + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted path=" + path);
        }
        int status = resp.statusCode();
        logger.debug("transport.call path={} status={} reqChars={} tookMs={}", path, status, json.length(), (System.nanoTime() - t0) / 1_000_000L);
        if (status >= 200 && status < 300) {
            try {
                return mapper.readValue(resp.body(), responseType);
            } catch (IOException e) {
                throw new SyncException(SyncErrorCode.INTERNAL, "cannot parse response path=" + path + " status=" + status, e);
            }
        }
        throw toException(path, status, resp.body());
    }

    private SyncException toException(String path, int status, String body) {
        SyncErrorCode code = SyncErrorCode.INTERNAL;
        String message = body;
        try {
            JsonNode node = mapper.readTree(body == null ? "" : body);
            if (node != null && node.hasNonNull("code")) {
                code = SyncErrorCode.parse(node.get("code").asText());
                message = node.path("message").asText(body);
            }
        } catch (IOException e) {
            logger.debug("transport.error_body unparsable path={} status={}", path, status);
        }
        String text = "server rejected path=" + path + " status=" + status + " code=" + code + " msg=" + message;
        if (code == SyncErrorCode.ENCRYPTION) {
            return new EncryptionException(text);
        }
        if (status >= 500) {
            return new TransientNetworkException(text);
        }
        return new SyncException(code, text);
    }
}
