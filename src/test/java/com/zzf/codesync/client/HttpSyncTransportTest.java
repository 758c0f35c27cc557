package com.zzf.codesync.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.codesync.model.EncryptionException;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import com.zzf.codesync.model.TransientNetworkException;
import com.zzf.codesync.protocol.CommitRequest;
import com.zzf.codesync.protocol.ProbeRequest;
import com.zzf.codesync.protocol.ProbeResponse;
import com.zzf.codesync.support.FakeHttpClient;
import com.zzf.codesync.support.FakeHttpClient.FakeHttpResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpSyncTransportTest {

    @Test
    void testPostsJsonAndPropagatesTraceId() {
        FakeHttpClient http = new FakeHttpClient(new FakeHttpResponse(200, "{\"upToDate\":true,\"acknowledgedRootHash\":\"abc\"}"));
        MDC.put("traceId", "cycle-1");
        try {
            ProbeResponse resp = transport(http).probe(new ProbeRequest("/work/p", "abc"));
            assertTrue(resp.isUpToDate());
            assertEquals("abc", resp.getAcknowledgedRootHash());
        } finally {
            MDC.remove("traceId");
        }
        assertEquals("POST /api/sync/probe", http.requests().get(0));
        assertEquals("cycle-1", http.rawRequests().get(0).headers().firstValue("X-Trace-Id").orElse(null));
    }

    @Test
    void testServerErrorIsTransient() {
        FakeHttpClient http = new FakeHttpClient(new FakeHttpResponse(503, "{\"code\":\"TRANSIENT_NETWORK\",\"message\":\"busy\"}"));
        assertThrows(TransientNetworkException.class, () -> transport(http).probe(new ProbeRequest("/work/p", "abc")));
    }

    @Test
    void testEncryptionFailureIsFatal() {
        FakeHttpClient http = new FakeHttpClient(new FakeHttpResponse(500, "{\"code\":\"ENCRYPTION\",\"message\":\"key missing\"}"));
        assertThrows(EncryptionException.class, () -> transport(http).commit(new CommitRequest("/work/p", "s1")));
    }

    @Test
    void testClientErrorKeepsServerCode() {
        FakeHttpClient http = new FakeHttpClient(new FakeHttpResponse(409, "{\"code\":\"UNKNOWN_SESSION\",\"message\":\"superseded\"}"));
        SyncException e = assertThrows(SyncException.class, () -> transport(http).commit(new CommitRequest("/work/p", "s1")));
        assertEquals(SyncErrorCode.UNKNOWN_SESSION, e.getErrorCode());
        assertFalse(e instanceof TransientNetworkException);
    }

    @Test
    void testUnparsableErrorBodyIsInternal() {
        FakeHttpClient http = new FakeHttpClient(new FakeHttpResponse(400, "<html>bad gateway</html>"));
        SyncException e = assertThrows(SyncException.class, () -> transport(http).probe(new ProbeRequest("/work/p", "abc")));
        assertEquals(SyncErrorCode.INTERNAL, e.getErrorCode());
    }

    @Test
    void testConnectionFailureIsTransient() {
        FakeHttpClient http = new FakeHttpClient(new IOException("connection refused"));
        assertThrows(TransientNetworkException.class, () -> transport(http).probe(new ProbeRequest("/work/p", "abc")));
    }

    private static HttpSyncTransport transport(FakeHttpClient http) {
        return new HttpSyncTransport(http, URI.create("http://localhost:8080"), new ObjectMapper(), Duration.ofSeconds(2));
    }
}
