package com.zzf.codesync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.codesync.client.CycleResult;
import com.zzf.codesync.client.CycleStatus;
import com.zzf.codesync.client.HttpSyncTransport;
import com.zzf.codesync.client.ProjectConfig;
import com.zzf.codesync.client.RetryPolicy;
import com.zzf.codesync.client.SyncCycleRunner;
import com.zzf.codesync.protocol.ProjectListResponse;
import com.zzf.codesync.protocol.ProjectSummary;
import com.zzf.codesync.protocol.RegisterProjectRequest;
import com.zzf.codesync.protocol.RegisterProjectResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.metrics.AutoConfigureMetrics;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@AutoConfigureMetrics
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class CodeSyncApplicationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @TempDir
    Path tempDir;

    @Test
    public void testHealthEndpoint() {
        ResponseEntity<String> resp = restTemplate.getForEntity(url("/actuator/health"), String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertTrue(resp.getBody().contains("\"status\""));
    }

    @Test
    public void testPrometheusEndpoint() {
        ResponseEntity<String> resp = restTemplate.getForEntity(url("/actuator/prometheus"), String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertTrue(resp.getBody().contains("# TYPE"));
    }

    @Test
    public void testApiHealth() {
        ResponseEntity<String> resp = restTemplate.getForEntity(url("/api/health"), String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertTrue(resp.getBody().contains("\"status\""));
    }

    @Test
    public void testRegisterListsProject() {
        String projectPath = tempDir.resolve("registered").toString();
        ResponseEntity<RegisterProjectResponse> resp = restTemplate.postForEntity(url("/api/projects/register"),
                new RegisterProjectRequest(projectPath, "registered"), RegisterProjectResponse.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());

        ProjectListResponse list = restTemplate.getForObject(url("/api/projects"), ProjectListResponse.class);
        boolean found = false;
        for (ProjectSummary p : list.getProjects()) {
            if (projectPath.equals(p.getProjectId())) {
                found = true;
                assertEquals("registered", p.getProjectName());
            }
        }
        assertTrue(found);
    }

    @Test
    public void testSyncCycleOverHttpThenQuery() throws Exception {
        Path root = Files.createDirectories(tempDir.resolve("synced"));
        Files.createDirectories(root.resolve("src"));
        Files.write(root.resolve("src/Greeter.java"),
                "class Greeter {\n    String greet() { return \"hello\"; }\n}\n".getBytes(StandardCharsets.UTF_8));
        Files.write(root.resolve("README.md"), "# greeter\n".getBytes(StandardCharsets.UTF_8));

        HttpSyncTransport transport = new HttpSyncTransport(HttpClient.newHttpClient(),
                URI.create("http://localhost:" + port), objectMapper, Duration.ofSeconds(10));
        SyncCycleRunner runner = new SyncCycleRunner(transport, new RetryPolicy(3, 10, 2.0, 100), 50, 1024 * 1024);
        ProjectConfig project = ProjectConfig.of(root.toString(), root);

        CycleResult first = runner.runCycle(project);
        assertEquals(CycleStatus.COMMITTED, first.getStatus());
        assertEquals(first.getClientRootHash(), first.getAcknowledgedRootHash());

        CycleResult second = runner.runCycle(project);
        assertEquals(CycleStatus.UP_TO_DATE, second.getStatus());

        ResponseEntity<String> hits = restTemplate.getForEntity(
                url("/api/projects/query?projectId={p}&q={q}&k=3"), String.class, root.toString(), "greet hello");
        assertEquals(HttpStatus.OK, hits.getStatusCode());
        assertTrue(hits.getBody().contains("src/Greeter.java"));
    }

    @Test
    public void testUnknownSessionIsConflict() {
        String body = "{\"projectId\":\"" + tempDir.resolve("nobody").toString().replace("\\", "\\\\")
                + "\",\"sessionId\":\"missing\",\"files\":[]}";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> resp = restTemplate.postForEntity(url("/api/sync/push"),
                new HttpEntity<String>(body, headers), String.class);
        assertEquals(HttpStatus.CONFLICT, resp.getStatusCode());
        assertTrue(resp.getBody().contains("UNKNOWN_SESSION"));
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }
}
