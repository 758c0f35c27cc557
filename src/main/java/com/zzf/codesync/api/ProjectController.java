package com.zzf.codesync.api;

import com.zzf.codesync.protocol.HealthResponse;
import com.zzf.codesync.protocol.ProjectListResponse;
import com.zzf.codesync.protocol.RegisterProjectRequest;
import com.zzf.codesync.protocol.RegisterProjectResponse;
import com.zzf.codesync.service.ProjectRegistryService;
import com.zzf.codesync.service.QueryHit;
import com.zzf.codesync.service.VectorQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public final class ProjectController {
    private final ProjectRegistryService projectRegistryService;
    private final VectorQueryService vectorQueryService;

    public ProjectController(ProjectRegistryService projectRegistryService, VectorQueryService vectorQueryService) {
        this.projectRegistryService = projectRegistryService;
        this.vectorQueryService = vectorQueryService;
    }

    @GetMapping("/api/health")
    public HealthResponse health() {
        return projectRegistryService.health();
    }

    @PostMapping("/api/projects/register")
    public RegisterProjectResponse register(@RequestBody RegisterProjectRequest req) {
        return projectRegistryService.register(req);
    }

    @GetMapping("/api/projects")
    public ProjectListResponse list() {
        return projectRegistryService.list();
    }

    @GetMapping("/api/projects/query")
    public List<QueryHit> query(
            @RequestParam("projectId") String projectId,
            @RequestParam("q") String q,
            @RequestParam(value = "k", defaultValue = "5") int k
    ) {
        return vectorQueryService.query(projectId, q, k);
    }
}
