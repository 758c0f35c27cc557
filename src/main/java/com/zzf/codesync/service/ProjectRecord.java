package com.zzf.codesync.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persisted server state of one project: the acknowledged root hash and, for every
 * acknowledged file, the ordered chunk hashes its embeddings are stored under.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectRecord {
    private String projectId;
    private String projectKey;
    private String projectName;
    private long registeredAt;
    private long lastSync;
    private String acknowledgedRootHash;
    private int fileCount;
    @Builder.Default
    private Map<String, List<String>> pathChunks = new TreeMap<String, List<String>>();
}
