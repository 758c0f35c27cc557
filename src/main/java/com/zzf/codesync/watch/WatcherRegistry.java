package com.zzf.codesync.watch;

import com.zzf.codesync.client.CycleResult;
import com.zzf.codesync.client.CycleRunner;
import com.zzf.codesync.client.ProjectConfig;
import com.zzf.codesync.client.ProjectRootDetector;
import com.zzf.codesync.config.SyncProperties;
import com.zzf.codesync.core.util.ProjectKeys;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide set of watched projects. Cycles of different projects run concurrently on a
 * shared worker pool; each project's watcher keeps its own cycles sequential.
 */
@Component
public class WatcherRegistry implements InitializingBean, DisposableBean {
    private static final Logger logger = LoggerFactory.getLogger(WatcherRegistry.class);

    private final SyncProperties properties;
    private final CycleRunner runner;
    private final ExecutorService worker;
    private final ScheduledExecutorService scheduler;
    private final Map<String, WatchHandle> handles = new ConcurrentHashMap<String, WatchHandle>();

    @Autowired
    public WatcherRegistry(SyncProperties properties, CycleRunner runner) {
        this(properties, runner,
                Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors() / 2), daemon("codesync-cycle")),
                Executors.newSingleThreadScheduledExecutor(daemon("codesync-trigger")));
    }

    public WatcherRegistry(SyncProperties properties, CycleRunner runner, ExecutorService worker, ScheduledExecutorService scheduler) {
        this.properties = properties;
        this.runner = runner;
        this.worker = worker;
        this.scheduler = scheduler;
    }

    @Override
    public void afterPropertiesSet() {
        SyncProperties.Client client = properties.getClient();
        if (!client.isEnabled()) {
            logger.info("watch.autostart enabled=false");
            return;
        }
        logger.info("watch.autostart enabled=true projects={} server={}", client.getProjects().size(), client.getServerUrl());
        ProjectRootDetector detector = new ProjectRootDetector();
        for (SyncProperties.Project p : client.getProjects()) {
            if (p.getRoot() == null || p.getRoot().trim().isEmpty()) {
                logger.warn("watch.autostart skip reason=no_root projectId={}", p.getProjectId());
                continue;
            }
            Path root = detector.detectOrSelf(Paths.get(p.getRoot()));
            String projectId = p.getProjectId() == null || p.getProjectId().trim().isEmpty() ? root.toString() : p.getProjectId();
            try {
                start(new ProjectConfig(projectId, root, p.getName(), client.getWatch().isFileEvents(),
                        client.getWatch().getDebounceMs(), client.getWatch().getIntervalMs()));
            } catch (SyncException e) {
                logger.error("watch.autostart failed projectId={} err={}", projectId, e.getMessage());
            }
        }
    }

    @Override
    public void destroy() {
        stopAll();
    }

    public WatchHandle start(ProjectConfig project) {
        String key = ProjectKeys.projectKey(project.getProjectId());
        WatchHandle existing = handles.get(key);
        if (existing != null && existing.isActive()) {
            logger.info("watch.start skip reason=already_watching projectId={}", project.getProjectId());
            return existing;
        }
        ChangeWatcher watcher = new ChangeWatcher(project, runner, worker, scheduler, this::onResult);
        WatchHandle handle = new WatchHandle(project.getProjectId(), watcher);
        handles.put(key, handle);
        try {
            watcher.start();
        } catch (IOException e) {
            handles.remove(key, handle);
            watcher.stop();
            throw new SyncException(SyncErrorCode.ENUMERATION, "cannot watch " + project.getRoot() + ": " + e.getMessage(), e);
        }
        return handle;
    }

    public void stop(WatchHandle handle) {
        if (handle == null) {
            return;
        }
        handles.remove(ProjectKeys.projectKey(handle.getProjectId()), handle);
        handle.watcher().stop();
    }

    public void stopAll() {
        List<WatchHandle> all = new ArrayList<WatchHandle>(handles.values());
        for (WatchHandle h : all) {
            stop(h);
        }
        scheduler.shutdownNow();
        worker.shutdownNow();
        logger.info("watch.stopAll ok stopped={}", all.size());
    }

    public List<WatchHandle> handles() {
        return new ArrayList<WatchHandle>(handles.values());
    }

    private void onResult(CycleResult result) {
        if (result.isSuccess()) {
            logger.info("watch.cycle projectId={} status={} tookMs={}", result.getProjectId(), result.getStatus(), result.getTookMs());
        } else {
            logger.warn("watch.cycle projectId={} status={} rejected={} pending={} error={} tookMs={}", result.getProjectId(), result.getStatus(),
                    result.getRejected().size(), result.getPending().size(), result.getErrorMessage(), result.getTookMs());
        }
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
