package com.zzf.codesync.watch;

/**
 * Token returned by {@link WatcherRegistry#start}; pass it back to stop watching.
 */
public final class WatchHandle {
    private final String projectId;
    private final ChangeWatcher watcher;

    WatchHandle(String projectId, ChangeWatcher watcher) {
        this.projectId = projectId;
        this.watcher = watcher;
    }

    public String getProjectId() {
        return projectId;
    }

    public boolean isActive() {
        return !watcher.isStopped();
    }

    public WatchState getState() {
        return watcher.getState();
    }

    ChangeWatcher watcher() {
        return watcher;
    }
}
