package com.zzf.codesync.watch;

public enum WatchState {
    IDLE,
    RUNNING,
    /** A trigger arrived while a cycle was running; one more cycle follows. */
    RUNNING_PENDING
}
