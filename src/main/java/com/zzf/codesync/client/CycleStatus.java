package com.zzf.codesync.client;

public enum CycleStatus {
    /** Server already holds this root hash. */
    UP_TO_DATE,
    COMMITTED,
    /** Committed, but some paths were rejected or not pushed and will show up again. */
    PARTIAL,
    /** Retry budget for the network ran out; nothing was committed. */
    DEGRADED,
    FAILED,
    CANCELLED
}
