package com.zzf.codesync.core.merkle;

public enum NodeKind {
    FILE,
    DIRECTORY
}
