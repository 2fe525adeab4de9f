package com.globalai.backend.model;

public enum SnapshotSource {
    PROVIDER,
    CACHE,
    SYNTHETIC
}
