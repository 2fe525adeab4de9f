package com.globalai.backend.model;

public enum ExecutionStatus {
    SUBMITTED,
    SIMULATED,
    FAILED
}
