package com.globalai.backend.model;

public record AllocationWarning(String ticker, WarningCode code, String message) {}
