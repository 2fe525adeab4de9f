package com.globalai.backend.model;

public record CanonicalInstrument(String ticker, String displayName) {}
