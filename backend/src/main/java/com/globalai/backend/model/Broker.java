package com.globalai.backend.model;

import com.globalai.backend.exception.NotFoundException;

import java.util.Locale;

public enum Broker {
    ALPACA,
    SWISSQUOTE;

    public static Broker fromRequest(String value) {
        if (value == null || value.isBlank()) {
            throw new NotFoundException("Broker is required");
        }
        try {
            return Broker.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new NotFoundException("Unknown broker: " + value);
        }
    }
}
