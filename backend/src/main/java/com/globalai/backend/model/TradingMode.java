package com.globalai.backend.model;

public enum TradingMode {
    PAPER,
    LIVE;

    public static TradingMode of(boolean paper) {
        return paper ? PAPER : LIVE;
    }
}
