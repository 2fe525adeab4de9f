package com.globalai.backend.model;

import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
