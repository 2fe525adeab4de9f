package com.globalai.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum PositionSide {
    LONG,
    SHORT;

    public OrderSide toOrderSide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    @JsonCreator
    public static PositionSide fromValue(String value) {
        if (value == null) {
            return null;
        }
        return PositionSide.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
