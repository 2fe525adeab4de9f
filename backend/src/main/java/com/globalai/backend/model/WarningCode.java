package com.globalai.backend.model;

public enum WarningCode {
    UNMAPPED_INSTRUMENT,
    PRICE_UNAVAILABLE,
    FX_UNAVAILABLE,
    QUANTITY_BELOW_MINIMUM,
    DEGRADED_PRICE,
    ALLOCATION_ABORTED
}
