package com.globalai.backend.service.marketdata.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

final class JsonValues {

    private JsonValues() {
    }

    static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isNumber()) {
            return null;
        }
        return value.decimalValue();
    }

    static Long longValue(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asLong() : null;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
