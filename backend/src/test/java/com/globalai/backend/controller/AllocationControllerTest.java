package com.globalai.backend.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("offline")
class AllocationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void allocatesDefaultStrategyOnSyntheticPrices() throws Exception {
        mockMvc.perform(post("/api/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalCapital\":100000,\"allocationPercent\":50,\"broker\":\"alpaca\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategyId").value("global-ai-long-short"))
                .andExpect(jsonPath("$.allocatedCapital").value(50000.0))
                .andExpect(jsonPath("$.aborted").value(false))
                .andExpect(jsonPath("$.degraded").value(true))
                .andExpect(jsonPath("$.orders", hasSize(9)))
                .andExpect(jsonPath("$.orders[0].brokerSymbol").value("NVDA"))
                .andExpect(jsonPath("$.orders[0].side").value("BUY"))
                .andExpect(jsonPath("$.orders[0].quantity").value(8.566533))
                .andExpect(jsonPath("$.orders[*].priceSource", everyItem(is("SYNTHETIC"))))
                .andExpect(jsonPath("$.warnings[?(@.code == 'UNMAPPED_INSTRUMENT')].ticker").value(contains("TEP")))
                .andExpect(jsonPath("$.warnings[?(@.code == 'DEGRADED_PRICE')]", hasSize(9)))
                .andExpect(jsonPath("$.metrics.longExposure").value(30000.0))
                .andExpect(jsonPath("$.metrics.shortExposure").value(-15000.0));
    }

    @Test
    void swissquoteUsesVenueListingsAndWholeShares() throws Exception {
        mockMvc.perform(post("/api/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalCapital\":100000,\"allocationPercent\":50,\"broker\":\"SWISSQUOTE\","
                                + "\"strategyId\":\"global-ai-long-short\",\"strategyVersion\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orders", hasSize(10)))
                .andExpect(jsonPath("$.orders[2].brokerSymbol").value("ASML.AS"))
                .andExpect(jsonPath("$.orders[2].quantity").value(8))
                .andExpect(jsonPath("$.orders[8].brokerSymbol").value("WPP.L"))
                .andExpect(jsonPath("$.orders[8].quantity").value(371));
    }

    @Test
    void missingCapitalIsAValidationError() throws Exception {
        mockMvc.perform(post("/api/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"allocationPercent\":50,\"broker\":\"alpaca\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.details[0].field").value("totalCapital"));
    }

    @Test
    void percentAboveHundredIsRejected() throws Exception {
        mockMvc.perform(post("/api/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalCapital\":100000,\"allocationPercent\":150,\"broker\":\"alpaca\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("allocationPercent must be between 0 and 100"));
    }

    @Test
    void unknownBrokerOrStrategyIsNotFound() throws Exception {
        mockMvc.perform(post("/api/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalCapital\":100000,\"allocationPercent\":50,\"broker\":\"ibkr\"}"))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/allocations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalCapital\":100000,\"allocationPercent\":50,\"broker\":\"alpaca\",\"strategyId\":\"nope\"}"))
                .andExpect(status().isNotFound());
    }
}
