package com.globalai.backend.service.execution;

import com.globalai.backend.model.Broker;
import com.globalai.backend.model.BrokerCredentials;
import com.globalai.backend.model.OrderSide;

import java.math.BigDecimal;

/**
 * Broker REST integration. Any broker that can authenticate, answer a cheap account lookup and
 * accept {@code submitOrder(symbol, qty, side, orderType)} can be plugged in.
 */
public interface BrokerOrderClient {

    Broker broker();

    /**
     * @throws com.globalai.backend.exception.ConnectionFailedException when the broker rejects or cannot be reached
     */
    BrokerSession authenticate(BrokerCredentials credentials);

    void ping(BrokerSession session);

    /**
     * @throws com.globalai.backend.exception.BrokerOrderException when this single order is rejected
     */
    BrokerOrderAck submitOrder(BrokerSession session, BrokerOrderRequest request);

    record BrokerOrderRequest(String symbol, BigDecimal quantity, OrderSide side, String orderType) {}

    record BrokerOrderAck(String id, String status) {}
}
