package com.globalai.backend.service.execution;

import com.globalai.backend.config.BrokerProperties;
import com.globalai.backend.exception.BrokerOrderException;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.ExecutionResult;
import com.globalai.backend.model.ExecutionStatus;
import com.globalai.backend.model.Order;
import com.globalai.backend.service.connection.ConnectionManager;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sends orders to a connected broker, or simulates them when the broker is not connected. Each
 * order gets its own result; one rejection never stops the rest of the batch.
 */
@Slf4j
@Service
public class ExecutionAdapter {

    private final Map<Broker, BrokerOrderClient> clients = new EnumMap<>(Broker.class);
    private final ConnectionManager connectionManager;
    private final SimulatedExecutionService simulatedExecutionService;
    private final BrokerProperties brokerProperties;
    private final MeterRegistry meterRegistry;

    public ExecutionAdapter(List<BrokerOrderClient> clients,
                            ConnectionManager connectionManager,
                            SimulatedExecutionService simulatedExecutionService,
                            BrokerProperties brokerProperties,
                            MeterRegistry meterRegistry) {
        clients.forEach(client -> this.clients.put(client.broker(), client));
        this.connectionManager = connectionManager;
        this.simulatedExecutionService = simulatedExecutionService;
        this.brokerProperties = brokerProperties;
        this.meterRegistry = meterRegistry;
    }

    public List<ExecutionResult> execute(List<Order> orders, Broker broker) {
        Optional<BrokerSession> session = connectionManager.activeSession(broker);
        BrokerOrderClient client = clients.get(broker);
        if (session.isEmpty() || client == null) {
            log.info("{} not connected, simulating {} orders", broker, orders.size());
            List<ExecutionResult> simulated = orders.stream().map(simulatedExecutionService::simulate).toList();
            count(broker, ExecutionStatus.SIMULATED, simulated.size());
            return simulated;
        }

        String orderType = brokerProperties.forBroker(broker).getOrderType();
        List<ExecutionResult> results = new ArrayList<>(orders.size());
        for (Order order : orders) {
            ExecutionResult result = submit(client, session.get(), order, orderType);
            count(broker, result.status(), 1);
            results.add(result);
        }
        log.info("Submitted {} orders to {} ({} failed)", orders.size(), broker,
                results.stream().filter(result -> result.status() == ExecutionStatus.FAILED).count());
        return results;
    }

    private ExecutionResult submit(BrokerOrderClient client, BrokerSession session, Order order, String orderType) {
        ExecutionResult.ExecutionResultBuilder result = ExecutionResult.builder()
                .ticker(order.ticker())
                .brokerSymbol(order.brokerSymbol())
                .side(order.side())
                .quantity(order.quantity())
                .dollarAmount(order.dollarAmount());
        try {
            BrokerOrderClient.BrokerOrderAck ack = client.submitOrder(session,
                    new BrokerOrderClient.BrokerOrderRequest(order.brokerSymbol(), order.quantity(), order.side(), orderType));
            return result.status(ExecutionStatus.SUBMITTED)
                    .brokerOrderId(ack.id())
                    .brokerStatus(ack.status())
                    .build();
        } catch (BrokerOrderException e) {
            log.warn("{} order for {} failed: {}", session.broker(), order.brokerSymbol(), e.getMessage());
            return result.status(ExecutionStatus.FAILED).error(e.getMessage()).build();
        } catch (RuntimeException e) {
            log.error("Unexpected {} failure submitting {}", session.broker(), order.brokerSymbol(), e);
            return result.status(ExecutionStatus.FAILED).error(e.getMessage()).build();
        }
    }

    private void count(Broker broker, ExecutionStatus status, int amount) {
        meterRegistry.counter("broker_orders_total", "broker", broker.name(), "status", status.name()).increment(amount);
    }
}
