package com.globalai.backend.service.connection;

import com.globalai.backend.config.BrokerProperties;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.BrokerCredentials;
import com.globalai.backend.model.ConnectionState;
import com.globalai.backend.model.TradingMode;
import com.globalai.backend.service.execution.BrokerOrderClient;
import com.globalai.backend.service.execution.BrokerSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks one in-memory session per broker. Connection problems are reported through
 * {@link ConnectionState}, never thrown.
 */
@Slf4j
@Service
public class ConnectionManager {

    private final Map<Broker, BrokerOrderClient> clients = new EnumMap<>(Broker.class);
    private final Map<Broker, BrokerSession> sessions = new ConcurrentHashMap<>();
    private final Map<Broker, ConnectionState> states = new ConcurrentHashMap<>();
    private final BrokerProperties brokerProperties;
    private final Clock clock;

    public ConnectionManager(List<BrokerOrderClient> clients, BrokerProperties brokerProperties, Clock clock) {
        clients.forEach(client -> this.clients.put(client.broker(), client));
        this.brokerProperties = brokerProperties;
        this.clock = clock;
    }

    public ConnectionState connect(Broker broker, BrokerCredentials credentials) {
        if (credentials == null || !credentials.isPresent()) {
            sessions.remove(broker);
            ConnectionState state = ConnectionState.disconnected(broker, clock.instant()).toBuilder()
                    .error("Broker credentials missing")
                    .build();
            states.put(broker, state);
            return state;
        }
        BrokerOrderClient client = clients.get(broker);
        ConnectionState.ConnectionStateBuilder state = ConnectionState.builder()
                .broker(broker)
                .credentialsPresent(true)
                .mode(TradingMode.of(credentials.paper()));
        try {
            if (client == null) {
                throw new IllegalStateException("No client registered for " + broker);
            }
            BrokerSession session = client.authenticate(credentials);
            sessions.put(broker, session);
            ConnectionState connected = state.connected(true)
                    .accountId(session.accountId())
                    .lastCheckedAt(clock.instant())
                    .build();
            states.put(broker, connected);
            log.info("Connected to {} ({} mode)", broker, session.mode());
            return connected;
        } catch (RuntimeException e) {
            sessions.remove(broker);
            ConnectionState failed = state.connected(false)
                    .lastCheckedAt(clock.instant())
                    .error(e.getMessage())
                    .build();
            states.put(broker, failed);
            log.warn("Connection to {} failed: {}", broker, e.getMessage());
            return failed;
        }
    }

    public ConnectionState disconnect(Broker broker) {
        BrokerSession removed = sessions.remove(broker);
        ConnectionState state = ConnectionState.disconnected(broker, clock.instant());
        states.put(broker, state);
        if (removed != null) {
            log.info("Disconnected from {}", broker);
        }
        return state;
    }

    public boolean healthCheck(Broker broker) {
        BrokerSession session = sessions.get(broker);
        ConnectionState current = connectionStatus(broker);
        if (session == null) {
            states.put(broker, current.toBuilder().connected(false).lastCheckedAt(clock.instant()).build());
            return false;
        }
        try {
            clients.get(broker).ping(session);
            states.put(broker, current.toBuilder().connected(true).lastCheckedAt(clock.instant()).error(null).build());
            return true;
        } catch (RuntimeException e) {
            sessions.remove(broker, session);
            states.put(broker, current.toBuilder().connected(false).lastCheckedAt(clock.instant()).error(e.getMessage()).build());
            log.warn("Health check for {} failed: {}", broker, e.getMessage());
            return false;
        }
    }

    public ConnectionState connectionStatus(Broker broker) {
        return states.getOrDefault(broker, ConnectionState.disconnected(broker, clock.instant()));
    }

    public Optional<BrokerSession> activeSession(Broker broker) {
        return Optional.ofNullable(sessions.get(broker));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void connectConfigured() {
        for (Broker broker : Broker.values()) {
            BrokerCredentials credentials = brokerProperties.forBroker(broker).configuredCredentials();
            if (credentials.isPresent()) {
                connect(broker, credentials);
            }
        }
    }

    @Scheduled(fixedDelayString = "${brokers.health-check-interval-ms:300000}",
            initialDelayString = "${brokers.health-check-interval-ms:300000}")
    public void refreshHealth() {
        for (Broker broker : sessions.keySet()) {
            healthCheck(broker);
        }
    }
}
