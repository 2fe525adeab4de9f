package com.globalai.backend.controller;

import com.globalai.backend.config.BrokerProperties;
import com.globalai.backend.dto.BrokerStatusResponse;
import com.globalai.backend.dto.ConnectRequest;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.BrokerCredentials;
import com.globalai.backend.service.connection.ConnectionManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/brokers/{broker}")
@RequiredArgsConstructor
@Tag(name = "Broker")
public class BrokerConnectionController {

    private final ConnectionManager connectionManager;
    private final BrokerProperties brokerProperties;

    @GetMapping("/status")
    @Operation(summary = "Get broker connection status")
    public ResponseEntity<BrokerStatusResponse> status(@PathVariable String broker) {
        return ResponseEntity.ok(BrokerStatusResponse.from(connectionManager.connectionStatus(Broker.fromRequest(broker))));
    }

    @PostMapping("/connect")
    @Operation(summary = "Connect with supplied credentials, or the configured ones when the body is empty")
    public ResponseEntity<BrokerStatusResponse> connect(@PathVariable String broker,
                                                        @RequestBody(required = false) ConnectRequest request) {
        Broker target = Broker.fromRequest(broker);
        BrokerCredentials credentials = request != null
                ? request.toCredentials()
                : brokerProperties.forBroker(target).configuredCredentials();
        return ResponseEntity.ok(BrokerStatusResponse.from(connectionManager.connect(target, credentials)));
    }

    @PostMapping("/disconnect")
    @Operation(summary = "Drop the broker session")
    public ResponseEntity<BrokerStatusResponse> disconnect(@PathVariable String broker) {
        return ResponseEntity.ok(BrokerStatusResponse.from(connectionManager.disconnect(Broker.fromRequest(broker))));
    }

    @GetMapping("/health")
    @Operation(summary = "Ping the broker and refresh the connection status")
    public ResponseEntity<BrokerStatusResponse> health(@PathVariable String broker) {
        Broker target = Broker.fromRequest(broker);
        connectionManager.healthCheck(target);
        return ResponseEntity.ok(BrokerStatusResponse.from(connectionManager.connectionStatus(target)));
    }
}
