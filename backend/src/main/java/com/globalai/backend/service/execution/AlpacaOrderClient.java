package com.globalai.backend.service.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.globalai.backend.config.BrokerProperties;
import com.globalai.backend.exception.BrokerOrderException;
import com.globalai.backend.exception.ConnectionFailedException;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.BrokerCredentials;
import com.globalai.backend.model.TradingMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alpaca trading API v2. Header authentication, fractional quantities.
 */
@Slf4j
@Component
public class AlpacaOrderClient extends AbstractBrokerOrderClient {

    static final String KEY_HEADER = "APCA-API-KEY-ID";
    static final String SECRET_HEADER = "APCA-API-SECRET-KEY";

    public AlpacaOrderClient(@Qualifier("brokerRestTemplate") RestTemplate brokerRestTemplate, BrokerProperties brokerProperties) {
        super(brokerRestTemplate, brokerProperties);
    }

    @Override
    public Broker broker() {
        return Broker.ALPACA;
    }

    @Override
    public BrokerSession authenticate(BrokerCredentials credentials) {
        if (credentials == null || !credentials.isPresent()) {
            throw new ConnectionFailedException("Alpaca credentials missing");
        }
        String baseUrl = baseUrl(credentials.paper());
        JsonNode account = connectionCall(baseUrl + "/v2/account", HttpMethod.GET, headers(credentials), null);
        String status = text(account, "status");
        if (status != null && !"ACTIVE".equalsIgnoreCase(status)) {
            throw new ConnectionFailedException("Alpaca account is " + status);
        }
        return new BrokerSession(Broker.ALPACA, credentials, TradingMode.of(credentials.paper()), baseUrl,
                null, null, text(account, "account_number", "id"));
    }

    @Override
    public void ping(BrokerSession session) {
        connectionCall(session.baseUrl() + "/v2/account", HttpMethod.GET, headers(session.credentials()), null);
    }

    @Override
    public BrokerOrderAck submitOrder(BrokerSession session, BrokerOrderRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", request.symbol());
        body.put("qty", request.quantity().stripTrailingZeros().toPlainString());
        body.put("side", request.side().wireValue());
        body.put("type", request.orderType());
        body.put("time_in_force", settings().getTimeInForce());

        HttpHeaders headers = headers(session.credentials());
        headers.setContentType(MediaType.APPLICATION_JSON);
        JsonNode response = orderCall(session.baseUrl() + "/v2/orders", headers, body);
        String id = text(response, "id", "client_order_id");
        if (id == null) {
            throw new BrokerOrderException("Alpaca accepted " + request.symbol() + " without an order id");
        }
        return new BrokerOrderAck(id, text(response, "status"));
    }

    private HttpHeaders headers(BrokerCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(KEY_HEADER, credentials.apiKey());
        headers.set(SECRET_HEADER, credentials.apiSecret());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }
}
