package com.globalai.backend.service.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.globalai.backend.config.BrokerProperties;
import com.globalai.backend.exception.BrokerOrderException;
import com.globalai.backend.exception.ConnectionFailedException;
import com.globalai.backend.model.Broker;
import com.globalai.backend.model.BrokerCredentials;
import com.globalai.backend.model.OrderSide;
import com.globalai.backend.model.TradingMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Swissquote trading API. OAuth2 client credentials, whole shares, sells as negative quantities.
 */
@Slf4j
@Component
public class SwissquoteOrderClient extends AbstractBrokerOrderClient {

    private static final long DEFAULT_TOKEN_SECONDS = 3600;

    private final Clock clock;
    // token obtained after the session's own token expired, reused until it expires too
    private final AtomicReference<BrokerSession> refreshed = new AtomicReference<>();

    public SwissquoteOrderClient(@Qualifier("brokerRestTemplate") RestTemplate brokerRestTemplate,
                                 BrokerProperties brokerProperties,
                                 Clock clock) {
        super(brokerRestTemplate, brokerProperties);
        this.clock = clock;
    }

    @Override
    public Broker broker() {
        return Broker.SWISSQUOTE;
    }

    @Override
    public BrokerSession authenticate(BrokerCredentials credentials) {
        if (credentials == null || !credentials.isPresent()) {
            throw new ConnectionFailedException("Swissquote credentials missing");
        }
        String baseUrl = baseUrl(credentials.paper());
        BrokerSession tokenOnly = requestToken(baseUrl, credentials);
        JsonNode account = connectionCall(baseUrl + "/v1/account", HttpMethod.GET, bearer(tokenOnly), null);
        return new BrokerSession(Broker.SWISSQUOTE, credentials, tokenOnly.mode(), baseUrl,
                tokenOnly.accessToken(), tokenOnly.expiresAt(), text(account, "accountId", "account_id", "id"));
    }

    @Override
    public void ping(BrokerSession session) {
        connectionCall(session.baseUrl() + "/v1/account", HttpMethod.GET, bearer(fresh(session)), null);
    }

    @Override
    public BrokerOrderAck submitOrder(BrokerSession session, BrokerOrderRequest request) {
        BigDecimal quantity = request.quantity().setScale(0, RoundingMode.DOWN);
        if (quantity.signum() <= 0) {
            throw new BrokerOrderException("Swissquote only accepts whole shares, got " + request.quantity().toPlainString());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("financialInstrumentDetails", Map.of("stockKey", request.symbol()));
        body.put("quantity", request.side() == OrderSide.SELL ? quantity.negate() : quantity);
        body.put("executionType", request.orderType());
        body.put("timeInForce", settings().getTimeInForce());
        body.put("bestEffort", false);
        body.put("dryRun", false);

        HttpHeaders headers;
        try {
            headers = bearer(fresh(session));
        } catch (ConnectionFailedException e) {
            throw new BrokerOrderException("Swissquote token refresh failed: " + e.getMessage(), -1, e);
        }
        headers.setContentType(MediaType.APPLICATION_JSON);
        JsonNode response = orderCall(session.baseUrl() + "/v1/orders", headers, body);
        String id = text(response, "clientOrderId", "orderId", "id");
        if (id == null) {
            throw new BrokerOrderException("Swissquote accepted " + request.symbol() + " without an order id");
        }
        return new BrokerOrderAck(id, text(response, "status"));
    }

    private BrokerSession fresh(BrokerSession session) {
        Instant now = clock.instant();
        if (!session.isExpired(now)) {
            return session;
        }
        BrokerSession cached = refreshed.get();
        if (cached != null && !cached.isExpired(now) && sameLogin(cached, session)) {
            return cached;
        }
        log.info("Swissquote access token expired, requesting a new one");
        BrokerSession renewed = requestToken(session.baseUrl(), session.credentials());
        refreshed.set(renewed);
        return renewed;
    }

    private static boolean sameLogin(BrokerSession left, BrokerSession right) {
        return left.baseUrl().equals(right.baseUrl()) && left.credentials().equals(right.credentials());
    }

    private BrokerSession requestToken(String baseUrl, BrokerCredentials credentials) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", credentials.apiKey());
        form.add("client_secret", credentials.apiSecret());
        form.add("scope", "trading");
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        JsonNode token = connectionCall(baseUrl + "/oauth2/token", HttpMethod.POST, headers, form);
        String accessToken = text(token, "access_token");
        if (accessToken == null) {
            throw new ConnectionFailedException("Swissquote token response carried no access_token");
        }
        long expiresIn = token.path("expires_in").asLong(DEFAULT_TOKEN_SECONDS);
        Instant expiresAt = clock.instant().plusSeconds(expiresIn);
        return new BrokerSession(Broker.SWISSQUOTE, credentials, TradingMode.of(credentials.paper()), baseUrl,
                accessToken, expiresAt, null);
    }

    private HttpHeaders bearer(BrokerSession session) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(session.accessToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }
}
