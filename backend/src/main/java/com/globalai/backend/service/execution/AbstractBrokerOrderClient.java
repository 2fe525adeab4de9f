package com.globalai.backend.service.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.globalai.backend.config.BrokerProperties;
import com.globalai.backend.exception.BrokerOrderException;
import com.globalai.backend.exception.ConnectionFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Shared request plumbing. Connection-level calls fail with {@link ConnectionFailedException},
 * order submissions with {@link BrokerOrderException}.
 */
@Slf4j
abstract class AbstractBrokerOrderClient implements BrokerOrderClient {

    protected final RestTemplate brokerRestTemplate;
    protected final BrokerProperties brokerProperties;
    protected final ObjectMapper objectMapper = new ObjectMapper();

    protected AbstractBrokerOrderClient(RestTemplate brokerRestTemplate, BrokerProperties brokerProperties) {
        this.brokerRestTemplate = brokerRestTemplate;
        this.brokerProperties = brokerProperties;
    }

    protected BrokerProperties.Settings settings() {
        return brokerProperties.forBroker(broker());
    }

    protected String baseUrl(boolean paper) {
        String url = settings().baseUrl(paper);
        if (url == null || url.isBlank()) {
            throw new ConnectionFailedException(broker() + " " + (paper ? "paper" : "live") + " URL is not configured");
        }
        return url;
    }

    protected JsonNode connectionCall(String url, HttpMethod method, HttpHeaders headers, Object body) {
        try {
            return exchange(url, method, headers, body);
        } catch (HttpStatusCodeException e) {
            throw new ConnectionFailedException(broker() + " rejected " + method + " " + pathOf(url)
                    + " (" + e.getStatusCode().value() + ")", e);
        } catch (ResourceAccessException e) {
            throw new ConnectionFailedException(broker() + " unreachable: " + e.getMessage(), e);
        }
    }

    protected JsonNode orderCall(String url, HttpHeaders headers, Object body) {
        try {
            return exchange(url, HttpMethod.POST, headers, body);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            throw new BrokerOrderException(broker() + " order rejected (" + status + "): " + e.getResponseBodyAsString(), status, e);
        } catch (ResourceAccessException e) {
            throw new BrokerOrderException(broker() + " unreachable: " + e.getMessage(), -1, e);
        }
    }

    private JsonNode exchange(String url, HttpMethod method, HttpHeaders headers, Object body) {
        ResponseEntity<String> response = brokerRestTemplate.exchange(url, method, new HttpEntity<>(body, headers), String.class);
        String payload = response.getBody();
        if (payload == null || payload.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("{} returned a non-JSON body for {}", broker(), pathOf(url));
            return objectMapper.createObjectNode();
        }
    }

    protected static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (!value.isMissingNode() && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String pathOf(String url) {
        int schemeEnd = url.indexOf("://");
        int pathStart = schemeEnd < 0 ? -1 : url.indexOf('/', schemeEnd + 3);
        return pathStart < 0 ? url : url.substring(pathStart);
    }
}
