package com.globalai.backend.config;

import com.globalai.backend.service.marketdata.DeadlineAwareRequestFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.beans.factory.annotation.Value;

@Configuration
public class MarketDataHttpConfig {

    @Bean
    public RestTemplate marketDataRestTemplate(MarketDataProperties properties) {
        return new RestTemplate(new DeadlineAwareRequestFactory(properties.getConnectTimeout(), properties.getRequestTimeout()));
    }

    @Bean
    public RestTemplate brokerRestTemplate(
            @Value("${brokers.http.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${brokers.http.read-timeout-ms:10000}") int readTimeoutMs
    ) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
