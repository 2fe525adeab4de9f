package com.globalai.backend.service.marketdata;

import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.Optional;

/**
 * Caps each provider connection's timeouts by the remaining time of the caller's
 * {@link FetchDeadline} and closes the connection when that deadline is cancelled.
 */
public class DeadlineAwareRequestFactory extends SimpleClientHttpRequestFactory {

    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public DeadlineAwareRequestFactory(Duration connectTimeout, Duration readTimeout) {
        this.connectTimeoutMs = (int) connectTimeout.toMillis();
        this.readTimeoutMs = (int) readTimeout.toMillis();
        setConnectTimeout(connectTimeoutMs);
        setReadTimeout(readTimeoutMs);
    }

    @Override
    protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
        super.prepareConnection(connection, httpMethod);
        Optional<FetchDeadline> current = FetchDeadline.current();
        if (current.isEmpty()) {
            return;
        }
        FetchDeadline deadline = current.get();
        if (deadline.isExpired()) {
            throw new IOException(deadline.isCancelled() ? "request cancelled" : "request deadline reached");
        }
        long remainingMs = Math.max(1, deadline.remaining().toMillis());
        connection.setConnectTimeout((int) Math.min(connectTimeoutMs, remainingMs));
        connection.setReadTimeout((int) Math.min(readTimeoutMs, remainingMs));
        deadline.onCancel(connection::disconnect);
    }
}
