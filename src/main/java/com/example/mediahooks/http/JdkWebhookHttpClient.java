package com.example.mediahooks.http;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link WebhookHttpClient} backed by {@link java.net.http.HttpClient}.
 * <p>
 * The configured timeout bounds the connect phase and, separately, the whole
 * exchange including the response body. Only the first
 * {@link #MAX_RESPONSE_BODY_BYTES} bytes of a response body are kept.
 */
@Component
@Slf4j
public class JdkWebhookHttpClient implements WebhookHttpClient {

    static final int MAX_RESPONSE_BODY_BYTES = 64 * 1024;

    // Managed by the JDK client itself
    private static final Set<String> RESTRICTED_HEADERS = Set.of("content-length", "host", "connection",
            "expect", "upgrade");

    private final HttpClient httpClient;
    private final Duration timeout;

    public JdkWebhookHttpClient(@Value("${app.webhook.http.timeout:10s}") Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public WebhookHttpResponse send(WebhookHttpRequest request) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(request.getUrl()))
                .timeout(timeout)
                .method(request.getMethod(), request.getBody() == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(request.getBody()));

        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            if (RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                log.debug("[Webhook] Skipping restricted header {} for {}", header.getKey(), request.getUrl());
                continue;
            }
            builder.header(header.getKey(), header.getValue());
        }

        CompletableFuture<HttpResponse<String>> exchange = httpClient.sendAsync(builder.build(),
                TruncatingBodySubscriber.handler(MAX_RESPONSE_BODY_BYTES));
        try {
            HttpResponse<String> response = exchange.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return new WebhookHttpResponse(response.statusCode(), response.body());
        } catch (TimeoutException e) {
            exchange.cancel(true);
            throw new HttpTimeoutException("No complete response from " + request.getUrl() + " within " + timeout);
        } catch (InterruptedException e) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while calling " + request.getUrl());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Request to " + request.getUrl() + " failed: " + cause.getMessage(), cause);
        }
    }

    public Duration getTimeout() {
        return timeout;
    }
}
