package com.example.mediahooks.http;

import java.io.IOException;

/**
 * Outbound HTTP for webhook deliveries.
 * <p>
 * Implementations return a response for every status code and throw only when
 * the call itself did not complete (connect failure, timeout, interruption).
 */
public interface WebhookHttpClient {

    WebhookHttpResponse send(WebhookHttpRequest request) throws IOException;
}
