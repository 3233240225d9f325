package com.example.mediahooks.http;

/**
 * Response of a call that reached the remote end, whatever its status.
 */
public record WebhookHttpResponse(int statusCode, String body) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
