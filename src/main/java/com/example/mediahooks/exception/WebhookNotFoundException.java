package com.example.mediahooks.exception;

public class WebhookNotFoundException extends RuntimeException {

    public WebhookNotFoundException(Long id) {
        super("Webhook " + id + " not found");
    }
}
