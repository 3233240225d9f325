package com.example.mediahooks.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable delivery view of a {@link Webhook}. Headers and payload are parsed
 * once when the row is loaded; {@code configurationError} is set when either
 * column held malformed JSON.
 */
@Value
@Builder
public class ResolvedWebhook {

    Long id;
    String name;
    String url;
    String method;
    Map<String, String> headers;
    JsonNode payload;
    String configurationError;

    public boolean hasConfigurationError() {
        return configurationError != null;
    }
}
