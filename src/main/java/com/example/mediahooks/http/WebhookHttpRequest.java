package com.example.mediahooks.http;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class WebhookHttpRequest {

    @Builder.Default
    String method = "POST";

    String url;

    @Singular
    Map<String, String> headers;

    String body;
}
