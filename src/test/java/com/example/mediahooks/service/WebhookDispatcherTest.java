package com.example.mediahooks.service;

import com.example.mediahooks.http.WebhookHttpClient;
import com.example.mediahooks.http.WebhookHttpRequest;
import com.example.mediahooks.http.WebhookHttpResponse;
import com.example.mediahooks.metrics.WebhookDeliveryMetrics;
import com.example.mediahooks.model.ResolvedWebhook;
import com.example.mediahooks.template.TemplateCompiler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookDispatcher Tests")
class WebhookDispatcherTest {

    private static final String DISCORD_URL = "https://discord.com/api/webhooks/123/token";

    @Mock
    private WebhookRegistry registry;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-10-16T08:30:00.123Z"), ZoneOffset.UTC);
    private SimpleMeterRegistry meterRegistry;
    private RecordingHttpClient httpClient;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        httpClient = new RecordingHttpClient();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private WebhookDispatcher dispatcher(boolean failOnErrorStatus) {
        return new WebhookDispatcher(registry, new TemplateCompiler(), httpClient, objectMapper, executor, clock,
                new WebhookDeliveryMetrics(meterRegistry), "discord.com/api/webhooks", failOnErrorStatus);
    }

    private ResolvedWebhook webhook(long id, String url, String payload) throws Exception {
        return webhook(id, url, Map.of(), payload);
    }

    private ResolvedWebhook webhook(long id, String url, Map<String, String> headers, String payload)
            throws Exception {
        return ResolvedWebhook.builder()
                .id(id)
                .name("hook-" + id)
                .url(url)
                .method("POST")
                .headers(headers)
                .payload(objectMapper.readTree(payload))
                .build();
    }

    private ResolvedWebhook broken(long id) {
        return ResolvedWebhook.builder()
                .id(id)
                .name("broken-" + id)
                .url("https://example.org/broken")
                .method("POST")
                .headers(Map.of())
                .payload(objectMapper.createObjectNode())
                .configurationError("Unexpected character")
                .build();
    }

    @Test
    @DisplayName("No matching webhooks is a no-op success")
    void noWebhooksIsNoOpSuccess() {
        when(registry.webhooksForEvent("playback_ended")).thenReturn(List.of());

        assertTrue(dispatcher(false).triggerEventWebhooks("playback_ended", Map.of("userName", "alice")));

        assertTrue(httpClient.requests.isEmpty());
        verify(registry, never()).recordDelivery(any());
    }

    @Test
    @DisplayName("Playback started renders the template against event data")
    void playbackStartedRendersTemplate() throws Exception {
        when(registry.webhooksForEvent("playback_started"))
                .thenReturn(List.of(webhook(1, "https://example.org/hook", "{\"user\":\"{{data.userName}}\"}")));

        assertTrue(dispatcher(false).triggerEventWebhooks("playback_started", Map.of("userName", "alice")));

        assertEquals(1, httpClient.requests.size());
        WebhookHttpRequest sent = httpClient.requests.peek();
        assertEquals("{\"user\":\"alice\"}", sent.getBody());
        assertEquals("POST", sent.getMethod());
        verify(registry).recordDelivery(1L);
    }

    @Test
    @DisplayName("Event data is enriched with event name and trigger time")
    void enrichesEventData() throws Exception {
        when(registry.webhooksForEvent("media_recently_added")).thenReturn(List.of(webhook(2,
                "https://example.org/hook", "{\"e\":\"{{event}}\",\"at\":\"{{triggeredAt}}\",\"t\":\"{{item.title}}\"}")));

        dispatcher(false).triggerEventWebhooks("media_recently_added", Map.of("item", Map.of("title", "Dune")));

        JsonNode body = objectMapper.readTree(httpClient.requests.peek().getBody());
        assertEquals("media_recently_added", body.get("e").asText());
        assertEquals("2026-10-16T08:30:00.123Z", body.get("at").asText());
        assertEquals("Dune", body.get("t").asText());
    }

    @Test
    @DisplayName("Generic path sends declared headers and adds a JSON content type")
    void genericPathSendsDeclaredHeaders() throws Exception {
        ResolvedWebhook hook = webhook(3, "https://example.org/hook", Map.of("Authorization", "Bearer x"),
                "{\"a\":1}");

        assertTrue(dispatcher(false).executeWebhook(hook, objectMapper.createObjectNode()));

        WebhookHttpRequest sent = httpClient.requests.peek();
        assertEquals("Bearer x", sent.getHeaders().get("Authorization"));
        assertEquals("application/json", sent.getHeaders().get("Content-Type"));
    }

    @Test
    @DisplayName("Declared content type is not overridden on the generic path")
    void genericPathKeepsDeclaredContentType() throws Exception {
        ResolvedWebhook hook = webhook(4, "https://example.org/hook", Map.of("content-type", "text/plain"), "{}");

        dispatcher(false).executeWebhook(hook, objectMapper.createObjectNode());

        WebhookHttpRequest sent = httpClient.requests.peek();
        assertEquals(Map.of("content-type", "text/plain"), sent.getHeaders());
    }

    @Test
    @DisplayName("Chat webhook gets the raw payload and only a JSON content type")
    void chatWebhookSendsRawPayload() throws Exception {
        ResolvedWebhook hook = webhook(5, DISCORD_URL, Map.of("X-Custom", "ignored"), "{\"content\":\"hi\"}");

        assertTrue(dispatcher(false).executeWebhook(hook, objectMapper.readTree("{\"content\":\"other\"}")));

        WebhookHttpRequest sent = httpClient.requests.peek();
        assertEquals("{\"content\":\"hi\"}", sent.getBody());
        assertEquals(Map.of("Content-Type", "application/json"), sent.getHeaders());
        verify(registry).recordDelivery(5L);
    }

    @Test
    @DisplayName("Chat webhook payload is never template-compiled")
    void chatWebhookSkipsTemplating() throws Exception {
        ResolvedWebhook hook = webhook(6, DISCORD_URL, "{\"content\":\"{{data.userName}} started\"}");
        when(registry.webhooksForEvent("playback_started")).thenReturn(List.of(hook));

        dispatcher(false).triggerEventWebhooks("playback_started", Map.of("userName", "alice"));

        assertEquals("{\"content\":\"{{data.userName}} started\"}", httpClient.requests.peek().getBody());
    }

    @Test
    @DisplayName("A malformed webhook fails alone while its siblings deliver")
    void malformedWebhookIsIsolated() throws Exception {
        when(registry.webhooksForEvent("playback_started")).thenReturn(List.of(
                webhook(10, "https://example.org/a", "{\"n\":\"a\"}"),
                broken(11),
                webhook(12, "https://example.org/c", "{\"n\":\"c\"}")));

        WebhookDispatcher dispatcher = dispatcher(false);
        assertTrue(dispatcher.triggerEventWebhooks("playback_started", Map.of()));

        assertEquals(2, httpClient.requests.size());
        verify(registry).recordDelivery(10L);
        verify(registry).recordDelivery(12L);
        verify(registry, never()).recordDelivery(11L);
        assertFalse(dispatcher.executeWebhook(broken(11), objectMapper.createObjectNode()));
    }

    @Test
    @DisplayName("Transport failure does not record a delivery")
    void transportFailureDoesNotRecord() throws Exception {
        httpClient.responder = request -> {
            if (request.getUrl().endsWith("/down")) {
                throw new IllegalStateException(new ConnectException("Connection refused"));
            }
            return new WebhookHttpResponse(200, "ok");
        };
        when(registry.webhooksForEvent("playback_ended")).thenReturn(List.of(
                webhook(20, "https://example.org/down", "{}"),
                webhook(21, "https://example.org/up", "{}")));

        assertTrue(dispatcher(false).triggerEventWebhooks("playback_ended", Map.of()));

        verify(registry, never()).recordDelivery(20L);
        verify(registry).recordDelivery(21L);
        assertEquals(1.0, meterRegistry.get(WebhookDeliveryMetrics.DELIVERIES)
                .tag("path", "generic").tag("outcome", "failed").counter().count());
    }

    @Test
    @DisplayName("Timeout counts as a failed delivery")
    void timeoutIsFailure() throws Exception {
        httpClient.failure = new HttpTimeoutException("request timed out");
        ResolvedWebhook hook = webhook(22, "https://example.org/slow", "{}");

        assertFalse(dispatcher(false).executeWebhook(hook, objectMapper.createObjectNode()));
        verify(registry, never()).recordDelivery(any());
    }

    @Test
    @DisplayName("Non-2xx status still records the delivery by default")
    void errorStatusStillRecorded() throws Exception {
        httpClient.responder = request -> new WebhookHttpResponse(500, "boom");
        ResolvedWebhook hook = webhook(30, "https://example.org/hook", "{}");

        assertTrue(dispatcher(false).executeWebhook(hook, objectMapper.createObjectNode()));
        verify(registry).recordDelivery(30L);
    }

    @Test
    @DisplayName("Non-2xx status fails when fail-on-error-status is enabled")
    void errorStatusFailsWhenConfigured() throws Exception {
        httpClient.responder = request -> new WebhookHttpResponse(404, "missing");
        ResolvedWebhook hook = webhook(31, "https://example.org/hook", "{}");

        assertFalse(dispatcher(true).executeWebhook(hook, objectMapper.createObjectNode()));
        verify(registry, never()).recordDelivery(any());
    }

    @Test
    @DisplayName("Resolution failure is reported as dispatch failure")
    void resolutionFailureReturnsFalse() {
        when(registry.webhooksForEvent("playback_started")).thenThrow(new IllegalStateException("db down"));

        assertFalse(dispatcher(false).triggerEventWebhooks("playback_started", Map.of()));
        assertTrue(httpClient.requests.isEmpty());
    }

    @Test
    @DisplayName("All deliveries are in flight before any completes")
    void deliversConcurrently() throws Exception {
        CountDownLatch allStarted = new CountDownLatch(3);
        httpClient.responder = request -> {
            allStarted.countDown();
            try {
                if (!allStarted.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("deliveries ran sequentially");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return new WebhookHttpResponse(204, "");
        };
        when(registry.webhooksForEvent("playback_started")).thenReturn(List.of(
                webhook(40, "https://example.org/1", "{}"),
                webhook(41, "https://example.org/2", "{}"),
                webhook(42, "https://example.org/3", "{}")));

        assertTrue(dispatcher(false).triggerEventWebhooks("playback_started", Map.of()));

        verify(registry).recordDelivery(40L);
        verify(registry).recordDelivery(41L);
        verify(registry).recordDelivery(42L);
    }

    @Test
    @DisplayName("Raw event data stays reachable under data unless the event defines it")
    void enrichKeepsDataAlias() {
        WebhookDispatcher dispatcher = dispatcher(false);

        JsonNode context = dispatcher.enrich("playback_started", Map.of("userName", "alice"));
        assertEquals("alice", context.get("userName").asText());
        assertEquals("alice", context.path("data").path("userName").asText());
        assertFalse(context.get("data").has("event"));

        JsonNode own = dispatcher.enrich("playback_started", Map.of("data", "mine"));
        assertEquals("mine", own.get("data").asText());
    }

    @Test
    void detectsChatWebhookByUrlMarker() {
        WebhookDispatcher dispatcher = dispatcher(false);
        assertTrue(dispatcher.isChatWebhook(DISCORD_URL));
        assertFalse(dispatcher.isChatWebhook("https://example.org/discord"));
        assertFalse(dispatcher.isChatWebhook(null));
    }

    @Test
    void countsDeliveriesByPath() throws Exception {
        WebhookDispatcher dispatcher = dispatcher(false);
        dispatcher.executeWebhook(webhook(50, DISCORD_URL, "{}"), objectMapper.createObjectNode());
        dispatcher.executeWebhook(webhook(51, "https://example.org/x", "{}"), objectMapper.createObjectNode());

        assertThat(meterRegistry.get(WebhookDeliveryMetrics.DELIVERIES)
                .tag("path", "chat").tag("outcome", "delivered").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get(WebhookDeliveryMetrics.DELIVERIES)
                .tag("path", "generic").tag("outcome", "delivered").counter().count()).isEqualTo(1.0);
    }

    /**
     * Records every request; answers 200 unless told otherwise.
     */
    static class RecordingHttpClient implements WebhookHttpClient {

        final Queue<WebhookHttpRequest> requests = new ConcurrentLinkedQueue<>();
        volatile Function<WebhookHttpRequest, WebhookHttpResponse> responder =
                request -> new WebhookHttpResponse(200, "ok");
        volatile IOException failure;

        @Override
        public WebhookHttpResponse send(WebhookHttpRequest request) throws IOException {
            requests.add(request);
            if (failure != null) {
                throw failure;
            }
            return responder.apply(request);
        }
    }
}
