package com.example.mediahooks.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * In-process publish/subscribe channel for named media events.
 * <p>
 * One bus exists per application context; producers and subscribers get it
 * injected. {@link #publish(String, Map)} hands every handler invocation to
 * the {@code taskExecutor} pool and returns at once, so producers never wait
 * for webhook delivery.
 *
 * <pre>{@code
 * eventBus.publish(MediaEventNames.PLAYBACK_STARTED, Map.of("userName", "alice"));
 * }</pre>
 */
@Component
@Slf4j
public class MediaEventBus {

    private final Map<String, List<MediaEventHandler>> handlers = new ConcurrentHashMap<>();
    private final Executor executor;

    public MediaEventBus(@Qualifier("taskExecutor") Executor executor) {
        this.executor = executor;
    }

    public void subscribe(String eventName, MediaEventHandler handler) {
        handlers.computeIfAbsent(eventName, name -> new CopyOnWriteArrayList<>()).add(handler);
        log.info("[EventBus] Handler subscribed to {}", eventName);
    }

    /**
     * Fires all handlers of {@code eventName} asynchronously. Events nobody
     * subscribed to are dropped.
     */
    public void publish(String eventName, Map<String, Object> data) {
        List<MediaEventHandler> subscribers = handlers.get(eventName);
        if (subscribers == null || subscribers.isEmpty()) {
            log.debug("[EventBus] No subscribers for {}, event dropped", eventName);
            return;
        }

        MediaEvent event = new MediaEvent(eventName, data);
        log.debug("[EventBus] Publishing {} to {} handler(s)", eventName, subscribers.size());
        for (MediaEventHandler handler : subscribers) {
            try {
                executor.execute(() -> invoke(handler, event));
            } catch (RejectedExecutionException e) {
                log.error("[EventBus] Executor rejected handler for {}: {}", eventName, e.getMessage());
            }
        }
    }

    public boolean hasSubscribers(String eventName) {
        List<MediaEventHandler> subscribers = handlers.get(eventName);
        return subscribers != null && !subscribers.isEmpty();
    }

    private void invoke(MediaEventHandler handler, MediaEvent event) {
        try {
            handler.handle(event);
        } catch (Exception e) {
            log.error("[EventBus] Handler for {} failed: {}", event.name(), e.getMessage(), e);
        }
    }
}
