package com.example.mediahooks.event;

import com.example.mediahooks.service.WebhookDispatcher;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Connects the webhook dispatcher to every configured event name.
 */
@Component
@Slf4j
public class WebhookEventSubscriber {

    private final MediaEventBus eventBus;
    private final WebhookDispatcher dispatcher;
    private final List<String> eventNames;

    public WebhookEventSubscriber(MediaEventBus eventBus,
            WebhookDispatcher dispatcher,
            @Value("${app.webhook.events:" + MediaEventNames.PLAYBACK_STARTED + ","
                    + MediaEventNames.PLAYBACK_ENDED + ","
                    + MediaEventNames.MEDIA_RECENTLY_ADDED + "}") List<String> eventNames) {
        this.eventBus = eventBus;
        this.dispatcher = dispatcher;
        this.eventNames = eventNames;
    }

    @PostConstruct
    public void subscribe() {
        for (String eventName : eventNames) {
            String name = eventName.trim();
            if (name.isEmpty()) {
                continue;
            }
            eventBus.subscribe(name, event -> dispatcher.triggerEventWebhooks(event.name(), event.data()));
        }
        log.info("[EventBus] Webhook dispatch wired for events: {}", eventNames);
    }
}
