package com.example.mediahooks.controller;

import com.example.mediahooks.event.MediaEventBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.Map;

/**
 * 外部事件入口：将事件发布到事件总线，不等待 webhook 投递完成。
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class EventController {

    private final MediaEventBus eventBus;

    @PostMapping("/{eventName}")
    public ResponseEntity<String> publish(@PathVariable String eventName,
            @RequestBody(required = false) Map<String, Object> data) {
        if (!eventBus.hasSubscribers(eventName)) {
            log.info("[EventBus] Event {} received but nothing subscribes to it", eventName);
        }
        eventBus.publish(eventName, data == null ? Collections.emptyMap() : data);
        return ResponseEntity.accepted().body("Accepted");
    }
}
