package com.example.mediahooks.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "webhooks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Webhook {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, length = 2048)
    private String url;

    private String method; // null means POST

    @Column(columnDefinition = "TEXT")
    private String headers; // JSON object, e.g. {"Authorization":"Bearer ..."}

    @Column(columnDefinition = "TEXT")
    private String payload; // JSON template with {{path}} placeholders

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TriggerType triggerType = TriggerType.EVENT;

    @Column(length = 100)
    private String eventType; // only for EVENT webhooks, e.g. "playback_started"

    @Builder.Default
    private boolean enabled = true;

    private LocalDateTime lastTriggered;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
