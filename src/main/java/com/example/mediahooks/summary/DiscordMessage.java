package com.example.mediahooks.summary;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Discord Webhook API body.
 *
 * <pre>{@code
 * {
 *   "content": "...",
 *   "embeds": [
 *     {
 *       "title": "...",
 *       "color": 15844367,
 *       "fields": [{"name": "...", "value": "...", "inline": false}],
 *       "footer": {"text": "..."}
 *     }
 *   ]
 * }
 * }</pre>
 *
 * @see <a href="https://discord.com/developers/docs/resources/webhook#execute-webhook">Discord Webhook
 *     API</a>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscordMessage(
        @JsonProperty("content") String content,
        @JsonProperty("embeds") List<Embed> embeds) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Embed(
            @JsonProperty("title") String title,
            @JsonProperty("color") Integer color,
            @JsonProperty("fields") List<Field> fields,
            @JsonProperty("footer") Footer footer) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Field(
            @JsonProperty("name") String name,
            @JsonProperty("value") String value,
            @JsonProperty("inline") Boolean inline) {
    }

    public record Footer(@JsonProperty("text") String text) {
    }
}
