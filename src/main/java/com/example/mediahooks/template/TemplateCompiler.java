package com.example.mediahooks.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.re2j.Matcher;
import com.google.re2j.Pattern;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Renders a JSON payload template against an event data tree.
 * <p>
 * Every string value in the template may hold {@code {{dotted.path}}}
 * placeholders. Each one is resolved from the root of the data tree; a path
 * that does not fully resolve is left in place as written. Object keys,
 * array order and non-string scalars are kept as they are.
 * <p>
 * The compiler is stateless and never mutates its inputs.
 */
@Component
public class TemplateCompiler {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    public JsonNode compile(JsonNode template, JsonNode data) {
        if (template == null) {
            return null;
        }
        if (template.isObject()) {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = template.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                result.set(field.getKey(), compile(field.getValue(), data));
            }
            return result;
        }
        if (template.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode(template.size());
            for (JsonNode element : template) {
                result.add(compile(element, data));
            }
            return result;
        }
        if (template.isTextual()) {
            return TextNode.valueOf(render(template.asText(), data));
        }
        return template;
    }

    /**
     * Substitutes the placeholders of a single string.
     */
    public String render(String text, JsonNode data) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = null;
        int last = 0;
        while (matcher.find()) {
            if (out == null) {
                out = new StringBuilder(text.length());
            }
            out.append(text, last, matcher.start());
            JsonNode value = resolve(matcher.group(1).trim(), data);
            out.append(value == null ? matcher.group() : asText(value));
            last = matcher.end();
        }
        if (out == null) {
            return text;
        }
        out.append(text, last, text.length());
        return out.toString();
    }

    /**
     * Walks {@code path} segment by segment. Returns {@code null} when any
     * segment is missing or an intermediate value is null or not an object.
     */
    JsonNode resolve(String path, JsonNode data) {
        JsonNode current = data;
        for (String segment : path.split("\\.", -1)) {
            if (current == null || !current.isContainerNode()) {
                return null;
            }
            current = current.isArray() ? arrayElement(current, segment) : current.get(segment);
        }
        return current;
    }

    private static JsonNode arrayElement(JsonNode array, String segment) {
        try {
            return array.get(Integer.parseInt(segment));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String asText(JsonNode value) {
        if (value.isValueNode()) {
            return value.isNull() ? "null" : value.asText();
        }
        return value.toString();
    }
}
