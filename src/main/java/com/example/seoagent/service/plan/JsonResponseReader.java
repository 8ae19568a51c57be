package com.example.seoagent.service.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Достаёт JSON из ответа модели: убирает markdown-ограждения и лишний текст вокруг.
 */
@Component
@RequiredArgsConstructor
public class JsonResponseReader {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*");

    private final ObjectMapper objectMapper;

    /**
     * Читает массив от первой '[' до последней ']'.
     */
    public JsonNode readArray(String response) {
        JsonNode node = read(response, '[', ']');
        if (!node.isArray()) {
            throw new SynthesisParseException("Expected a JSON array");
        }
        return node;
    }

    /**
     * Читает объект от первой '{' до последней '}'.
     */
    public JsonNode readObject(String response) {
        JsonNode node = read(response, '{', '}');
        if (!node.isObject()) {
            throw new SynthesisParseException("Expected a JSON object");
        }
        return node;
    }

    private JsonNode read(String response, char open, char close) {
        if (response == null || response.isBlank()) {
            throw new SynthesisParseException("Empty response");
        }
        String cleaned = CODE_FENCE.matcher(response.trim()).replaceAll("");
        int start = cleaned.indexOf(open);
        int end = cleaned.lastIndexOf(close);
        if (start < 0 || end < start) {
            throw new SynthesisParseException("No JSON " + (open == '[' ? "array" : "object") + " found in response");
        }
        try {
            return objectMapper.readTree(cleaned.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new SynthesisParseException("Malformed JSON in response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Непустой текст поля или null.
     */
    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Строки массива или null, если поле не массив.
     */
    public static List<String> stringList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return null;
        }
        List<String> items = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (!element.isNull()) {
                items.add(element.isValueNode() ? element.asText() : element.toString());
            }
        }
        return items;
    }
}
