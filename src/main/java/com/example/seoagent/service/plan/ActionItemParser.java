package com.example.seoagent.service.plan;

import com.example.seoagent.model.ActionCategory;
import com.example.seoagent.model.ActionItem;
import com.example.seoagent.model.Level;
import com.example.seoagent.model.Priority;
import com.example.seoagent.model.Timeframe;
import com.example.seoagent.model.ValueEnum;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Разбирает пункты плана из ответа модели. Значения вне перечислений заменяются значениями по умолчанию,
 * пункт при этом не отбрасывается.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionItemParser {

    static final String DEFAULT_TITLE = "Untitled Action";
    static final String DEFAULT_DESCRIPTION = "No description provided";
    static final String DEFAULT_STEP = "Review and implement this action";
    static final String DEFAULT_IMPROVEMENT = "Improved SEO performance";

    private final JsonResponseReader jsonReader;

    /**
     * @throws SynthesisParseException если в ответе нет непустого JSON-массива
     */
    public List<ActionItem> parse(String response) {
        JsonNode array = jsonReader.readArray(response);
        if (array.isEmpty()) {
            throw new SynthesisParseException("Action item array is empty");
        }

        List<ActionItem> items = new ArrayList<>(array.size());
        Set<String> usedIds = new HashSet<>();
        for (int i = 0; i < array.size(); i++) {
            JsonNode node = array.get(i).isObject() ? array.get(i) : JsonNodeFactory.instance.objectNode();
            items.add(toItem(node, i, usedIds));
        }
        return items;
    }

    private ActionItem toItem(JsonNode node, int index, Set<String> usedIds) {
        String id = JsonResponseReader.text(node, "id");
        if (id == null || !usedIds.add(id)) {
            id = uniqueId(index + 1, usedIds);
        }

        List<String> steps = JsonResponseReader.stringList(node, "steps");

        return ActionItem.builder()
                .id(id)
                .title(orDefault(JsonResponseReader.text(node, "title"), DEFAULT_TITLE))
                .description(orDefault(JsonResponseReader.text(node, "description"), DEFAULT_DESCRIPTION))
                .priority(coerce(Priority.class, node, "priority", Priority.MEDIUM))
                .impact(coerce(Level.class, node, "impact", Level.MEDIUM))
                .effort(coerce(Level.class, node, "effort", Level.MEDIUM))
                .category(coerce(ActionCategory.class, node, "category", ActionCategory.TECHNICAL))
                .timeframe(coerce(Timeframe.class, node, "timeframe", Timeframe.THIS_WEEK))
                .steps(steps != null ? steps : new ArrayList<>(List.of(DEFAULT_STEP)))
                .tools(JsonResponseReader.stringList(node, "tools"))
                .expectedImprovement(orDefault(JsonResponseReader.text(node, "expectedImprovement"), DEFAULT_IMPROVEMENT))
                .dependencies(JsonResponseReader.stringList(node, "dependencies"))
                .build();
    }

    private static <E extends Enum<E> & ValueEnum> E coerce(Class<E> type, JsonNode node, String field, E fallback) {
        String raw = JsonResponseReader.text(node, field);
        return ValueEnum.fromValue(type, raw).orElseGet(() -> {
            log.debug("Coercing {}='{}' to '{}'", field, raw, fallback.getValue());
            return fallback;
        });
    }

    private static String uniqueId(int position, Set<String> usedIds) {
        String candidate = "action_" + position;
        int suffix = 1;
        while (!usedIds.add(candidate)) {
            candidate = "action_" + position + "_" + suffix++;
        }
        return candidate;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
