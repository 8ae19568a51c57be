package com.example.seoagent.service.plan;

import com.example.seoagent.model.ActionCategory;
import com.example.seoagent.model.ActionItem;
import com.example.seoagent.model.Level;
import com.example.seoagent.model.Priority;
import com.example.seoagent.model.Timeframe;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ActionItemParserTest {

    private final ActionItemParser parser = new ActionItemParser(new JsonResponseReader(new ObjectMapper()));

    @Test
    void shouldParseWellFormedItems() {
        // Given
        String response = """
                [
                  {
                    "id": "action_1",
                    "title": "Add LocalBusiness schema",
                    "description": "Mark up the homepage",
                    "priority": "high",
                    "impact": "high",
                    "effort": "low",
                    "category": "technical",
                    "timeframe": "immediate",
                    "steps": ["Open schema.org", "Add JSON-LD to the homepage"],
                    "tools": ["Rich Results Test"],
                    "expectedImprovement": "Rich results in search",
                    "dependencies": []
                  }
                ]
                """;

        // When
        List<ActionItem> items = parser.parse(response);

        // Then
        assertEquals(1, items.size());
        ActionItem item = items.get(0);
        assertEquals("action_1", item.getId());
        assertEquals(Priority.HIGH, item.getPriority());
        assertEquals(Level.LOW, item.getEffort());
        assertEquals(Timeframe.IMMEDIATE, item.getTimeframe());
        assertEquals(List.of("Open schema.org", "Add JSON-LD to the homepage"), item.getSteps());
        assertEquals(List.of("Rich Results Test"), item.getTools());
    }

    @Test
    void shouldCoerceUnknownEnumValuesToDefaults() {
        String response = """
                [{"id": "a", "title": "Fix it", "priority": "urgent", "impact": "huge",
                  "effort": 3, "category": "marketing", "timeframe": "someday"}]
                """;

        ActionItem item = parser.parse(response).get(0);

        assertEquals(Priority.MEDIUM, item.getPriority());
        assertEquals(Level.MEDIUM, item.getImpact());
        assertEquals(Level.MEDIUM, item.getEffort());
        assertEquals(ActionCategory.TECHNICAL, item.getCategory());
        assertEquals(Timeframe.THIS_WEEK, item.getTimeframe());
    }

    @Test
    void shouldCoerceEnumValuesInOtherCaseToDefaults() {
        String response = """
                [{"id": "a", "title": "Fix it", "priority": "High", "impact": "LOW",
                  "effort": "low", "timeframe": "THIS_MONTH"}]
                """;

        ActionItem item = parser.parse(response).get(0);

        assertEquals(Priority.MEDIUM, item.getPriority());
        assertEquals(Level.MEDIUM, item.getImpact());
        assertEquals(Level.LOW, item.getEffort());
        assertEquals(Timeframe.THIS_WEEK, item.getTimeframe());
    }

    @Test
    void shouldFillMissingFieldsWithDefaults() {
        ActionItem item = parser.parse("[{}]").get(0);

        assertEquals("action_1", item.getId());
        assertEquals(ActionItemParser.DEFAULT_TITLE, item.getTitle());
        assertEquals(ActionItemParser.DEFAULT_DESCRIPTION, item.getDescription());
        assertEquals(List.of(ActionItemParser.DEFAULT_STEP), item.getSteps());
        assertEquals(ActionItemParser.DEFAULT_IMPROVEMENT, item.getExpectedImprovement());
        assertNull(item.getTools());
    }

    @Test
    void shouldRenumberDuplicateIds() {
        String response = """
                [{"id": "x", "title": "One"}, {"id": "x", "title": "Two"}, {"title": "Three"}]
                """;

        List<ActionItem> items = parser.parse(response);

        assertEquals(List.of("x", "action_2", "action_3"), items.stream().map(ActionItem::getId).toList());
    }

    @Test
    void shouldReadArrayWrappedInProseAndCodeFence() {
        String response = "Here is the plan:\n```json\n[{\"id\": \"action_1\", \"title\": \"Claim listing\"}]\n```\nGood luck!";

        List<ActionItem> items = parser.parse(response);

        assertEquals("Claim listing", items.get(0).getTitle());
    }

    @Test
    void shouldRejectUnparseableResponses() {
        assertThrows(SynthesisParseException.class, () -> parser.parse("I cannot help with that."));
        assertThrows(SynthesisParseException.class, () -> parser.parse("[]"));
        assertThrows(SynthesisParseException.class, () -> parser.parse("[{\"id\": "));
    }
}
