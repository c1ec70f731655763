package com.qiyi.webagent.llm;

import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LlmResponseParserTest {

    @Test
    public void itemsArrayShouldBePreferred() {
        List<Object> items = LlmResponseParser.parseItems(
                "Sure! {\"other\":[1],\"items\":[{\"title\":\"A\"},{\"title\":\"B\"}]} hope this helps");

        assertEquals(2, items.size());
        assertEquals("A", ((JSONObject) items.get(0)).getString("title"));
    }

    @Test
    public void firstArrayValueShouldBeUsedWithoutItemsKey() {
        List<Object> items = LlmResponseParser.parseItems("{\"products\":[{\"name\":\"x\"}],\"count\":1}");

        assertEquals(1, items.size());
        assertEquals("x", ((JSONObject) items.get(0)).getString("name"));
    }

    @Test
    public void plainObjectShouldBeASingleItem() {
        List<Object> items = LlmResponseParser.parseItems("{\"name\":\"only\"}");

        assertEquals(1, items.size());
        assertEquals("only", ((JSONObject) items.get(0)).getString("name"));
    }

    @Test
    public void unparseableOutputShouldYieldNoItems() {
        assertTrue(LlmResponseParser.parseItems(null).isEmpty());
        assertTrue(LlmResponseParser.parseItems("no json here").isEmpty());
        assertTrue(LlmResponseParser.parseItems("} backwards {").isEmpty());
        assertTrue(LlmResponseParser.parseItems("{\"title\": \"unterminated}").isEmpty());
    }

    @Test
    public void selectorShouldLoseCodeFences() {
        assertEquals("li.next a", LlmResponseParser.cleanSelector("```css\nli.next a\n```"));
        assertEquals("a.next-page[href]", LlmResponseParser.cleanSelector("`a.next-page[href]`"));
        assertEquals("NO_PAGINATION", LlmResponseParser.cleanSelector("  NO_PAGINATION \n"));
        assertEquals("", LlmResponseParser.cleanSelector(null));
    }
}
