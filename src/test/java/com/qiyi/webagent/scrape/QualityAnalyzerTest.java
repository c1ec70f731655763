package com.qiyi.webagent.scrape;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QualityAnalyzerTest {
    private final QualityAnalyzer analyzer = new QualityAnalyzer();

    private static List<Object> items(String json) {
        return new ArrayList<>(JSON.parseArray(json));
    }

    @Test
    public void emptyListShouldScoreZero() {
        QualityReport report = analyzer.analyze(new ArrayList<>());

        assertEquals(0, report.getTotalItems());
        assertEquals(0.0, report.getCompletionRate());
        assertTrue(report.getMissingFields().isEmpty());
    }

    @Test
    public void nullAndEmptyStringShouldCountAsMissing() {
        QualityReport report = analyzer.analyze(items(
                "[{\"title\":\"A\",\"price\":1.5},"
                        + "{\"title\":\"\",\"price\":2},"
                        + "{\"title\":\"C\",\"price\":null}]"));

        assertEquals(3, report.getTotalItems());
        assertEquals(1, report.getCompleteItems());
        assertEquals(0.333, report.getCompletionRate());
        assertEquals(List.of("title: 1 items", "price: 1 items"), report.getMissingFields());
    }

    @Test
    public void falseAndZeroShouldNotCountAsMissing() {
        QualityReport report = analyzer.analyze(items("[{\"in_stock\":false,\"rating\":0}]"));

        assertEquals(1.0, report.getCompletionRate());
    }

    @Test
    public void nestedFieldsShouldUseDottedPaths() {
        QualityReport report = analyzer.analyze(items(
                "[{\"name\":\"x\",\"seller\":{\"name\":null,\"address\":{\"city\":\"\"}}},"
                        + "{\"name\":\"y\",\"tags\":[{\"label\":null},{\"label\":\"ok\"}]}]"));

        assertEquals(0, report.getCompleteItems());
        assertTrue(report.getMissingFields().contains("seller.name: 1 items"));
        assertTrue(report.getMissingFields().contains("seller.address.city: 1 items"));
        assertTrue(report.getMissingFields().contains("tags.label: 1 items"));
    }

    @Test
    public void blankingALeafShouldLowerTheRate() {
        List<Object> data = items("[{\"a\":\"1\",\"b\":{\"c\":\"2\"}},{\"a\":\"3\",\"b\":{\"c\":\"4\"}}]");
        double before = analyzer.analyze(data).getCompletionRate();

        ((JSONObject) data.get(1)).getJSONObject("b").put("c", "");
        double after = analyzer.analyze(data).getCompletionRate();

        assertEquals(1.0, before);
        assertEquals(0.5, after);
    }

    @Test
    public void scalarItemsShouldBeComplete() {
        QualityReport report = analyzer.analyze(items("[\"a\", 1, true]"));

        assertEquals(3, report.getCompleteItems());
        assertEquals(1.0, report.getCompletionRate());
    }

    @Test
    public void rateShouldRoundHalfUpToThreeDecimals() {
        // 2/3 = 0.6666...
        QualityReport report = analyzer.analyze(items("[{\"a\":1},{\"a\":2},{\"a\":null}]"));

        assertEquals(0.667, report.getCompletionRate());
        assertTrue(report.getCompletionRate() >= 0.0 && report.getCompletionRate() <= 1.0);
    }

    @Test
    public void structuredDataShouldScoreTheFirstList() {
        JSONObject data = new JSONObject();
        data.put("books", JSON.parseArray("[{\"t\":\"a\"},{\"t\":null}]"));
        data.put("metadata", JSON.parseObject("{\"nb_resultats\":2}"));

        QualityReport report = analyzer.analyzeStructured(data);

        assertEquals(2, report.getTotalItems());
        assertEquals(0.5, report.getCompletionRate());

        JSONObject json = report.toJson();
        assertEquals(new JSONArray(), json.getJSONArray("errors"));
        assertEquals(1, json.getJSONArray("missing_fields").size());
    }
}
