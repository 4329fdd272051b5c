package com.zzf.localagent.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JsonUtilsTest {

    @Test
    public void testExtractFromFence() {
        String raw = "Here you go:\n```json\n{\"steps\": [\"a\"]}\n```\nthanks";
        assertEquals("{\"steps\": [\"a\"]}", JsonUtils.extractFirstJsonObject(raw));
    }

    @Test
    public void testExtractBalancedWithBracesInStrings() {
        String raw = "prefix {\"a\": \"}{\", \"b\": {\"c\": 1}} suffix {\"x\": 2}";
        assertEquals("{\"a\": \"}{\", \"b\": {\"c\": 1}}", JsonUtils.extractFirstJsonObject(raw));
    }

    @Test
    public void testExtractFailures() {
        assertThrows(IllegalArgumentException.class, () -> JsonUtils.extractFirstJsonObject(null));
        assertThrows(IllegalArgumentException.class, () -> JsonUtils.extractFirstJsonObject("no json here"));
        assertThrows(IllegalArgumentException.class, () -> JsonUtils.extractFirstJsonObject("{\"open\": 1"));
    }

    @Test
    public void testTextList() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals(List.of("a", "b"), JsonUtils.textList(mapper.readTree("{\"steps\": [\" a \", \"\", \"b\"]}"), "steps"));
        assertTrue(JsonUtils.textList(mapper.readTree("{\"steps\": \"a\"}"), "steps").isEmpty());
        assertTrue(JsonUtils.textList(null, "steps").isEmpty());
    }
}
