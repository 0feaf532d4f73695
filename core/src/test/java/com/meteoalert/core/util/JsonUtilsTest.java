package com.meteoalert.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndLenientOnUnknownProperties() throws Exception {
        ObjectMapper first = JsonUtils.objectMapper();

        assertSame(first, JsonUtils.objectMapper());
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

        Payload parsed = first.readValue("{\"name\":\"ok\",\"date\":\"2026-10-19\",\"extra\":1}", Payload.class);
        assertEquals(LocalDate.of(2026, 10, 19), parsed.date());
    }

    @Test
    void datesAreWrittenAsIsoStringsAndNullsOmitted() throws Exception {
        String json = JsonUtils.toJson(new Payload("ok", LocalDate.of(2026, 10, 19), null));
        var tree = JsonUtils.objectMapper().readTree(json);

        assertEquals("2026-10-19", tree.get("date").asText());
        assertFalse(tree.has("time"));
        assertTrue(JsonUtils.toJson(new Payload("t", null, LocalTime.of(21, 0))).contains("\"time\":\"21:00"));
    }

    private record Payload(String name, LocalDate date, LocalTime time) {
    }
}
