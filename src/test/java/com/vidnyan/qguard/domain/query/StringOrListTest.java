package com.vidnyan.qguard.domain.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StringOrListTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void fromJson_ShouldReadScalarString() throws Exception {
        StringOrList value = objectMapper.readValue("\"get\"", StringOrList.class);

        assertFalse(value.isList());
        assertEquals(List.of("get"), value.values());
    }

    @Test
    void fromJson_ShouldReadArrayInOrder() throws Exception {
        StringOrList value = objectMapper.readValue("[\"get\", \"list\", \"watch\"]", StringOrList.class);

        assertTrue(value.isList());
        assertEquals(List.of("get", "list", "watch"), value.values());
        assertEquals(3, value.size());
    }

    @Test
    void fromJson_ShouldAcceptUnquotedStatusCodes() throws Exception {
        StringOrList scalar = objectMapper.readValue("403", StringOrList.class);
        StringOrList list = objectMapper.readValue("[200, \"404\"]", StringOrList.class);

        assertEquals(List.of("403"), scalar.values());
        assertEquals(List.of("200", "404"), list.values());
    }

    @Test
    void isEmpty_ShouldIgnoreBlankValues() {
        assertTrue(StringOrList.empty().isEmpty());
        assertTrue(StringOrList.of("", "  ").isEmpty());
        assertTrue(StringOrList.of((String) null).isEmpty());
        assertFalse(StringOrList.of("", "pods").isEmpty());
    }

    @Test
    void toJson_ShouldKeepTheOriginalShape() throws Exception {
        assertEquals("\"get\"", objectMapper.writeValueAsString(StringOrList.of("get")));
        assertEquals("[\"get\",\"list\"]", objectMapper.writeValueAsString(StringOrList.of("get", "list")));
    }
}
