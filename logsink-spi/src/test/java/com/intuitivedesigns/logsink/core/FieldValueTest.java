/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldValueTest {

    private enum Color { RED }

    @Test
    void testScalarMapping() {
        assertEquals(FieldValue.Kind.STRING, FieldValue.of((Object) "s").kind());
        assertEquals(FieldValue.Kind.STRING, FieldValue.of((Object) 'c').kind());
        assertEquals(FieldValue.Kind.STRING, FieldValue.of(Color.RED).kind());
        assertEquals(FieldValue.Kind.INTEGER, FieldValue.of((Object) (short) 3).kind());
        assertEquals(FieldValue.Kind.INTEGER, FieldValue.of((Object) Long.MAX_VALUE).kind());
        assertEquals(FieldValue.Kind.FLOAT, FieldValue.of((Object) 2.5f).kind());
        assertEquals(FieldValue.Kind.BOOL, FieldValue.of((Object) Boolean.FALSE).kind());
        assertEquals(Long.MAX_VALUE, FieldValue.of((Object) Long.MAX_VALUE).toJson().asLong());
    }

    @Test
    void testNullBecomesJsonNull() {
        FieldValue v = FieldValue.of((Object) null);
        assertEquals(FieldValue.Kind.STRUCTURED, v.kind());
        assertTrue(v.toJson().isNull());
    }

    @Test
    void testCollectionsBecomeStructured() {
        FieldValue map = FieldValue.of(Map.of("k", List.of(1, 2, 3)));
        assertEquals(FieldValue.Kind.STRUCTURED, map.kind());
        assertEquals(3, map.toJson().get("k").size());

        FieldValue array = FieldValue.of(new int[] {4, 5});
        assertTrue(array.toJson().isArray());
    }

    @Test
    void testOtherObjectsFallBackToString() {
        Instant t = Instant.parse("2025-01-01T00:00:00Z");
        FieldValue v = FieldValue.of((Object) t);
        assertEquals(FieldValue.Kind.STRING, v.kind());
        assertEquals("2025-01-01T00:00:00Z", v.toString());
    }

    @Test
    void testStructuredValueCannotBeMutatedThroughItsNode() {
        ObjectNode node = LogRecordJson.mapper().createObjectNode().put("a", 1);
        FieldValue v = FieldValue.of(node);

        node.put("a", 2);
        ((ObjectNode) v.toJson()).put("a", 3);

        JsonNode current = v.toJson();
        assertEquals(1, current.get("a").asInt());
    }

    @Test
    void testExistingFieldValuePassesThrough() {
        FieldValue v = FieldValue.of(true);
        assertSame(v, FieldValue.of((Object) v));
    }
}
