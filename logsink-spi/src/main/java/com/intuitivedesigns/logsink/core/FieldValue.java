/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Map;
import java.util.Objects;

/**
 * A single structured-context value attached to a {@link LogRecord}.
 *
 * <p>Closed set of shapes, identified by {@link #kind()}:
 * STRING, INTEGER (64-bit), FLOAT (64-bit), BOOL and STRUCTURED (a JSON tree).
 * Every shape renders to JSON, so record serialization is total.</p>
 */
public interface FieldValue {

    enum Kind { STRING, INTEGER, FLOAT, BOOL, STRUCTURED }

    Kind kind();

    /** JSON rendering of this value. Callers get a fresh node. */
    JsonNode toJson();

    // -----------------------------------------------------------------------
    // FACTORY METHODS
    // -----------------------------------------------------------------------

    static FieldValue of(String value) {
        return new StringValue(value);
    }

    static FieldValue of(long value) {
        return new IntegerValue(value);
    }

    static FieldValue of(double value) {
        return new FloatValue(value);
    }

    static FieldValue of(boolean value) {
        return new BoolValue(value);
    }

    /**
     * Maps an arbitrary Java value onto the closest shape.
     * Values that cannot be represented as a JSON tree fall back to their {@code String.valueOf}.
     */
    static FieldValue of(Object value) {
        if (value == null) return new StructuredValue(NullNode.getInstance());
        if (value instanceof FieldValue fv) return fv;
        if (value instanceof CharSequence || value instanceof Character || value instanceof Enum<?>) {
            return new StringValue(value.toString());
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new IntegerValue(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return new FloatValue(((Number) value).doubleValue());
        }
        if (value instanceof Boolean b) {
            return new BoolValue(b);
        }
        if (value instanceof JsonNode node) {
            return new StructuredValue(node);
        }
        if (value instanceof Map<?, ?> || value instanceof Iterable<?> || value.getClass().isArray()) {
            try {
                return new StructuredValue(LogRecordJson.mapper().valueToTree(value));
            } catch (IllegalArgumentException e) {
                return new StringValue(String.valueOf(value));
            }
        }
        return new StringValue(String.valueOf(value));
    }

    // -----------------------------------------------------------------------
    // SHAPES
    // -----------------------------------------------------------------------

    record StringValue(String value) implements FieldValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override public Kind kind() { return Kind.STRING; }
        @Override public JsonNode toJson() { return TextNode.valueOf(value); }
        @Override public String toString() { return value; }
    }

    record IntegerValue(long value) implements FieldValue {
        @Override public Kind kind() { return Kind.INTEGER; }
        @Override public JsonNode toJson() { return LongNode.valueOf(value); }
        @Override public String toString() { return Long.toString(value); }
    }

    record FloatValue(double value) implements FieldValue {
        @Override public Kind kind() { return Kind.FLOAT; }
        @Override public JsonNode toJson() { return DoubleNode.valueOf(value); }
        @Override public String toString() { return Double.toString(value); }
    }

    record BoolValue(boolean value) implements FieldValue {
        @Override public Kind kind() { return Kind.BOOL; }
        @Override public JsonNode toJson() { return BooleanNode.valueOf(value); }
        @Override public String toString() { return Boolean.toString(value); }
    }

    /**
     * A JSON tree. The node is copied on the way in and on the way out,
     * so holders of a record can never change it.
     */
    record StructuredValue(JsonNode node) implements FieldValue {
        public StructuredValue {
            node = (node == null) ? NullNode.getInstance() : node.deepCopy();
        }

        @Override
        public JsonNode node() {
            return node.deepCopy();
        }

        @Override public Kind kind() { return Kind.STRUCTURED; }
        @Override public JsonNode toJson() { return node.deepCopy(); }
        @Override public String toString() { return node.toString(); }
    }
}
