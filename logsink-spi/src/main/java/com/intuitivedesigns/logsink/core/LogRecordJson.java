/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * JSON rendering shared by the backend adapters.
 *
 * <p>Layout (snake_case, absent optionals rendered as JSON null):</p>
 * <pre>
 * {"timestamp":"2025-01-01T00:00:00Z","level":"ERROR","target":"auth",
 *  "module_path":null,"file":null,"line":null,
 *  "fields":{"user_id":42},"message":"authentication failed","service_name":null}
 * </pre>
 */
public final class LogRecordJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LogRecordJson() {}

    /** Shared, thread-safe mapper. Do not reconfigure. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode toNode(LogRecord record) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("timestamp", record.timestamp().toString());
        node.put("level", record.level());
        node.put("target", record.target());
        node.put("module_path", record.modulePath());
        node.put("file", record.file());
        node.put("line", record.line());
        node.set("fields", fieldsNode(record.fields()));
        node.put("message", record.message());
        node.put("service_name", record.serviceName());
        return node;
    }

    public static ObjectNode fieldsNode(Map<String, FieldValue> fields) {
        ObjectNode node = MAPPER.createObjectNode();
        for (Map.Entry<String, FieldValue> e : fields.entrySet()) {
            node.set(e.getKey(), e.getValue().toJson());
        }
        return node;
    }

    public static String toJson(LogRecord record) {
        return write(toNode(record));
    }

    public static String fieldsJson(Map<String, FieldValue> fields) {
        return write(fieldsNode(fields));
    }

    private static String write(Object node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // Tree nodes built above always serialize
            throw new IllegalStateException("Failed to render log record as JSON", e);
        }
    }
}
