package com.cpp2c.transformer.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;

/** One JSON object per line, fields as in {@link Fact#toMap()}. */
public final class JsonLinesFactSink implements FactSink {

    private static final ObjectMapper om = new ObjectMapper();

    private final Writer out;

    public JsonLinesFactSink(Writer out) {
        this.out = out;
    }

    @Override
    public void emit(Fact fact) {
        try {
            out.write(toJson(fact));
            out.write('\n');
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write fact record", e);
        }
    }

    public static String toJson(Fact fact) {
        ObjectNode node = om.createObjectNode();
        for (Map.Entry<String, Object> e : fact.toMap().entrySet()) {
            node.put(e.getKey(), String.valueOf(e.getValue()));
        }
        try {
            return om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Fact not serializable: " + fact, e);
        }
    }

    @Override
    public void flush() {
        try {
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush fact records", e);
        }
    }
}
