package com.ryuqq.directory.wire.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Helpers for externally tagged variants.
 *
 * <pre>
 * unit variant     → "Name"
 * newtype variant  → {"Name": value}
 * tuple variant    → {"Name": [a, b]}
 * </pre>
 *
 * @author Directory Team
 * @since 1.0.0
 */
final class TaggedJson {

    private TaggedJson() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * A decoded variant: its tag and payload (null for unit variants).
     */
    record Tagged(String tag, JsonNode payload) {

        boolean isUnit() {
            return payload == null;
        }
    }

    static void writeUnit(JsonGenerator gen, String tag) throws IOException {
        gen.writeString(tag);
    }

    static void writeNewtype(JsonGenerator gen, String tag, String value) throws IOException {
        gen.writeStartObject();
        gen.writeStringField(tag, value);
        gen.writeEndObject();
    }

    static void writePair(JsonGenerator gen, String tag, String first, String second) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(tag);
        gen.writeStartArray();
        gen.writeString(first);
        gen.writeString(second);
        gen.writeEndArray();
        gen.writeEndObject();
    }

    static Tagged readTagged(JsonNode node, DeserializationContext ctxt, Class<?> type) throws IOException {
        if (node != null && node.isTextual()) {
            return new Tagged(node.textValue(), null);
        }
        if (node != null && node.isObject() && node.size() == 1) {
            Map.Entry<String, JsonNode> field = node.fields().next();
            return new Tagged(field.getKey(), field.getValue());
        }
        return ctxt.reportInputMismatch(type, "Expected a tagged %s but found %s",
            type.getSimpleName(), describe(node));
    }

    static String readText(JsonNode node, DeserializationContext ctxt, Class<?> type, String what) throws IOException {
        if (node == null || !node.isTextual()) {
            return ctxt.reportInputMismatch(type, "Expected %s to be a string but found %s", what, describe(node));
        }
        return node.textValue();
    }

    static String readOptionalText(JsonNode node, DeserializationContext ctxt, Class<?> type, String what) throws IOException {
        if (node == null || node.isNull()) {
            return null;
        }
        return readText(node, ctxt, type, what);
    }

    /**
     * Writes {@code {"Tag": n}} where {@code n} is the id read as an unsigned 64-bit number.
     */
    static void writeUnsignedId(JsonGenerator gen, String tag, long id) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(tag);
        gen.writeNumber(new BigInteger(Long.toUnsignedString(id)));
        gen.writeEndObject();
    }

    /**
     * Reads an unsigned 64-bit integer, returning its two's complement bit pattern.
     */
    static long readUnsignedId(JsonNode node, DeserializationContext ctxt, Class<?> type, String what) throws IOException {
        if (node == null || !node.isIntegralNumber()) {
            return ctxt.reportInputMismatch(type, "Expected %s to be an unsigned integer but found %s", what, describe(node));
        }
        BigInteger value = node.bigIntegerValue();
        if (value.signum() < 0 || value.bitLength() > 64) {
            return ctxt.reportInputMismatch(type, "Expected %s to be within [0, 2^64) but found %s", what, value);
        }
        return value.longValue();
    }

    static List<JsonNode> readArray(JsonNode node, DeserializationContext ctxt, Class<?> type, String what) throws IOException {
        if (node == null || !node.isArray()) {
            return ctxt.reportInputMismatch(type, "Expected %s to be an array but found %s", what, describe(node));
        }
        List<JsonNode> items = new ArrayList<>(node.size());
        Iterator<JsonNode> elements = node.elements();
        while (elements.hasNext()) {
            items.add(elements.next());
        }
        return items;
    }

    static List<JsonNode> readTuple(JsonNode node, int arity, DeserializationContext ctxt, Class<?> type, String tag) throws IOException {
        List<JsonNode> items = readArray(node, ctxt, type, tag);
        if (items.size() != arity) {
            return ctxt.reportInputMismatch(type, "Expected %s to have %d elements but found %d", tag, arity, items.size());
        }
        return items;
    }

    static JsonNode requireField(JsonNode node, String field, DeserializationContext ctxt, Class<?> type) throws IOException {
        if (node == null || !node.isObject()) {
            return ctxt.reportInputMismatch(type, "Expected %s to be an object but found %s", type.getSimpleName(), describe(node));
        }
        JsonNode value = node.get(field);
        if (value == null) {
            return ctxt.reportInputMismatch(type, "Missing field '%s' in %s", field, type.getSimpleName());
        }
        return value;
    }

    static <T> T unknownTag(DeserializationContext ctxt, Class<?> type, String tag) throws IOException {
        return ctxt.reportInputMismatch(type, "Unknown %s variant '%s'", type.getSimpleName(), tag);
    }

    static <T> T unexpectedUnit(DeserializationContext ctxt, Class<?> type, Tagged tagged) throws IOException {
        String shape = tagged.isUnit() ? "without" : "with";
        return ctxt.reportInputMismatch(type, "%s variant '%s' given %s a payload", type.getSimpleName(), tagged.tag(), shape);
    }

    /**
     * Builds a domain value, reporting constructor validation failures as input mismatches.
     */
    static <T> T construct(DeserializationContext ctxt, Class<?> type, Supplier<T> factory) throws IOException {
        try {
            return factory.get();
        } catch (IllegalArgumentException e) {
            return ctxt.reportInputMismatch(type, "Invalid %s: %s", type.getSimpleName(), e.getMessage());
        }
    }

    private static String describe(JsonNode node) {
        return node == null ? "nothing" : node.getNodeType().toString();
    }
}
