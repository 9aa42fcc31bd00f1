package com.ryuqq.directory.wire.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.ryuqq.directory.core.filter.Filter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of {@link Filter}.
 *
 * <pre>
 * {"Eq":["name","alice"]}   {"Sub":["name","al"]}   {"Pres":"mail"}
 * {"Or":[...]}   {"And":[...]}   {"AndNot":{...}}   "Self"
 * </pre>
 *
 * <p>Trees deeper than the configured maximum are rejected in both directions, so a hostile
 * payload cannot exhaust the decoder's stack.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
final class FilterJson {

    static final String EQ = "Eq";
    static final String SUB = "Sub";
    static final String PRES = "Pres";
    static final String OR = "Or";
    static final String AND = "And";
    static final String AND_NOT = "AndNot";
    static final String SELF = "Self";

    private FilterJson() {
        throw new UnsupportedOperationException("Utility class");
    }

    static final class Serializer extends StdSerializer<Filter> {

        private static final long serialVersionUID = 1L;
        private final int maxDepth;

        Serializer(int maxDepth) {
            super(Filter.class);
            this.maxDepth = maxDepth;
        }

        @Override
        public void serialize(Filter filter, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (filter.depth() > maxDepth) {
                throw JsonMappingException.from(gen,
                    "Filter depth " + filter.depth() + " exceeds maximum " + maxDepth);
            }
            write(filter, gen);
        }

        // depth was checked above, recursion is bounded by maxDepth
        private static void write(Filter filter, JsonGenerator gen) throws IOException {
            if (filter instanceof Filter.Eq eq) {
                TaggedJson.writePair(gen, EQ, eq.attr(), eq.value());
            } else if (filter instanceof Filter.Sub sub) {
                TaggedJson.writePair(gen, SUB, sub.attr(), sub.value());
            } else if (filter instanceof Filter.Pres pres) {
                TaggedJson.writeNewtype(gen, PRES, pres.attr());
            } else if (filter instanceof Filter.Or or) {
                writeChildren(gen, OR, or.children());
            } else if (filter instanceof Filter.And and) {
                writeChildren(gen, AND, and.children());
            } else if (filter instanceof Filter.AndNot not) {
                gen.writeStartObject();
                gen.writeFieldName(AND_NOT);
                write(not.child(), gen);
                gen.writeEndObject();
            } else {
                TaggedJson.writeUnit(gen, SELF);
            }
        }

        private static void writeChildren(JsonGenerator gen, String tag, List<Filter> children) throws IOException {
            gen.writeStartObject();
            gen.writeFieldName(tag);
            gen.writeStartArray();
            for (Filter child : children) {
                write(child, gen);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
    }

    static final class Deserializer extends StdDeserializer<Filter> {

        private static final long serialVersionUID = 1L;
        private final int maxDepth;

        Deserializer(int maxDepth) {
            super(Filter.class);
            this.maxDepth = maxDepth;
        }

        @Override
        public Filter deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return readTree(ctxt.readTree(p), ctxt);
        }

        Filter readTree(JsonNode node, DeserializationContext ctxt) throws IOException {
            return read(node, ctxt, 1);
        }

        private Filter read(JsonNode node, DeserializationContext ctxt, int depth) throws IOException {
            if (depth > maxDepth) {
                return ctxt.reportInputMismatch(Filter.class, "Filter nesting exceeds maximum depth %d", maxDepth);
            }

            TaggedJson.Tagged tagged = TaggedJson.readTagged(node, ctxt, Filter.class);
            if (SELF.equals(tagged.tag())) {
                return tagged.isUnit() ? Filter.self() : TaggedJson.unexpectedUnit(ctxt, Filter.class, tagged);
            }
            if (tagged.isUnit()) {
                return isKnown(tagged.tag())
                    ? TaggedJson.unexpectedUnit(ctxt, Filter.class, tagged)
                    : TaggedJson.unknownTag(ctxt, Filter.class, tagged.tag());
            }

            JsonNode payload = tagged.payload();
            switch (tagged.tag()) {
                case EQ -> {
                    List<JsonNode> pair = TaggedJson.readTuple(payload, 2, ctxt, Filter.class, EQ);
                    String attr = TaggedJson.readText(pair.get(0), ctxt, Filter.class, "Eq attribute");
                    String value = TaggedJson.readText(pair.get(1), ctxt, Filter.class, "Eq value");
                    return TaggedJson.construct(ctxt, Filter.class, () -> Filter.eq(attr, value));
                }
                case SUB -> {
                    List<JsonNode> pair = TaggedJson.readTuple(payload, 2, ctxt, Filter.class, SUB);
                    String attr = TaggedJson.readText(pair.get(0), ctxt, Filter.class, "Sub attribute");
                    String value = TaggedJson.readText(pair.get(1), ctxt, Filter.class, "Sub value");
                    return TaggedJson.construct(ctxt, Filter.class, () -> Filter.sub(attr, value));
                }
                case PRES -> {
                    String attr = TaggedJson.readText(payload, ctxt, Filter.class, "Pres attribute");
                    return TaggedJson.construct(ctxt, Filter.class, () -> Filter.pres(attr));
                }
                case OR -> {
                    return new Filter.Or(readChildren(payload, ctxt, depth, OR));
                }
                case AND -> {
                    return new Filter.And(readChildren(payload, ctxt, depth, AND));
                }
                case AND_NOT -> {
                    return new Filter.AndNot(read(payload, ctxt, depth + 1));
                }
                default -> {
                    return TaggedJson.unknownTag(ctxt, Filter.class, tagged.tag());
                }
            }
        }

        private List<Filter> readChildren(JsonNode payload, DeserializationContext ctxt, int depth, String tag) throws IOException {
            List<JsonNode> items = TaggedJson.readArray(payload, ctxt, Filter.class, tag);
            List<Filter> children = new ArrayList<>(items.size());
            for (JsonNode item : items) {
                children.add(read(item, ctxt, depth + 1));
            }
            return children;
        }

        private static boolean isKnown(String tag) {
            return switch (tag) {
                case EQ, SUB, PRES, OR, AND, AND_NOT -> true;
                default -> false;
            };
        }
    }
}
