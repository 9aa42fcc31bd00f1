package com.ryuqq.directory.wire.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.modify.Modify;
import com.ryuqq.directory.core.modify.ModifyList;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of {@link Entry}, {@link Modify} and {@link ModifyList}.
 *
 * <pre>
 * {"attrs":{"mail":["a@example.com"],"name":["alice"]}}
 * {"Present":["mail","a@example.com"]}   {"Removed":[...]}   {"Purged":"mail"}
 * {"mods":[...]}
 * </pre>
 *
 * @author Directory Team
 * @since 1.0.0
 */
final class EntryJson {

    static final String ATTRS = "attrs";
    static final String MODS = "mods";
    static final String PRESENT = "Present";
    static final String REMOVED = "Removed";
    static final String PURGED = "Purged";

    private EntryJson() {
        throw new UnsupportedOperationException("Utility class");
    }

    static void writeEntry(Entry entry, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(ATTRS);
        gen.writeStartObject();
        for (Map.Entry<String, List<String>> attr : entry.getAttrs().entrySet()) {
            gen.writeFieldName(attr.getKey());
            gen.writeStartArray();
            for (String value : attr.getValue()) {
                gen.writeString(value);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }

    static Entry readEntry(JsonNode node, DeserializationContext ctxt) throws IOException {
        JsonNode attrs = TaggedJson.requireField(node, ATTRS, ctxt, Entry.class);
        if (!attrs.isObject()) {
            return ctxt.reportInputMismatch(Entry.class, "Expected attrs to be an object");
        }

        Map<String, List<String>> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = attrs.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> attrValues = new ArrayList<>();
            for (JsonNode value : TaggedJson.readArray(field.getValue(), ctxt, Entry.class, field.getKey())) {
                attrValues.add(TaggedJson.readText(value, ctxt, Entry.class, "value of " + field.getKey()));
            }
            values.put(field.getKey(), attrValues);
        }
        return TaggedJson.construct(ctxt, Entry.class, () -> Entry.of(values));
    }

    static void writeModify(Modify modify, JsonGenerator gen) throws IOException {
        if (modify instanceof Modify.Present present) {
            TaggedJson.writePair(gen, PRESENT, present.attr(), present.value());
        } else if (modify instanceof Modify.Removed removed) {
            TaggedJson.writePair(gen, REMOVED, removed.attr(), removed.value());
        } else {
            TaggedJson.writeNewtype(gen, PURGED, modify.attr());
        }
    }

    static Modify readModify(JsonNode node, DeserializationContext ctxt) throws IOException {
        TaggedJson.Tagged tagged = TaggedJson.readTagged(node, ctxt, Modify.class);
        if (tagged.isUnit()) {
            return TaggedJson.unexpectedUnit(ctxt, Modify.class, tagged);
        }
        switch (tagged.tag()) {
            case PRESENT -> {
                List<JsonNode> pair = TaggedJson.readTuple(tagged.payload(), 2, ctxt, Modify.class, PRESENT);
                String attr = TaggedJson.readText(pair.get(0), ctxt, Modify.class, "Present attribute");
                String value = TaggedJson.readText(pair.get(1), ctxt, Modify.class, "Present value");
                return TaggedJson.construct(ctxt, Modify.class, () -> new Modify.Present(attr, value));
            }
            case REMOVED -> {
                List<JsonNode> pair = TaggedJson.readTuple(tagged.payload(), 2, ctxt, Modify.class, REMOVED);
                String attr = TaggedJson.readText(pair.get(0), ctxt, Modify.class, "Removed attribute");
                String value = TaggedJson.readText(pair.get(1), ctxt, Modify.class, "Removed value");
                return TaggedJson.construct(ctxt, Modify.class, () -> new Modify.Removed(attr, value));
            }
            case PURGED -> {
                String attr = TaggedJson.readText(tagged.payload(), ctxt, Modify.class, "Purged attribute");
                return TaggedJson.construct(ctxt, Modify.class, () -> new Modify.Purged(attr));
            }
            default -> {
                return TaggedJson.unknownTag(ctxt, Modify.class, tagged.tag());
            }
        }
    }

    static void writeModifyList(ModifyList modlist, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(MODS);
        gen.writeStartArray();
        for (Modify modify : modlist.mods()) {
            writeModify(modify, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    static ModifyList readModifyList(JsonNode node, DeserializationContext ctxt) throws IOException {
        JsonNode mods = TaggedJson.requireField(node, MODS, ctxt, ModifyList.class);
        List<Modify> parsed = new ArrayList<>();
        for (JsonNode item : TaggedJson.readArray(mods, ctxt, ModifyList.class, MODS)) {
            parsed.add(readModify(item, ctxt));
        }
        return new ModifyList(parsed);
    }
}
