package com.ryuqq.directory.wire.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.directory.core.contract.CreateRequest;
import com.ryuqq.directory.core.contract.DeleteRequest;
import com.ryuqq.directory.core.contract.ModifyRequest;
import com.ryuqq.directory.core.contract.OperationResponse;
import com.ryuqq.directory.core.contract.SearchRequest;
import com.ryuqq.directory.core.contract.SearchResponse;
import com.ryuqq.directory.core.contract.WhoamiRequest;
import com.ryuqq.directory.core.contract.WhoamiResponse;
import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.filter.Filter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of the request/response envelope.
 *
 * <pre>
 * SearchRequest    {"filter":...}           SearchResponse   {"entries":[...]}
 * CreateRequest    {"entries":[...]}        DeleteRequest    {"filter":...}
 * ModifyRequest    {"filter":...,"modlist":{"mods":[...]}}
 * OperationResponse {}                      WhoamiRequest    {}
 * WhoamiResponse   {"youare":{...},"uat":{...}}
 * </pre>
 *
 * @author Directory Team
 * @since 1.0.0
 */
final class EnvelopeJson {

    static final String FILTER = "filter";
    static final String ENTRIES = "entries";
    static final String MODLIST = "modlist";
    static final String YOUARE = "youare";
    static final String UAT = "uat";

    private EnvelopeJson() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Envelope handlers bound to one filter form.
     */
    static final class Handlers {

        private final FilterJson.Serializer filterWriter;
        private final FilterJson.Deserializer filterReader;

        Handlers(int maxFilterDepth) {
            this.filterWriter = new FilterJson.Serializer(maxFilterDepth);
            this.filterReader = new FilterJson.Deserializer(maxFilterDepth);
        }

        void writeFilterRequest(Filter filter, JsonGenerator gen) throws IOException {
            gen.writeStartObject();
            gen.writeFieldName(FILTER);
            filterWriter.serialize(filter, gen, null);
            gen.writeEndObject();
        }

        Filter readFilterField(JsonNode node, DeserializationContext ctxt, Class<?> type) throws IOException {
            return filterReader.readTree(TaggedJson.requireField(node, FILTER, ctxt, type), ctxt);
        }

        void writeModifyRequest(ModifyRequest request, JsonGenerator gen) throws IOException {
            gen.writeStartObject();
            gen.writeFieldName(FILTER);
            filterWriter.serialize(request.filter(), gen, null);
            gen.writeFieldName(MODLIST);
            EntryJson.writeModifyList(request.modlist(), gen);
            gen.writeEndObject();
        }

        ModifyRequest readModifyRequest(JsonNode node, DeserializationContext ctxt) throws IOException {
            Filter filter = readFilterField(node, ctxt, ModifyRequest.class);
            JsonNode modlist = TaggedJson.requireField(node, MODLIST, ctxt, ModifyRequest.class);
            return new ModifyRequest(filter, EntryJson.readModifyList(modlist, ctxt));
        }
    }

    static void writeEntries(List<Entry> entries, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(ENTRIES);
        gen.writeStartArray();
        for (Entry entry : entries) {
            EntryJson.writeEntry(entry, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    static List<Entry> readEntries(JsonNode node, DeserializationContext ctxt, Class<?> type) throws IOException {
        List<Entry> entries = new ArrayList<>();
        for (JsonNode item : TaggedJson.readArray(TaggedJson.requireField(node, ENTRIES, ctxt, type), ctxt, type, ENTRIES)) {
            entries.add(EntryJson.readEntry(item, ctxt));
        }
        return entries;
    }

    static void writeEmpty(Object ignored, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeEndObject();
    }

    static void requireObject(JsonNode node, DeserializationContext ctxt, Class<?> type) throws IOException {
        if (node == null || !node.isObject()) {
            ctxt.reportInputMismatch(type, "Expected %s to be an object", type.getSimpleName());
        }
    }

    static void writeWhoami(WhoamiResponse response, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(YOUARE);
        EntryJson.writeEntry(response.youare(), gen);
        gen.writeFieldName(UAT);
        IdentityJson.writeToken(response.uat(), gen);
        gen.writeEndObject();
    }

    static WhoamiResponse readWhoami(JsonNode node, DeserializationContext ctxt) throws IOException {
        Entry youare = EntryJson.readEntry(TaggedJson.requireField(node, YOUARE, ctxt, WhoamiResponse.class), ctxt);
        return new WhoamiResponse(youare,
            IdentityJson.readToken(TaggedJson.requireField(node, UAT, ctxt, WhoamiResponse.class), ctxt));
    }

    static SearchResponse readSearchResponse(JsonNode node, DeserializationContext ctxt) throws IOException {
        return new SearchResponse(readEntries(node, ctxt, SearchResponse.class));
    }

    static CreateRequest readCreateRequest(JsonNode node, DeserializationContext ctxt) throws IOException {
        return new CreateRequest(readEntries(node, ctxt, CreateRequest.class));
    }

    static OperationResponse readOperationResponse(JsonNode node, DeserializationContext ctxt) throws IOException {
        requireObject(node, ctxt, OperationResponse.class);
        return OperationResponse.ack();
    }

    static WhoamiRequest readWhoamiRequest(JsonNode node, DeserializationContext ctxt) throws IOException {
        requireObject(node, ctxt, WhoamiRequest.class);
        return new WhoamiRequest();
    }
}
