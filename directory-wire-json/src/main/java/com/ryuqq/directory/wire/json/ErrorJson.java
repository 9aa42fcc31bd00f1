package com.ryuqq.directory.wire.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.directory.core.error.ConsistencyError;
import com.ryuqq.directory.core.error.ErrorPayload;
import com.ryuqq.directory.core.error.OperationError;
import com.ryuqq.directory.core.error.SchemaError;
import com.ryuqq.directory.core.outcome.Result;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of the error taxonomy.
 *
 * <pre>
 * "Backend"
 * {"SchemaViolation":"InvalidClass"}
 * {"SchemaViolation":{"MissingMustAttribute":"name"}}
 * {"CorruptedEntry":12}
 * {"ConsistencyError":[{"Ok":null},{"Err":{"UuidNotUnique":"x"}}]}
 * {"SchemaClassMissingAttribute":["person","name"]}
 * </pre>
 *
 * @author Directory Team
 * @since 1.0.0
 */
final class ErrorJson {

    static final String OK = "Ok";
    static final String ERR = "Err";

    private ErrorJson() {
        throw new UnsupportedOperationException("Utility class");
    }

    // ============================================================
    // SchemaError
    // ============================================================

    static void writeSchemaError(SchemaError error, JsonGenerator gen) throws IOException {
        if (error.getAttribute() == null) {
            TaggedJson.writeUnit(gen, error.getKind().wireName());
        } else {
            TaggedJson.writeNewtype(gen, error.getKind().wireName(), error.getAttribute());
        }
    }

    static SchemaError readSchemaError(JsonNode node, DeserializationContext ctxt) throws IOException {
        TaggedJson.Tagged tagged = TaggedJson.readTagged(node, ctxt, SchemaError.class);
        SchemaError.Kind kind = SchemaError.Kind.fromWireName(tagged.tag()).orElse(null);
        if (kind == null) {
            return TaggedJson.unknownTag(ctxt, SchemaError.class, tagged.tag());
        }
        if (kind == SchemaError.Kind.MISSING_MUST_ATTRIBUTE) {
            if (tagged.isUnit()) {
                return TaggedJson.unexpectedUnit(ctxt, SchemaError.class, tagged);
            }
            String attribute = TaggedJson.readText(tagged.payload(), ctxt, SchemaError.class, tagged.tag());
            return TaggedJson.construct(ctxt, SchemaError.class, () -> SchemaError.missingMustAttribute(attribute));
        }
        return tagged.isUnit()
            ? SchemaError.of(kind)
            : TaggedJson.unexpectedUnit(ctxt, SchemaError.class, tagged);
    }

    // ============================================================
    // ConsistencyError
    // ============================================================

    static void writeConsistencyError(ConsistencyError error, JsonGenerator gen) throws IOException {
        String tag = error.getKind().wireName();
        switch (error.getKind().payload()) {
            case TEXT -> TaggedJson.writeNewtype(gen, tag, error.getText());
            case TEXT_PAIR -> TaggedJson.writePair(gen, tag, error.getText(), error.getSecondText());
            case ENTRY_ID -> TaggedJson.writeUnsignedId(gen, tag, error.getEntryId());
            default -> TaggedJson.writeUnit(gen, tag);
        }
    }

    static ConsistencyError readConsistencyError(JsonNode node, DeserializationContext ctxt) throws IOException {
        Class<?> type = ConsistencyError.class;
        TaggedJson.Tagged tagged = TaggedJson.readTagged(node, ctxt, type);
        ConsistencyError.Kind kind = ConsistencyError.Kind.fromWireName(tagged.tag()).orElse(null);
        if (kind == null) {
            return TaggedJson.unknownTag(ctxt, type, tagged.tag());
        }
        if (tagged.isUnit() != (kind.payload() == ErrorPayload.NONE)) {
            return TaggedJson.unexpectedUnit(ctxt, type, tagged);
        }

        switch (kind.payload()) {
            case TEXT -> {
                String text = TaggedJson.readText(tagged.payload(), ctxt, type, tagged.tag());
                return TaggedJson.construct(ctxt, type, () -> ConsistencyError.withText(kind, text));
            }
            case TEXT_PAIR -> {
                List<JsonNode> pair = TaggedJson.readTuple(tagged.payload(), 2, ctxt, type, tagged.tag());
                String className = TaggedJson.readText(pair.get(0), ctxt, type, "class name");
                String attribute = TaggedJson.readText(pair.get(1), ctxt, type, "attribute");
                return TaggedJson.construct(ctxt, type,
                    () -> ConsistencyError.schemaClassMissingAttribute(className, attribute));
            }
            case ENTRY_ID -> {
                long entryId = TaggedJson.readUnsignedId(tagged.payload(), ctxt, type, tagged.tag());
                return ConsistencyError.withEntryId(kind, entryId);
            }
            default -> {
                return ConsistencyError.of(kind);
            }
        }
    }

    // ============================================================
    // OperationError
    // ============================================================

    static void writeOperationError(OperationError error, JsonGenerator gen) throws IOException {
        String tag = error.getKind().wireName();
        switch (error.getKind().payload()) {
            case TEXT -> TaggedJson.writeNewtype(gen, tag, error.getDetail());
            case ENTRY_ID -> TaggedJson.writeUnsignedId(gen, tag, error.getEntryId());
            case SCHEMA -> {
                gen.writeStartObject();
                gen.writeFieldName(tag);
                writeSchemaError(error.getSchemaError(), gen);
                gen.writeEndObject();
            }
            case CONSISTENCY -> {
                gen.writeStartObject();
                gen.writeFieldName(tag);
                gen.writeStartArray();
                for (Result<Void, ConsistencyError> check : error.getConsistencyResults()) {
                    gen.writeStartObject();
                    if (check.isOk()) {
                        gen.writeNullField(OK);
                    } else {
                        gen.writeFieldName(ERR);
                        writeConsistencyError(check.getError(), gen);
                    }
                    gen.writeEndObject();
                }
                gen.writeEndArray();
                gen.writeEndObject();
            }
            default -> TaggedJson.writeUnit(gen, tag);
        }
    }

    static OperationError readOperationError(JsonNode node, DeserializationContext ctxt) throws IOException {
        Class<?> type = OperationError.class;
        TaggedJson.Tagged tagged = TaggedJson.readTagged(node, ctxt, type);
        OperationError.Kind kind = OperationError.Kind.fromWireName(tagged.tag()).orElse(null);
        if (kind == null) {
            return TaggedJson.unknownTag(ctxt, type, tagged.tag());
        }
        if (tagged.isUnit() != (kind.payload() == ErrorPayload.NONE)) {
            return TaggedJson.unexpectedUnit(ctxt, type, tagged);
        }

        switch (kind.payload()) {
            case TEXT -> {
                String detail = TaggedJson.readText(tagged.payload(), ctxt, type, tagged.tag());
                return OperationError.withDetail(kind, detail);
            }
            case ENTRY_ID -> {
                return OperationError.corruptedEntry(TaggedJson.readUnsignedId(tagged.payload(), ctxt, type, tagged.tag()));
            }
            case SCHEMA -> {
                return OperationError.schemaViolation(readSchemaError(tagged.payload(), ctxt));
            }
            case CONSISTENCY -> {
                List<Result<Void, ConsistencyError>> checks = new ArrayList<>();
                for (JsonNode item : TaggedJson.readArray(tagged.payload(), ctxt, type, tagged.tag())) {
                    checks.add(readCheck(item, ctxt));
                }
                return OperationError.consistency(checks);
            }
            default -> {
                return OperationError.of(kind);
            }
        }
    }

    private static Result<Void, ConsistencyError> readCheck(JsonNode node, DeserializationContext ctxt) throws IOException {
        TaggedJson.Tagged tagged = TaggedJson.readTagged(node, ctxt, Result.class);
        if (OK.equals(tagged.tag()) && !tagged.isUnit() && tagged.payload().isNull()) {
            return Result.ok();
        }
        if (ERR.equals(tagged.tag()) && !tagged.isUnit()) {
            return Result.err(readConsistencyError(tagged.payload(), ctxt));
        }
        return ctxt.reportInputMismatch(Result.class, "Expected {\"Ok\":null} or {\"Err\":...} but found '%s'", tagged.tag());
    }
}
