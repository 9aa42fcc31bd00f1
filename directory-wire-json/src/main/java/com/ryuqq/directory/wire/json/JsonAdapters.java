package com.ryuqq.directory.wire.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Bridges the static write/read functions of the JSON form classes into Jackson.
 *
 * @author Directory Team
 * @since 1.0.0
 */
final class JsonAdapters {

    private JsonAdapters() {
        throw new UnsupportedOperationException("Utility class");
    }

    @FunctionalInterface
    interface Writer<T> {
        void write(T value, JsonGenerator gen) throws IOException;
    }

    @FunctionalInterface
    interface Reader<T> {
        T read(JsonNode node, DeserializationContext ctxt) throws IOException;
    }

    static <T> StdSerializer<T> serializer(Class<T> type, Writer<T> writer) {
        return new WriterSerializer<>(type, writer);
    }

    static <T> StdDeserializer<T> deserializer(Class<T> type, Reader<T> reader) {
        return new ReaderDeserializer<>(type, reader);
    }

    private static final class WriterSerializer<T> extends StdSerializer<T> {

        private static final long serialVersionUID = 1L;
        private final transient Writer<T> writer;

        WriterSerializer(Class<T> type, Writer<T> writer) {
            super(type);
            this.writer = writer;
        }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            writer.write(value, gen);
        }
    }

    private static final class ReaderDeserializer<T> extends StdDeserializer<T> {

        private static final long serialVersionUID = 1L;
        private final transient Reader<T> reader;

        ReaderDeserializer(Class<T> type, Reader<T> reader) {
            super(type);
            this.reader = reader;
        }

        @Override
        public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return reader.read(ctxt.readTree(p), ctxt);
        }
    }
}
