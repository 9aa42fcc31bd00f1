package com.ryuqq.directory.wire.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.directory.core.filter.FilterCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Encodes and decodes protocol values in their JSON wire form.
 *
 * <p>Every failure surfaces as {@link WireFormatException}: malformed text, a repeated
 * object key, an unknown tag, or a filter over the depth limit. Instances are thread-safe.</p>
 *
 * <pre>{@code
 * WireCodec codec = new WireCodec();
 * String json = codec.encode(new SearchRequest(Filter.eq("name", "alice")));
 * SearchRequest back = codec.decode(json, SearchRequest.class);
 * }</pre>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class WireCodec {

    private static final Logger log = LoggerFactory.getLogger(WireCodec.class);

    private final ObjectMapper objectMapper;
    private final int maxFilterDepth;

    public WireCodec() {
        this(FilterCanonicalizer.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxFilterDepth deepest filter accepted or produced
     */
    public WireCodec(int maxFilterDepth) {
        if (maxFilterDepth < 1) {
            throw new IllegalArgumentException("maxFilterDepth must be at least 1 (current: " + maxFilterDepth + ")");
        }
        this.maxFilterDepth = maxFilterDepth;

        // each filter level costs two JSON levels (object + array), plus the envelope around it
        JsonFactory factory = JsonFactory.builder()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .streamReadConstraints(StreamReadConstraints.builder()
                .maxNestingDepth(maxFilterDepth * 4 + 16)
                .build())
            .build();
        this.objectMapper = new ObjectMapper(factory);
        this.objectMapper.registerModule(new DirectoryModule(maxFilterDepth));
    }

    public String encode(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Failed to encode {}: {}", value.getClass().getSimpleName(), e.getOriginalMessage());
            throw new WireFormatException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    public byte[] encodeBytes(Object value) {
        return encode(value).getBytes(StandardCharsets.UTF_8);
    }

    public <T> T decode(String json, Class<T> type) {
        if (json == null) {
            throw new WireFormatException("Failed to decode " + type.getSimpleName() + ": input is null", null);
        }
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new WireFormatException("Failed to decode " + type.getSimpleName() + ": null document", null);
            }
            return value;
        } catch (IOException e) {
            log.debug("Failed to decode {}: {}", type.getSimpleName(), e.getMessage());
            throw new WireFormatException("Failed to decode " + type.getSimpleName(), e);
        } catch (IllegalArgumentException e) {
            log.debug("Rejected {} payload: {}", type.getSimpleName(), e.getMessage());
            throw new WireFormatException("Failed to decode " + type.getSimpleName(), e);
        }
    }

    public <T> T decode(byte[] json, Class<T> type) {
        if (json == null) {
            throw new WireFormatException("Failed to decode " + type.getSimpleName() + ": input is null", null);
        }
        return decode(new String(json, StandardCharsets.UTF_8), type);
    }

    public int getMaxFilterDepth() {
        return maxFilterDepth;
    }

    /**
     * @return the configured mapper, for embedding the protocol types into larger documents
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
