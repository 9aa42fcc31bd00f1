package com.ryuqq.directory.core.error;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Structural integrity fault found by a consistency check.
 *
 * <p>A consistency pass reports one result per check, so several faults can be
 * surfaced together inside {@link OperationError#consistency(java.util.List)}.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class ConsistencyError {

    /**
     * Consistency error kinds with their wire tag.
     */
    public enum Kind {
        UNKNOWN("Unknown", ErrorPayload.NONE),
        SCHEMA_CLASS_MISSING_ATTRIBUTE("SchemaClassMissingAttribute", ErrorPayload.TEXT_PAIR),
        QUERY_SERVER_SEARCH_FAILURE("QueryServerSearchFailure", ErrorPayload.NONE),
        ENTRY_UUID_CORRUPT("EntryUuidCorrupt", ErrorPayload.ENTRY_ID),
        UUID_INDEX_CORRUPT("UuidIndexCorrupt", ErrorPayload.TEXT),
        UUID_NOT_UNIQUE("UuidNotUnique", ErrorPayload.TEXT),
        REFINT_NOT_UPHELD("RefintNotUpheld", ErrorPayload.ENTRY_ID),
        MEMBER_OF_INVALID("MemberOfInvalid", ErrorPayload.ENTRY_ID),
        INVALID_ATTRIBUTE_TYPE("InvalidAttributeType", ErrorPayload.TEXT),
        DUPLICATE_UNIQUE_ATTRIBUTE("DuplicateUniqueAttribute", ErrorPayload.TEXT);

        private final String wireName;
        private final ErrorPayload payload;

        Kind(String wireName, ErrorPayload payload) {
            this.wireName = wireName;
            this.payload = payload;
        }

        public String wireName() {
            return wireName;
        }

        public ErrorPayload payload() {
            return payload;
        }

        public static Optional<Kind> fromWireName(String wireName) {
            return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(wireName))
                .findFirst();
        }
    }

    private final Kind kind;
    private final String text;
    private final String secondText;
    private final Long entryId;

    private ConsistencyError(Kind kind, String text, String secondText, Long entryId) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        boolean shapeMatches = switch (kind.payload()) {
            case NONE -> text == null && secondText == null && entryId == null;
            case TEXT -> text != null && secondText == null && entryId == null;
            case TEXT_PAIR -> text != null && secondText != null && entryId == null;
            case ENTRY_ID -> text == null && secondText == null && entryId != null;
            default -> false;
        };
        if (!shapeMatches) {
            throw new IllegalArgumentException(
                "Payload does not match " + kind.wireName() + " (expected " + kind.payload() + ")");
        }
        this.kind = kind;
        this.text = text;
        this.secondText = secondText;
        this.entryId = entryId;
    }

    public static ConsistencyError of(Kind kind) {
        return new ConsistencyError(kind, null, null, null);
    }

    public static ConsistencyError withText(Kind kind, String text) {
        return new ConsistencyError(kind, text, null, null);
    }

    /**
     * Creates an id-carrying error. The id is unsigned 64-bit; values above
     * {@code Long.MAX_VALUE} are passed as their two's complement bit pattern.
     *
     * @param kind the kind
     * @param entryId the entry id, unsigned
     * @return the error
     * @throws IllegalArgumentException if the kind does not carry an entry id
     */
    public static ConsistencyError withEntryId(Kind kind, long entryId) {
        return new ConsistencyError(kind, null, null, entryId);
    }

    public static ConsistencyError schemaClassMissingAttribute(String className, String attribute) {
        return new ConsistencyError(Kind.SCHEMA_CLASS_MISSING_ATTRIBUTE, className, attribute, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return first text payload (or class name for {@code SchemaClassMissingAttribute}), null if none
     */
    public String getText() {
        return text;
    }

    /**
     * @return attribute name for {@code SchemaClassMissingAttribute}, null otherwise
     */
    public String getSecondText() {
        return secondText;
    }

    /**
     * @return entry identifier bit pattern for id-carrying kinds, null otherwise
     */
    public Long getEntryId() {
        return entryId;
    }

    /**
     * @return entry identifier as an unsigned decimal, null if none
     */
    public String getEntryIdText() {
        return entryId == null ? null : Long.toUnsignedString(entryId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsistencyError that = (ConsistencyError) o;
        return kind == that.kind
            && Objects.equals(text, that.text)
            && Objects.equals(secondText, that.secondText)
            && Objects.equals(entryId, that.entryId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, secondText, entryId);
    }

    @Override
    public String toString() {
        return switch (kind.payload()) {
            case TEXT -> kind.wireName() + "(" + text + ")";
            case TEXT_PAIR -> kind.wireName() + "(" + text + ", " + secondText + ")";
            case ENTRY_ID -> kind.wireName() + "(" + getEntryIdText() + ")";
            default -> kind.wireName();
        };
    }
}
