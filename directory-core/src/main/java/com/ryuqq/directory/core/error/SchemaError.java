package com.ryuqq.directory.core.error;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry shape violation reported by the schema validator.
 *
 * <p>Closed set of kinds. Only {@link Kind#MISSING_MUST_ATTRIBUTE} carries a payload
 * (the missing attribute name).</p>
 *
 * <p>Schema errors reach clients wrapped in
 * {@link OperationError.Kind#SCHEMA_VIOLATION}; see {@link #toOperationError()}.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class SchemaError {

    /**
     * Schema error kinds with their wire tag.
     */
    public enum Kind {
        NOT_IMPLEMENTED("NotImplemented", ErrorPayload.NONE),
        INVALID_CLASS("InvalidClass", ErrorPayload.NONE),
        MISSING_MUST_ATTRIBUTE("MissingMustAttribute", ErrorPayload.TEXT),
        INVALID_ATTRIBUTE("InvalidAttribute", ErrorPayload.NONE),
        INVALID_ATTRIBUTE_SYNTAX("InvalidAttributeSyntax", ErrorPayload.NONE),
        EMPTY_FILTER("EmptyFilter", ErrorPayload.NONE),
        CORRUPTED("Corrupted", ErrorPayload.NONE);

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

        /**
         * Looks up a kind by its wire tag.
         *
         * @param wireName the tag, e.g. {@code "InvalidClass"}
         * @return the kind, or empty when the tag is unknown
         */
        public static Optional<Kind> fromWireName(String wireName) {
            return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(wireName))
                .findFirst();
        }
    }

    private final Kind kind;
    private final String attribute;

    private SchemaError(Kind kind, String attribute) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind.payload() == ErrorPayload.TEXT && (attribute == null || attribute.isBlank())) {
            throw new IllegalArgumentException(kind.wireName() + " requires an attribute name");
        }
        if (kind.payload() == ErrorPayload.NONE && attribute != null) {
            throw new IllegalArgumentException(kind.wireName() + " carries no payload");
        }
        this.kind = kind;
        this.attribute = attribute;
    }

    /**
     * Creates a payload-free schema error.
     *
     * @param kind the kind
     * @return the error
     * @throws IllegalArgumentException if the kind requires a payload
     */
    public static SchemaError of(Kind kind) {
        return new SchemaError(kind, null);
    }

    /**
     * Creates a {@code MissingMustAttribute} error.
     *
     * @param attribute the missing attribute name
     * @return the error
     */
    public static SchemaError missingMustAttribute(String attribute) {
        return new SchemaError(Kind.MISSING_MUST_ATTRIBUTE, attribute);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the attribute name for {@code MissingMustAttribute}, null otherwise
     */
    public String getAttribute() {
        return attribute;
    }

    /**
     * Wraps this error as an {@code OperationError.SchemaViolation}.
     *
     * @return the operation error
     */
    public OperationError toOperationError() {
        return OperationError.schemaViolation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SchemaError that = (SchemaError) o;
        return kind == that.kind && Objects.equals(attribute, that.attribute);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, attribute);
    }

    @Override
    public String toString() {
        return attribute == null ? kind.wireName() : kind.wireName() + "(" + attribute + ")";
    }
}
