package com.ryuqq.directory.core.error;

import com.ryuqq.directory.core.outcome.Result;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Top-level failure of a protocol operation.
 *
 * <p>Covers request shape problems, authentication and authorisation failures,
 * backend faults, and the two wrapped layers:</p>
 * <ul>
 *   <li>{@link Kind#SCHEMA_VIOLATION} wraps a {@link SchemaError}</li>
 *   <li>{@link Kind#CONSISTENCY_ERROR} wraps one result per consistency check</li>
 * </ul>
 *
 * <p>Operation errors are values: operations return them inside a
 * {@link Result}, they are never thrown.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class OperationError {

    /**
     * Operation error kinds with their wire tag and payload shape.
     */
    public enum Kind {
        EMPTY_REQUEST("EmptyRequest", ErrorPayload.NONE),
        BACKEND("Backend", ErrorPayload.NONE),
        NO_MATCHING_ENTRIES("NoMatchingEntries", ErrorPayload.NONE),
        CORRUPTED_ENTRY("CorruptedEntry", ErrorPayload.ENTRY_ID),
        CONSISTENCY_ERROR("ConsistencyError", ErrorPayload.CONSISTENCY),
        SCHEMA_VIOLATION("SchemaViolation", ErrorPayload.SCHEMA),
        PLUGIN("Plugin", ErrorPayload.NONE),
        FILTER_GENERATION("FilterGeneration", ErrorPayload.NONE),
        FILTER_UUID_RESOLUTION("FilterUUIDResolution", ErrorPayload.NONE),
        INVALID_ATTRIBUTE_NAME("InvalidAttributeName", ErrorPayload.TEXT),
        INVALID_ATTRIBUTE("InvalidAttribute", ErrorPayload.TEXT),
        INVALID_DB_STATE("InvalidDBState", ErrorPayload.NONE),
        INVALID_ENTRY_ID("InvalidEntryID", ErrorPayload.NONE),
        INVALID_REQUEST_STATE("InvalidRequestState", ErrorPayload.NONE),
        INVALID_STATE("InvalidState", ErrorPayload.NONE),
        INVALID_ENTRY_STATE("InvalidEntryState", ErrorPayload.NONE),
        INVALID_UUID("InvalidUuid", ErrorPayload.NONE),
        INVALID_ACP_STATE("InvalidACPState", ErrorPayload.TEXT),
        INVALID_SCHEMA_STATE("InvalidSchemaState", ErrorPayload.TEXT),
        INVALID_ACCOUNT_STATE("InvalidAccountState", ErrorPayload.TEXT),
        BACKEND_ENGINE("BackendEngine", ErrorPayload.NONE),
        SQLITE_ERROR("SQLiteError", ErrorPayload.NONE),
        FS_ERROR("FsError", ErrorPayload.NONE),
        SERDE_JSON_ERROR("SerdeJsonError", ErrorPayload.NONE),
        SERDE_CBOR_ERROR("SerdeCborError", ErrorPayload.NONE),
        ACCESS_DENIED("AccessDenied", ErrorPayload.NONE),
        NOT_AUTHENTICATED("NotAuthenticated", ErrorPayload.NONE),
        INVALID_AUTH_STATE("InvalidAuthState", ErrorPayload.TEXT),
        INVALID_SESSION_STATE("InvalidSessionState", ErrorPayload.NONE),
        SYSTEM_PROTECTED_OBJECT("SystemProtectedObject", ErrorPayload.NONE);

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
    private final String detail;
    private final Long entryId;
    private final SchemaError schemaError;
    private final List<Result<Void, ConsistencyError>> consistencyResults;

    private OperationError(Kind kind,
                           String detail,
                           Long entryId,
                           SchemaError schemaError,
                           List<Result<Void, ConsistencyError>> consistencyResults) {
        this.kind = kind;
        this.detail = detail;
        this.entryId = entryId;
        this.schemaError = schemaError;
        this.consistencyResults = consistencyResults;
    }

    /**
     * Creates a payload-free operation error.
     *
     * @param kind the kind
     * @return the error
     * @throws IllegalArgumentException if kind is null or requires a payload
     */
    public static OperationError of(Kind kind) {
        requireShape(kind, ErrorPayload.NONE);
        return new OperationError(kind, null, null, null, null);
    }

    /**
     * Creates an operation error carrying a text detail
     * (e.g. {@code InvalidAttributeName}, {@code InvalidAuthState}).
     *
     * @param kind the kind
     * @param detail the detail text
     * @return the error
     * @throws IllegalArgumentException if the kind does not carry text or detail is null
     */
    public static OperationError withDetail(Kind kind, String detail) {
        requireShape(kind, ErrorPayload.TEXT);
        if (detail == null) {
            throw new IllegalArgumentException("detail cannot be null for " + kind.wireName());
        }
        return new OperationError(kind, detail, null, null, null);
    }

    /**
     * Creates a {@code CorruptedEntry} error.
     *
     * <p>Entry ids are unsigned 64-bit values; ids above {@code Long.MAX_VALUE} are
     * passed as their two's complement bit pattern (e.g. {@code -1} for 2^64-1).</p>
     *
     * @param entryId the corrupted entry identifier, unsigned
     * @return the error
     */
    public static OperationError corruptedEntry(long entryId) {
        return new OperationError(Kind.CORRUPTED_ENTRY, null, entryId, null, null);
    }

    /**
     * Wraps a schema error.
     *
     * @param schemaError the schema error
     * @return a {@code SchemaViolation} error
     * @throws IllegalArgumentException if schemaError is null
     */
    public static OperationError schemaViolation(SchemaError schemaError) {
        if (schemaError == null) {
            throw new IllegalArgumentException("schemaError cannot be null");
        }
        return new OperationError(Kind.SCHEMA_VIOLATION, null, null, schemaError, null);
    }

    /**
     * Wraps the per-check results of a consistency pass.
     *
     * <p>Passed checks are kept as {@code Ok} entries so the report preserves
     * the position of every check.</p>
     *
     * @param results one result per check, in check order
     * @return a {@code ConsistencyError} error
     * @throws IllegalArgumentException if results is null or contains null
     */
    public static OperationError consistency(List<Result<Void, ConsistencyError>> results) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        for (Result<Void, ConsistencyError> result : results) {
            if (result == null) {
                throw new IllegalArgumentException("results cannot contain null");
            }
        }
        return new OperationError(Kind.CONSISTENCY_ERROR, null, null, null, List.copyOf(results));
    }

    private static void requireShape(Kind kind, ErrorPayload expected) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind.payload() != expected) {
            throw new IllegalArgumentException(
                kind.wireName() + " expects payload " + kind.payload() + ", not " + expected);
        }
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return text detail for text-carrying kinds, null otherwise
     */
    public String getDetail() {
        return detail;
    }

    /**
     * @return entry id bit pattern for {@code CorruptedEntry}, null otherwise
     * @see #getEntryIdText()
     */
    public Long getEntryId() {
        return entryId;
    }

    /**
     * @return entry id as an unsigned decimal for {@code CorruptedEntry}, null otherwise
     */
    public String getEntryIdText() {
        return entryId == null ? null : Long.toUnsignedString(entryId);
    }

    /**
     * @return wrapped schema error for {@code SchemaViolation}, null otherwise
     */
    public SchemaError getSchemaError() {
        return schemaError;
    }

    /**
     * @return per-check results for {@code ConsistencyError}, null otherwise
     */
    public List<Result<Void, ConsistencyError>> getConsistencyResults() {
        return consistencyResults;
    }

    /**
     * Returns only the failed checks of a consistency report.
     *
     * @return failed checks, empty for other kinds
     */
    public List<ConsistencyError> failedChecks() {
        if (consistencyResults == null) {
            return List.of();
        }
        return consistencyResults.stream()
            .filter(Result::isErr)
            .map(Result::getError)
            .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationError that = (OperationError) o;
        return kind == that.kind
            && Objects.equals(detail, that.detail)
            && Objects.equals(entryId, that.entryId)
            && Objects.equals(schemaError, that.schemaError)
            && Objects.equals(consistencyResults, that.consistencyResults);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, detail, entryId, schemaError, consistencyResults);
    }

    @Override
    public String toString() {
        return switch (kind.payload()) {
            case TEXT -> kind.wireName() + "(" + detail + ")";
            case ENTRY_ID -> kind.wireName() + "(" + getEntryIdText() + ")";
            case SCHEMA -> kind.wireName() + "(" + schemaError + ")";
            case CONSISTENCY -> kind.wireName() + failedChecks();
            default -> kind.wireName();
        };
    }
}
