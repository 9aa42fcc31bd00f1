package com.ryuqq.directory.core.error;

import com.ryuqq.directory.core.outcome.Result;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Error taxonomy tests.
 *
 * @author Directory Team
 * @since 1.0.0
 */
class OperationErrorTest {

    @Test
    void of_PayloadFreeKind_Creates() {
        // When
        OperationError error = OperationError.of(OperationError.Kind.ACCESS_DENIED);

        // Then
        assertEquals(OperationError.Kind.ACCESS_DENIED, error.getKind());
        assertNull(error.getDetail());
        assertEquals("AccessDenied", error.toString());
    }

    @Test
    void of_KindRequiringPayload_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> OperationError.of(OperationError.Kind.INVALID_AUTH_STATE));
        assertThrows(IllegalArgumentException.class, () -> OperationError.of(OperationError.Kind.CORRUPTED_ENTRY));
    }

    @Test
    void withDetail_TextKind_CarriesDetail() {
        // When
        OperationError error = OperationError.withDetail(OperationError.Kind.INVALID_ATTRIBUTE_NAME, "bad name");

        // Then
        assertEquals("bad name", error.getDetail());
        assertEquals(error, OperationError.withDetail(OperationError.Kind.INVALID_ATTRIBUTE_NAME, "bad name"));
    }

    @Test
    void withDetail_NonTextKind_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> OperationError.withDetail(OperationError.Kind.BACKEND, "x"));
    }

    @Test
    void schemaViolation_WrapsSchemaError() {
        // Given
        SchemaError schemaError = SchemaError.missingMustAttribute("name");

        // When
        OperationError error = schemaError.toOperationError();

        // Then
        assertEquals(OperationError.Kind.SCHEMA_VIOLATION, error.getKind());
        assertEquals(schemaError, error.getSchemaError());
    }

    @Test
    void consistency_KeepsPassedChecks_FailedChecksFiltersThem() {
        // Given
        ConsistencyError duplicate = ConsistencyError.withText(ConsistencyError.Kind.UUID_NOT_UNIQUE, "u-1");
        List<Result<Void, ConsistencyError>> checks = List.of(Result.ok(), Result.err(duplicate), Result.ok());

        // When
        OperationError error = OperationError.consistency(checks);

        // Then
        assertEquals(3, error.getConsistencyResults().size());
        assertEquals(List.of(duplicate), error.failedChecks());
    }

    @Test
    void corruptedEntry_CarriesId() {
        // When
        OperationError error = OperationError.corruptedEntry(12);

        // Then
        assertEquals(12L, error.getEntryId());
        assertEquals("CorruptedEntry(12)", error.toString());
    }

    // ============================================================
    // Wire names
    // ============================================================

    @ParameterizedTest
    @EnumSource(OperationError.Kind.class)
    void fromWireName_EveryKind_RoundTrips(OperationError.Kind kind) {
        assertEquals(kind, OperationError.Kind.fromWireName(kind.wireName()).orElseThrow());
    }

    @Test
    void wireNames_Unique() {
        // When
        Set<String> names = Arrays.stream(OperationError.Kind.values())
            .map(OperationError.Kind::wireName)
            .collect(Collectors.toSet());

        // Then
        assertEquals(OperationError.Kind.values().length, names.size());
    }

    @Test
    void fromWireName_Unknown_Empty() {
        assertTrue(OperationError.Kind.fromWireName("Exploded").isEmpty());
        assertTrue(SchemaError.Kind.fromWireName("backend").isEmpty());
        assertTrue(ConsistencyError.Kind.fromWireName("").isEmpty());
    }

    // ============================================================
    // SchemaError / ConsistencyError
    // ============================================================

    @Test
    void schemaError_PayloadShapeEnforced() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> SchemaError.of(SchemaError.Kind.MISSING_MUST_ATTRIBUTE));
        assertThrows(IllegalArgumentException.class, () -> SchemaError.missingMustAttribute(" "));
        assertEquals("name", SchemaError.missingMustAttribute("name").getAttribute());
    }

    @Test
    void consistencyError_PayloadShapeEnforced() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> ConsistencyError.of(ConsistencyError.Kind.REFINT_NOT_UPHELD));
        assertThrows(IllegalArgumentException.class,
            () -> ConsistencyError.withText(ConsistencyError.Kind.UNKNOWN, "x"));
        assertThrows(IllegalArgumentException.class,
            () -> ConsistencyError.withEntryId(ConsistencyError.Kind.UUID_NOT_UNIQUE, 1));

        ConsistencyError pair = ConsistencyError.schemaClassMissingAttribute("person", "name");
        assertEquals("person", pair.getText());
        assertEquals("name", pair.getSecondText());
    }
}
