package com.ryuqq.directory.core.spi;

import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.error.OperationError;
import com.ryuqq.directory.core.filter.Filter;
import com.ryuqq.directory.core.modify.ModifyList;
import com.ryuqq.directory.core.outcome.Result;

import java.util.List;

/**
 * Storage and query engine SPI.
 *
 * <p>The engine resolves canonical filters against persisted entries. It is the only
 * component that resolves {@link Filter.SelfUuid}: callers pass the requesting
 * principal's UUID, or null when the request is unauthenticated.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Evaluate filters over live entries and over the recycle bin</li>
 *   <li>Create entries, rejecting duplicate UUIDs with a consistency report</li>
 *   <li>Soft-delete matched entries into the recycle bin and revive them</li>
 *   <li>Apply modify lists, revalidating every modified entry</li>
 * </ul>
 *
 * <p><strong>Error contract:</strong></p>
 * <ul>
 *   <li>{@code FilterUUIDResolution}: filter contains Self and selfUuid is null</li>
 *   <li>{@code NoMatchingEntries}: delete, modify or revive selected nothing</li>
 *   <li>{@code SchemaViolation}: a modified entry no longer validates</li>
 *   <li>{@code ConsistencyError}: create would break UUID uniqueness</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Filters are expected in canonical form and within the depth limit</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public interface EntryStore {

    /**
     * Evaluates a filter against live entries.
     *
     * @param filter canonical filter
     * @param selfUuid UUID of the requesting principal, null if unauthenticated
     * @return matching entries in storage order
     */
    Result<List<Entry>, OperationError> evaluate(Filter filter, String selfUuid);

    /**
     * Evaluates a filter against the recycle bin.
     *
     * @param filter canonical filter
     * @param selfUuid UUID of the requesting principal, null if unauthenticated
     * @return matching recycled entries
     */
    Result<List<Entry>, OperationError> evaluateRecycled(Filter filter, String selfUuid);

    /**
     * Creates entries atomically: either all are stored or none.
     *
     * @param entries entries already accepted by the schema validator
     * @return empty result, or the failure
     */
    Result<Void, OperationError> create(List<Entry> entries);

    /**
     * Moves every matching live entry into the recycle bin.
     *
     * @param filter canonical filter
     * @param selfUuid UUID of the requesting principal, null if unauthenticated
     * @return empty result, or the failure
     */
    Result<Void, OperationError> delete(Filter filter, String selfUuid);

    /**
     * Applies a modify list to every matching live entry.
     *
     * @param filter canonical filter
     * @param modlist ordered modifications
     * @param selfUuid UUID of the requesting principal, null if unauthenticated
     * @return empty result, or the failure
     */
    Result<Void, OperationError> modify(Filter filter, ModifyList modlist, String selfUuid);

    /**
     * Restores every matching recycled entry to the live set.
     *
     * @param filter canonical filter
     * @param selfUuid UUID of the requesting principal, null if unauthenticated
     * @return empty result, or the failure
     */
    Result<Void, OperationError> revive(Filter filter, String selfUuid);
}
