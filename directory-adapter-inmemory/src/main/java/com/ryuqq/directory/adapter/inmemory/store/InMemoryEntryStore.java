package com.ryuqq.directory.adapter.inmemory.store;

import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.error.ConsistencyError;
import com.ryuqq.directory.core.error.OperationError;
import com.ryuqq.directory.core.error.SchemaError;
import com.ryuqq.directory.core.filter.Filter;
import com.ryuqq.directory.core.modify.ModifyList;
import com.ryuqq.directory.core.outcome.Result;
import com.ryuqq.directory.core.spi.EntryStore;
import com.ryuqq.directory.core.spi.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory implementation of {@link EntryStore} SPI for tests and embedding.
 *
 * <p>Entries are keyed by their {@code uuid} attribute. Entries created without one
 * are assigned a random UUID. Deleted entries move to a recycle bin from which they
 * can be searched and revived.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>live:</strong> LinkedHashMap&lt;String, Entry&gt; - live entries in creation order</li>
 *   <li><strong>recycled:</strong> LinkedHashMap&lt;String, Entry&gt; - soft-deleted entries in deletion order</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong> every method is {@code synchronized}; evaluation is a
 * linear scan, so this store is meant for small data sets.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public class InMemoryEntryStore implements EntryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEntryStore.class);

    private final SchemaValidator validator;
    private final FilterMatcher matcher;
    private final Map<String, Entry> live;
    private final Map<String, Entry> recycled;

    /**
     * Creates an empty store.
     *
     * @param validator validator applied to modified entries
     * @throws IllegalArgumentException if validator is null
     */
    public InMemoryEntryStore(SchemaValidator validator) {
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        this.validator = validator;
        this.matcher = new FilterMatcher();
        this.live = new LinkedHashMap<>();
        this.recycled = new LinkedHashMap<>();
    }

    @Override
    public synchronized Result<List<Entry>, OperationError> evaluate(Filter filter, String selfUuid) {
        return select(live, filter, selfUuid);
    }

    @Override
    public synchronized Result<List<Entry>, OperationError> evaluateRecycled(Filter filter, String selfUuid) {
        return select(recycled, filter, selfUuid);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>One consistency check per entry: its UUID must be unique across the batch,
     *       the live set and the recycle bin</li>
     *   <li>Any failed check rejects the whole batch</li>
     * </ul>
     */
    @Override
    public synchronized Result<Void, OperationError> create(List<Entry> entries) {
        if (entries == null || entries.isEmpty()) {
            return Result.err(OperationError.of(OperationError.Kind.EMPTY_REQUEST));
        }

        List<Entry> prepared = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            List<String> uuids = entry.getValues(Entry.UUID_ATTRIBUTE);
            if (uuids.size() > 1) {
                return Result.err(OperationError.of(OperationError.Kind.INVALID_UUID));
            }
            prepared.add(uuids.isEmpty()
                    ? entry.toBuilder().add(Entry.UUID_ATTRIBUTE, UUID.randomUUID().toString()).build()
                    : entry);
        }

        Set<String> seen = new HashSet<>();
        List<Result<Void, ConsistencyError>> checks = new ArrayList<>(prepared.size());
        boolean failed = false;
        for (Entry entry : prepared) {
            String uuid = uuidOf(entry);
            if (!seen.add(uuid) || live.containsKey(uuid) || recycled.containsKey(uuid)) {
                checks.add(Result.err(ConsistencyError.withText(ConsistencyError.Kind.UUID_NOT_UNIQUE, uuid)));
                failed = true;
            } else {
                checks.add(Result.ok());
            }
        }
        if (failed) {
            log.warn("Create rejected: duplicate uuid in batch of {}", prepared.size());
            return Result.err(OperationError.consistency(checks));
        }

        for (Entry entry : prepared) {
            live.put(uuidOf(entry), entry);
        }
        log.debug("Created {} entries", prepared.size());
        return Result.ok();
    }

    @Override
    public synchronized Result<Void, OperationError> delete(Filter filter, String selfUuid) {
        return select(live, filter, selfUuid).flatMap(matched -> {
            if (matched.isEmpty()) {
                return Result.err(OperationError.of(OperationError.Kind.NO_MATCHING_ENTRIES));
            }
            for (Entry entry : matched) {
                String uuid = uuidOf(entry);
                live.remove(uuid);
                recycled.put(uuid, entry);
            }
            log.debug("Recycled {} entries", matched.size());
            return Result.ok();
        });
    }

    /**
     * {@inheritDoc}
     *
     * <p>All modified entries are validated before any is stored. The {@code uuid}
     * attribute cannot be changed.</p>
     */
    @Override
    public synchronized Result<Void, OperationError> modify(Filter filter, ModifyList modlist, String selfUuid) {
        if (modlist == null || modlist.isEmpty()) {
            return Result.err(OperationError.of(OperationError.Kind.EMPTY_REQUEST));
        }

        return select(live, filter, selfUuid).flatMap(matched -> {
            if (matched.isEmpty()) {
                return Result.err(OperationError.of(OperationError.Kind.NO_MATCHING_ENTRIES));
            }

            Map<String, Entry> modified = new LinkedHashMap<>();
            for (Entry entry : matched) {
                Entry next = modlist.applyTo(entry);
                String uuid = uuidOf(entry);
                if (!next.getValues(Entry.UUID_ATTRIBUTE).equals(List.of(uuid))) {
                    return Result.err(OperationError.withDetail(
                            OperationError.Kind.INVALID_ATTRIBUTE, Entry.UUID_ATTRIBUTE));
                }
                Result<Void, SchemaError> validation = validator.validate(next);
                if (validation.isErr()) {
                    return Result.err(validation.getError().toOperationError());
                }
                modified.put(uuid, next);
            }

            live.putAll(modified);
            log.debug("Modified {} entries", modified.size());
            return Result.ok();
        });
    }

    @Override
    public synchronized Result<Void, OperationError> revive(Filter filter, String selfUuid) {
        return select(recycled, filter, selfUuid).flatMap(matched -> {
            if (matched.isEmpty()) {
                return Result.err(OperationError.of(OperationError.Kind.NO_MATCHING_ENTRIES));
            }
            for (Entry entry : matched) {
                String uuid = uuidOf(entry);
                recycled.remove(uuid);
                live.put(uuid, entry);
            }
            log.debug("Revived {} entries", matched.size());
            return Result.ok();
        });
    }

    private Result<List<Entry>, OperationError> select(Map<String, Entry> source, Filter filter, String selfUuid) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (selfUuid == null && filter.containsSelfUuid()) {
            return Result.err(OperationError.of(OperationError.Kind.FILTER_UUID_RESOLUTION));
        }

        List<Entry> matched = new ArrayList<>();
        for (Entry entry : source.values()) {
            if (matcher.matches(filter, entry, selfUuid)) {
                matched.add(entry);
            }
        }
        return Result.ok(matched);
    }

    private static String uuidOf(Entry entry) {
        return entry.getValues(Entry.UUID_ATTRIBUTE).get(0);
    }

    /**
     * Clears live and recycled entries.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public synchronized void clear() {
        live.clear();
        recycled.clear();
    }

    /**
     * @return number of live entries
     */
    public synchronized int liveCount() {
        return live.size();
    }

    /**
     * @return number of recycled entries
     */
    public synchronized int recycledCount() {
        return recycled.size();
    }
}
