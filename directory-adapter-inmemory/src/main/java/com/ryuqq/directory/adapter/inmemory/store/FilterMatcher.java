package com.ryuqq.directory.adapter.inmemory.store;

import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.filter.Filter;

/**
 * Evaluates a filter against a single entry.
 *
 * <p>Empty {@code And} matches every entry and empty {@code Or} matches none.
 * {@code Self} matches the entry whose {@code uuid} attribute holds the
 * requesting principal's UUID; with no principal it matches nothing.</p>
 *
 * <p>Recursion depth equals filter depth; callers pass canonical filters, which the
 * canonicalizer has already bounded.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class FilterMatcher {

    /**
     * Tests an entry.
     *
     * @param filter the filter
     * @param entry the entry
     * @param selfUuid UUID of the requesting principal, null if unauthenticated
     * @return true if the entry matches
     */
    public boolean matches(Filter filter, Entry entry, String selfUuid) {
        if (filter instanceof Filter.Eq eq) {
            return entry.getValues(eq.attr()).contains(eq.value());
        }
        if (filter instanceof Filter.Sub sub) {
            return entry.getValues(sub.attr()).stream().anyMatch(value -> value.contains(sub.value()));
        }
        if (filter instanceof Filter.Pres pres) {
            return entry.hasAttribute(pres.attr());
        }
        if (filter instanceof Filter.And and) {
            return and.children().stream().allMatch(child -> matches(child, entry, selfUuid));
        }
        if (filter instanceof Filter.Or or) {
            return or.children().stream().anyMatch(child -> matches(child, entry, selfUuid));
        }
        if (filter instanceof Filter.AndNot not) {
            return !matches(not.child(), entry, selfUuid);
        }
        if (filter instanceof Filter.SelfUuid) {
            return selfUuid != null && entry.getValues(Entry.UUID_ATTRIBUTE).contains(selfUuid);
        }
        throw new IllegalArgumentException("Unsupported filter: " + filter);
    }
}
