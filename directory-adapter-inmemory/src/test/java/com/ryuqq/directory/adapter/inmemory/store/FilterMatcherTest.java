package com.ryuqq.directory.adapter.inmemory.store;

import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.filter.Filter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FilterMatcher}.
 *
 * @author Directory Team
 * @since 1.0.0
 */
class FilterMatcherTest {

    private final FilterMatcher matcher = new FilterMatcher();

    private final Entry alice = Entry.builder()
        .add("name", "alice")
        .add("mail", "alice@example.com", "a@example.com")
        .add(Entry.UUID_ATTRIBUTE, "u-alice")
        .build();

    @Test
    void testEq_MatchesAnyValueExactly() {
        assertThat(matcher.matches(Filter.eq("mail", "a@example.com"), alice, null)).isTrue();
        assertThat(matcher.matches(Filter.eq("name", "Alice"), alice, null)).isFalse();
        assertThat(matcher.matches(Filter.eq("missing", "alice"), alice, null)).isFalse();
    }

    @Test
    void testSub_MatchesSubstring() {
        assertThat(matcher.matches(Filter.sub("mail", "@example"), alice, null)).isTrue();
        assertThat(matcher.matches(Filter.sub("name", "bob"), alice, null)).isFalse();
    }

    @Test
    void testPres_MatchesAttributePresence() {
        assertThat(matcher.matches(Filter.pres("mail"), alice, null)).isTrue();
        assertThat(matcher.matches(Filter.pres("phone"), alice, null)).isFalse();
    }

    @Test
    void testPres_AttributeGivenNoValues_NotPresent() {
        Entry entry = Entry.of(Map.of("mail", List.of(), "name", List.of("bob")));

        assertThat(matcher.matches(Filter.pres("mail"), entry, null)).isFalse();
        assertThat(matcher.matches(Filter.pres("name"), entry, null)).isTrue();
    }

    @Test
    void testSentinels_EmptyAndMatchesAll_EmptyOrMatchesNone() {
        assertThat(matcher.matches(Filter.MATCH_ALL, alice, null)).isTrue();
        assertThat(matcher.matches(Filter.MATCH_NONE, alice, null)).isFalse();
        assertThat(matcher.matches(Filter.andNot(Filter.MATCH_NONE), alice, null)).isTrue();
    }

    @Test
    void testCombinators_Nested() {
        Filter filter = Filter.and(
            Filter.pres("name"),
            Filter.or(Filter.eq("name", "bob"), Filter.sub("mail", "alice")),
            Filter.andNot(Filter.pres("locked")));

        assertThat(matcher.matches(filter, alice, null)).isTrue();
    }

    @Test
    void testSelf_MatchesOnlyRequestingPrincipal() {
        assertThat(matcher.matches(Filter.self(), alice, "u-alice")).isTrue();
        assertThat(matcher.matches(Filter.self(), alice, "u-bob")).isFalse();
        assertThat(matcher.matches(Filter.self(), alice, null)).isFalse();
    }
}
