package com.ryuqq.directory.wire.json;

import com.ryuqq.directory.core.error.OperationError;
import com.ryuqq.directory.core.filter.Filter;
import com.ryuqq.directory.core.filter.FilterCanonicalizer;
import com.ryuqq.directory.core.filter.RandomFilterGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Filter wire form through {@link WireCodec}.
 *
 * @author Directory Team
 * @since 1.0.0
 */
class FilterWireTest {

    private final WireCodec codec = new WireCodec();

    // ============================================================
    // 1. Encoding
    // ============================================================

    @Test
    void encode_Eq_TaggedPair() {
        assertThat(codec.encode(Filter.eq("name", "alice"))).isEqualTo("{\"Eq\":[\"name\",\"alice\"]}");
    }

    @Test
    void encode_Sub_TaggedPair() {
        assertThat(codec.encode(Filter.sub("name", "al"))).isEqualTo("{\"Sub\":[\"name\",\"al\"]}");
    }

    @Test
    void encode_Pres_TaggedString() {
        assertThat(codec.encode(Filter.pres("mail"))).isEqualTo("{\"Pres\":\"mail\"}");
    }

    @Test
    void encode_Self_BareString() {
        assertThat(codec.encode(Filter.self())).isEqualTo("\"Self\"");
    }

    @Test
    void encode_NestedCombinators_PreservesChildOrder() {
        // given
        Filter filter = Filter.and(
            Filter.eq("class", "person"),
            Filter.or(Filter.pres("mail"), Filter.self()),
            Filter.andNot(Filter.eq("name", "bob")));

        // when
        String json = codec.encode(filter);

        // then
        assertThat(json).isEqualTo(
            "{\"And\":[{\"Eq\":[\"class\",\"person\"]},"
                + "{\"Or\":[{\"Pres\":\"mail\"},\"Self\"]},"
                + "{\"AndNot\":{\"Eq\":[\"name\",\"bob\"]}}]}");
    }

    @Test
    void encode_EmptyCombinators_EmptyArrays() {
        assertThat(codec.encode(Filter.MATCH_ALL)).isEqualTo("{\"And\":[]}");
        assertThat(codec.encode(Filter.MATCH_NONE)).isEqualTo("{\"Or\":[]}");
    }

    // ============================================================
    // 2. Decoding
    // ============================================================

    @Test
    void decode_NestedFilter_ReturnsStructurallyEqualTree() {
        // given
        String json = "{\"Or\":[{\"Eq\":[\"name\",\"alice\"]},{\"AndNot\":\"Self\"},{\"And\":[]}]}";

        // when
        Filter filter = codec.decode(json, Filter.class);

        // then
        assertThat(filter).isEqualTo(Filter.or(
            Filter.eq("name", "alice"),
            Filter.andNot(Filter.self()),
            Filter.MATCH_ALL));
    }

    @Test
    void decode_EncodedFilter_ReturnsSameValue() {
        // given
        Filter filter = Filter.and(Filter.sub("mail", "@example"), Filter.pres("uuid"));

        // when
        Filter decoded = codec.decode(codec.encodeBytes(filter), Filter.class);

        // then
        assertThat(decoded).isEqualTo(filter);
    }

    @Test
    void decode_RandomTrees_RoundTrip() {
        RandomFilterGenerator generator = new RandomFilterGenerator(7L);

        for (int i = 0; i < 3_000; i++) {
            // given
            Filter filter = generator.next(5);

            // when
            Filter decoded = codec.decode(codec.encode(filter), Filter.class);

            // then
            assertThat(decoded).as("sample %d: %s", i, filter).isEqualTo(filter);
        }
    }

    @Test
    void decode_EmptyValue_Accepted() {
        assertThat(codec.decode("{\"Eq\":[\"name\",\"\"]}", Filter.class)).isEqualTo(Filter.eq("name", ""));
    }

    // ============================================================
    // 3. Rejection
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {
        "{",
        "null",
        "42",
        "\"Eq\"",
        "\"Unknown\"",
        "{\"Unknown\":[\"a\",\"b\"]}",
        "{\"Eq\":[\"name\"]}",
        "{\"Eq\":[\"name\",\"alice\",\"extra\"]}",
        "{\"Eq\":[\"name\",7]}",
        "{\"Eq\":[\"\",\"alice\"]}",
        "{\"Pres\":[\"mail\"]}",
        "{\"And\":{\"Pres\":\"mail\"}}",
        "{\"Self\":null}",
        "{\"Eq\":[\"a\",\"b\"],\"Pres\":\"c\"}"
    })
    void decode_MalformedFilter_ThrowsWireFormatException(String json) {
        assertThatThrownBy(() -> codec.decode(json, Filter.class))
            .isInstanceOf(WireFormatException.class)
            .satisfies(e -> assertThat(((WireFormatException) e).getError().getKind())
                .isEqualTo(OperationError.Kind.SERDE_JSON_ERROR));
    }

    // ============================================================
    // 4. Depth limit
    // ============================================================

    @Test
    void decode_FilterAtDepthLimit_Accepted() {
        // given
        WireCodec shallow = new WireCodec(3);
        String json = "{\"AndNot\":{\"AndNot\":{\"Pres\":\"mail\"}}}";

        // when
        Filter filter = shallow.decode(json, Filter.class);

        // then
        assertThat(filter.depth()).isEqualTo(3);
    }

    @Test
    void decode_FilterBeyondDepthLimit_Rejected() {
        // given
        WireCodec shallow = new WireCodec(3);
        String json = "{\"And\":[{\"Or\":[{\"AndNot\":{\"Pres\":\"mail\"}}]}]}";

        // when & then
        assertThatThrownBy(() -> shallow.decode(json, Filter.class))
            .isInstanceOf(WireFormatException.class);
    }

    @Test
    void encode_FilterBeyondDepthLimit_Rejected() {
        // given
        Filter filter = Filter.pres("mail");
        for (int i = 0; i < 4; i++) {
            filter = Filter.andNot(filter);
        }
        Filter tooDeep = filter;

        // when & then
        assertThatThrownBy(() -> new WireCodec(4).encode(tooDeep))
            .isInstanceOf(WireFormatException.class);
    }

    @Test
    void decode_HostileNesting_RejectedWithoutStackOverflow() {
        // given
        int levels = 100_000;
        StringBuilder json = new StringBuilder();
        for (int i = 0; i < levels; i++) {
            json.append("{\"AndNot\":");
        }
        json.append("\"Self\"");
        for (int i = 0; i < levels; i++) {
            json.append('}');
        }

        // when & then
        assertThatThrownBy(() -> codec.decode(json.toString(), Filter.class))
            .isInstanceOf(WireFormatException.class);
    }

    @Test
    void defaultDepthLimit_MatchesCanonicalizer() {
        assertThat(codec.getMaxFilterDepth()).isEqualTo(new FilterCanonicalizer().getMaxDepth());
    }

    @Test
    void constructor_NonPositiveDepth_Throws() {
        assertThatThrownBy(() -> new WireCodec(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxFilterDepth");
    }
}
