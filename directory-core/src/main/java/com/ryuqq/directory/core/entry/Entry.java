package com.ryuqq.directory.core.entry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 디렉터리 객체 (속성 → 다중 값).
 *
 * <p>Entry는 속성 이름에서 문자열 값 목록으로의 매핑입니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. 변경은 {@code ModifyList}를
 * 적용해 새 Entry를 만드는 방식으로만 표현됩니다.</p>
 * <p><strong>순서:</strong></p>
 * <ul>
 *   <li>속성은 이름 순으로 정렬</li>
 *   <li>속성 내 값은 삽입 순서 유지</li>
 *   <li>중복 값 허용 (중복 제거는 스키마/백엔드 정책)</li>
 * </ul>
 *
 * <p>값이 없는 속성은 보관하지 않습니다. 빈 값 목록은 속성이 없는 것과 같습니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class Entry {

    /**
     * 엔트리 UUID를 담는 속성 이름.
     */
    public static final String UUID_ATTRIBUTE = "uuid";

    private final Map<String, List<String>> attrs;

    private Entry(Map<String, List<String>> attrs) {
        TreeMap<String, List<String>> copy = new TreeMap<>();
        for (Map.Entry<String, List<String>> e : attrs.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new IllegalArgumentException("Attribute name cannot be null or blank");
            }
            if (e.getValue() == null) {
                throw new IllegalArgumentException("Values cannot be null for attribute: " + e.getKey());
            }
            for (String value : e.getValue()) {
                if (value == null) {
                    throw new IllegalArgumentException("Value cannot be null for attribute: " + e.getKey());
                }
            }
            if (!e.getValue().isEmpty()) {
                copy.put(e.getKey(), List.copyOf(e.getValue()));
            }
        }
        this.attrs = Collections.unmodifiableMap(copy);
    }

    /**
     * Entry 생성.
     *
     * @param attrs 속성 → 값 목록
     * @return Entry 인스턴스
     * @throws IllegalArgumentException attrs가 null이거나 null 이름/값을 포함한 경우
     */
    public static Entry of(Map<String, List<String>> attrs) {
        if (attrs == null) {
            throw new IllegalArgumentException("attrs cannot be null");
        }
        return new Entry(attrs);
    }

    /**
     * 빈 Entry 생성.
     *
     * @return 속성이 없는 Entry
     */
    public static Entry empty() {
        return new Entry(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 전체 속성 조회 (읽기 전용, 이름 순).
     *
     * @return 속성 → 값 목록
     */
    public Map<String, List<String>> getAttrs() {
        return attrs;
    }

    /**
     * 속성 값 목록 조회.
     *
     * @param attr 속성 이름
     * @return 값 목록 (속성이 없으면 빈 목록)
     */
    public List<String> getValues(String attr) {
        List<String> values = attrs.get(attr);
        return values == null ? List.of() : values;
    }

    /**
     * 첫 번째 값 조회.
     *
     * @param attr 속성 이름
     * @return 첫 번째 값 (없으면 empty)
     */
    public Optional<String> firstValue(String attr) {
        List<String> values = attrs.get(attr);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public boolean hasAttribute(String attr) {
        return attrs.containsKey(attr);
    }

    /**
     * 이 Entry를 시작점으로 하는 Builder 생성.
     *
     * @return 현재 속성이 복사된 Builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        attrs.forEach((name, values) -> builder.attrs.put(name, new ArrayList<>(values)));
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entry entry = (Entry) o;
        return attrs.equals(entry.attrs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attrs);
    }

    @Override
    public String toString() {
        return "Entry{" + attrs + '}';
    }

    /**
     * Entry Builder.
     *
     * <p>값은 호출 순서대로 누적됩니다.</p>
     */
    public static final class Builder {

        private final Map<String, List<String>> attrs = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 속성에 값 추가.
         *
         * @param attr 속성 이름
         * @param values 추가할 값
         * @return this
         */
        public Builder add(String attr, String... values) {
            List<String> current = attrs.computeIfAbsent(attr, k -> new ArrayList<>());
            Collections.addAll(current, values);
            return this;
        }

        /**
         * 속성 제거.
         *
         * @param attr 속성 이름
         * @return this
         */
        public Builder remove(String attr) {
            attrs.remove(attr);
            return this;
        }

        /**
         * 속성에서 특정 값을 모두 제거. 값이 남지 않으면 속성도 제거합니다.
         *
         * @param attr 속성 이름
         * @param value 제거할 값
         * @return this
         */
        public Builder removeValue(String attr, String value) {
            List<String> current = attrs.get(attr);
            if (current != null) {
                current.removeIf(v -> v.equals(value));
                if (current.isEmpty()) {
                    attrs.remove(attr);
                }
            }
            return this;
        }

        public Entry build() {
            return new Entry(attrs);
        }
    }
}
