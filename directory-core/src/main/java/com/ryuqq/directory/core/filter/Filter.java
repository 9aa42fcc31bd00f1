package com.ryuqq.directory.core.filter;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * 엔트리 속성에 대한 재귀 불리언 질의 트리.
 *
 * <p><strong>변형:</strong></p>
 * <ul>
 *   <li>{@link Eq}: 속성 값 일치</li>
 *   <li>{@link Sub}: 속성 값 부분 문자열 일치</li>
 *   <li>{@link Pres}: 속성 존재</li>
 *   <li>{@link Or}, {@link And}: 하위 필터 목록에 대한 결합</li>
 *   <li>{@link AndNot}: 단일 하위 필터 부정</li>
 *   <li>{@link SelfUuid}: 요청 주체 자신의 UUID (백엔드가 해석, 필터 엔진은 해석하지 않음)</li>
 * </ul>
 *
 * <p><strong>빈 결합자 규칙:</strong></p>
 * <ul>
 *   <li>{@code And([])} = 항상 참 ({@link #MATCH_ALL})</li>
 *   <li>{@code Or([])} = 항상 거짓 ({@link #MATCH_NONE})</li>
 * </ul>
 *
 * <p>레코드 동등성은 구조적(자식 순서 포함)입니다. 자식 순서와 무관한 비교는
 * {@link FilterCanonicalizer#equivalent(Filter, Filter)}로 정규형을 비교합니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public sealed interface Filter
    permits Filter.Eq, Filter.Sub, Filter.Pres, Filter.Or, Filter.And, Filter.AndNot, Filter.SelfUuid {

    /**
     * 항상 참인 필터 ({@code And([])}).
     */
    Filter MATCH_ALL = new And(List.of());

    /**
     * 항상 거짓인 필터 ({@code Or([])}).
     */
    Filter MATCH_NONE = new Or(List.of());

    /**
     * 변형 종류와 정렬 순위.
     *
     * <p>순위는 선언 순서가 아닌 명시적 값으로 고정됩니다.</p>
     */
    enum Kind {
        EQ(0),
        SUB(1),
        PRES(2),
        OR(3),
        AND(4),
        AND_NOT(5),
        SELF(6);

        private final int rank;

        Kind(int rank) {
            this.rank = rank;
        }

        public int rank() {
            return rank;
        }
    }

    /**
     * 변형 종류.
     *
     * @return Kind
     */
    Kind kind();

    /**
     * 속성 값 일치.
     *
     * @param attr 속성 이름
     * @param value 값
     */
    record Eq(String attr, String value) implements Filter {
        public Eq {
            requireText(attr, "attr");
            requireValue(value);
        }

        @Override
        public Kind kind() {
            return Kind.EQ;
        }
    }

    /**
     * 부분 문자열 일치.
     *
     * @param attr 속성 이름
     * @param value 부분 문자열
     */
    record Sub(String attr, String value) implements Filter {
        public Sub {
            requireText(attr, "attr");
            requireValue(value);
        }

        @Override
        public Kind kind() {
            return Kind.SUB;
        }
    }

    /**
     * 속성 존재.
     *
     * @param attr 속성 이름
     */
    record Pres(String attr) implements Filter {
        public Pres {
            requireText(attr, "attr");
        }

        @Override
        public Kind kind() {
            return Kind.PRES;
        }
    }

    /**
     * 논리합. 빈 목록은 항상 거짓.
     *
     * @param children 하위 필터 (순서 유지)
     */
    record Or(List<Filter> children) implements Filter {
        public Or {
            children = copyChildren(children);
        }

        @Override
        public Kind kind() {
            return Kind.OR;
        }
    }

    /**
     * 논리곱. 빈 목록은 항상 참.
     *
     * @param children 하위 필터 (순서 유지)
     */
    record And(List<Filter> children) implements Filter {
        public And {
            children = copyChildren(children);
        }

        @Override
        public Kind kind() {
            return Kind.AND;
        }
    }

    /**
     * 부정.
     *
     * @param child 부정할 필터
     */
    record AndNot(Filter child) implements Filter {
        public AndNot {
            if (child == null) {
                throw new IllegalArgumentException("child cannot be null");
            }
        }

        @Override
        public Kind kind() {
            return Kind.AND_NOT;
        }
    }

    /**
     * 요청 주체 자신을 가리키는 자리표시자.
     */
    record SelfUuid() implements Filter {
        @Override
        public Kind kind() {
            return Kind.SELF;
        }
    }

    static Filter eq(String attr, String value) {
        return new Eq(attr, value);
    }

    static Filter sub(String attr, String value) {
        return new Sub(attr, value);
    }

    static Filter pres(String attr) {
        return new Pres(attr);
    }

    static Filter and(Filter... children) {
        return new And(Arrays.asList(children));
    }

    static Filter or(Filter... children) {
        return new Or(Arrays.asList(children));
    }

    static Filter andNot(Filter child) {
        return new AndNot(child);
    }

    static Filter self() {
        return new SelfUuid();
    }

    /**
     * 결합자의 자식 목록 조회.
     *
     * @param filter 필터
     * @return And/Or의 자식 목록, AndNot은 단일 자식, 그 외는 빈 목록
     */
    static List<Filter> childrenOf(Filter filter) {
        if (filter instanceof And and) {
            return and.children();
        }
        if (filter instanceof Or or) {
            return or.children();
        }
        if (filter instanceof AndNot not) {
            return List.of(not.child());
        }
        return List.of();
    }

    /**
     * 트리 어디든 {@link SelfUuid}가 있는지 확인.
     *
     * <p>백엔드는 평가 전에 이 값으로 UUID 해석 가능 여부를 판단합니다.
     * 명시적 스택을 사용하므로 깊은 트리에서도 스택 오버플로가 발생하지 않습니다.</p>
     *
     * @return SelfUuid 포함 여부
     */
    default boolean containsSelfUuid() {
        Deque<Filter> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Filter current = pending.pop();
            if (current instanceof SelfUuid) {
                return true;
            }
            for (Filter child : childrenOf(current)) {
                pending.push(child);
            }
        }
        return false;
    }

    /**
     * 트리 높이 계산 (리프 = 1).
     *
     * @return 최대 중첩 깊이
     */
    default int depth() {
        int max = 0;
        Deque<Filter> nodes = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        nodes.push(this);
        levels.push(1);
        while (!nodes.isEmpty()) {
            Filter current = nodes.pop();
            int level = levels.pop();
            max = Math.max(max, level);
            for (Filter child : childrenOf(current)) {
                nodes.push(child);
                levels.push(level + 1);
            }
        }
        return max;
    }

    /**
     * @return {@code Or([])} 여부
     */
    default boolean isAlwaysFalse() {
        return this instanceof Or or && or.children().isEmpty();
    }

    /**
     * @return {@code And([])} 여부
     */
    default boolean isAlwaysTrue() {
        return this instanceof And and && and.children().isEmpty();
    }

    private static void requireText(String text, String name) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    private static void requireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    private static List<Filter> copyChildren(List<Filter> children) {
        if (children == null) {
            throw new IllegalArgumentException("children cannot be null");
        }
        for (Filter child : children) {
            if (child == null) {
                throw new IllegalArgumentException("children cannot contain null");
            }
        }
        return List.copyOf(children);
    }
}
