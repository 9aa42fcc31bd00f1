package com.ryuqq.directory.core.filter;

import com.ryuqq.directory.core.error.OperationError;
import com.ryuqq.directory.core.outcome.Result;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter 정규화.
 *
 * <p>의미상/구조상 동등한 두 필터는 정규형이 같고, 정규형이 같으면 동등합니다.
 * 중복 제거, 캐시 키, 일관성 검사에서의 필터 비교에 사용됩니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>깊이 검사: {@code maxDepth} 초과 시 {@code FilterGeneration} 오류 (재귀 전에 검사)</li>
 *   <li>자식을 먼저 정규화 (후위 순회)</li>
 *   <li>같은 종류의 중첩 And/And, Or/Or 평탄화</li>
 *   <li>{@link FilterOrder}로 자식 정렬</li>
 *   <li>정렬 후 인접한 완전 중복 자식 제거</li>
 *   <li>Eq, Sub, Pres, Self는 그대로, AndNot은 자식만 정규화</li>
 * </ol>
 *
 * <p>단일 자식 결합자는 벗겨내지 않습니다 ({@code And([x])}는 {@code And([x])}로 유지).
 * 빈 결합자 {@code And([])}, {@code Or([])}는 각각 항상 참/항상 거짓의 고정점입니다.</p>
 *
 * <p>순수 함수이며 상태가 없으므로 여러 스레드에서 동시에 호출할 수 있습니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class FilterCanonicalizer {

    /**
     * 기본 최대 중첩 깊이.
     */
    public static final int DEFAULT_MAX_DEPTH = 64;

    private final int maxDepth;

    /**
     * 기본 최대 깊이({@value #DEFAULT_MAX_DEPTH})로 생성.
     */
    public FilterCanonicalizer() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * 생성자.
     *
     * @param maxDepth 허용 최대 중첩 깊이 (1 이상)
     * @throws IllegalArgumentException maxDepth가 1 미만인 경우
     */
    public FilterCanonicalizer(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive (current: " + maxDepth + ")");
        }
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * 필터를 정규형으로 변환.
     *
     * @param filter 입력 필터
     * @return 정규형, 또는 깊이 초과 시 {@code FilterGeneration}
     * @throws IllegalArgumentException filter가 null인 경우
     */
    public Result<Filter, OperationError> canonicalize(Filter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (filter.depth() > maxDepth) {
            return Result.err(OperationError.of(OperationError.Kind.FILTER_GENERATION));
        }
        return Result.ok(canonical(filter));
    }

    /**
     * 정규형 비교로 두 필터의 동등성 판단.
     *
     * @param left 필터
     * @param right 필터
     * @return 정규형이 같으면 true, 어느 한쪽이라도 깊이 초과면 {@code FilterGeneration}
     */
    public Result<Boolean, OperationError> equivalent(Filter left, Filter right) {
        return canonicalize(left).flatMap(l -> canonicalize(right).map(l::equals));
    }

    // 깊이 검사를 통과한 트리만 들어오므로 재귀 깊이는 maxDepth로 제한됨
    private Filter canonical(Filter filter) {
        if (filter instanceof Filter.And and) {
            return new Filter.And(normalizeChildren(and.children(), Filter.Kind.AND));
        }
        if (filter instanceof Filter.Or or) {
            return new Filter.Or(normalizeChildren(or.children(), Filter.Kind.OR));
        }
        if (filter instanceof Filter.AndNot not) {
            return new Filter.AndNot(canonical(not.child()));
        }
        return filter;
    }

    private List<Filter> normalizeChildren(List<Filter> children, Filter.Kind kind) {
        List<Filter> flattened = new ArrayList<>(children.size());
        for (Filter child : children) {
            Filter canonicalChild = canonical(child);
            if (canonicalChild.kind() == kind) {
                flattened.addAll(Filter.childrenOf(canonicalChild));
            } else {
                flattened.add(canonicalChild);
            }
        }

        flattened.sort(FilterOrder.INSTANCE);

        List<Filter> unique = new ArrayList<>(flattened.size());
        for (Filter candidate : flattened) {
            if (unique.isEmpty() || FilterOrder.INSTANCE.compare(unique.get(unique.size() - 1), candidate) != 0) {
                unique.add(candidate);
            }
        }
        return unique;
    }
}
