package com.ryuqq.directory.core.filter;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Filter 전순서 (total order).
 *
 * <p><strong>비교 규칙:</strong></p>
 * <ol>
 *   <li>변형 순위 ({@link Filter.Kind#rank()}): Eq &lt; Sub &lt; Pres &lt; Or &lt; And &lt; AndNot &lt; Self</li>
 *   <li>속성 이름, 그 다음 값 (문자열 사전순)</li>
 *   <li>And/Or: 자식을 앞에서부터 하나씩 비교, 모두 같으면 짧은 목록이 앞</li>
 *   <li>AndNot: 자식 비교</li>
 * </ol>
 *
 * <p>재귀 대신 명시적 스택으로 비교하므로 트리 깊이와 무관하게 호출 스택을 쓰지 않습니다.
 * 순서는 레코드 동등성과 일치합니다 ({@code compare(a, b) == 0} ⇔ {@code a.equals(b)}).</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class FilterOrder implements Comparator<Filter> {

    /**
     * 공유 인스턴스 (상태 없음).
     */
    public static final FilterOrder INSTANCE = new FilterOrder();

    private FilterOrder() {
    }

    @Override
    public int compare(Filter left, Filter right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Filters cannot be null (left: " + left + ", right: " + right + ")");
        }

        // 프레임: 비교할 필터 쌍, 또는 앞선 자식이 모두 같을 때 적용할 길이 비교 결과
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(left, right, 0));

        while (!frames.isEmpty()) {
            Frame frame = frames.pop();
            if (frame.left == null) {
                if (frame.lengthOrder != 0) {
                    return frame.lengthOrder;
                }
                continue;
            }

            int result = compareShallow(frame.left, frame.right);
            if (result != 0) {
                return result;
            }

            List<Filter> leftChildren = Filter.childrenOf(frame.left);
            List<Filter> rightChildren = Filter.childrenOf(frame.right);
            if (leftChildren.isEmpty() && rightChildren.isEmpty()) {
                continue;
            }

            int common = Math.min(leftChildren.size(), rightChildren.size());
            frames.push(new Frame(null, null, Integer.compare(leftChildren.size(), rightChildren.size())));
            for (int i = common - 1; i >= 0; i--) {
                frames.push(new Frame(leftChildren.get(i), rightChildren.get(i), 0));
            }
        }
        return 0;
    }

    /**
     * 자식을 제외한 노드 자체 비교.
     */
    private static int compareShallow(Filter left, Filter right) {
        int byKind = Integer.compare(left.kind().rank(), right.kind().rank());
        if (byKind != 0) {
            return byKind;
        }
        if (left instanceof Filter.Eq l && right instanceof Filter.Eq r) {
            return compareAttrValue(l.attr(), l.value(), r.attr(), r.value());
        }
        if (left instanceof Filter.Sub l && right instanceof Filter.Sub r) {
            return compareAttrValue(l.attr(), l.value(), r.attr(), r.value());
        }
        if (left instanceof Filter.Pres l && right instanceof Filter.Pres r) {
            return l.attr().compareTo(r.attr());
        }
        return 0;
    }

    private static int compareAttrValue(String leftAttr, String leftValue, String rightAttr, String rightValue) {
        int byAttr = leftAttr.compareTo(rightAttr);
        return byAttr != 0 ? byAttr : leftValue.compareTo(rightValue);
    }

    private record Frame(Filter left, Filter right, int lengthOrder) {
    }
}
