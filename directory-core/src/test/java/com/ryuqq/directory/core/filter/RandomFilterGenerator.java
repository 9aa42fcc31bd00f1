package com.ryuqq.directory.core.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 시드 고정 무작위 필터 트리 생성기.
 *
 * <p>일곱 변형을 모두 만들며 빈 결합자도 포함합니다. 속성과 값 후보를 좁게 두어
 * 중복 자식과 같은 결합자 중첩이 자주 나오게 합니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public class RandomFilterGenerator {

    private static final String[] ATTRS = {"a", "b", "c"};
    private static final String[] VALUES = {"1", "2", ""};
    private static final int MAX_CHILDREN = 3;

    private final Random random;

    public RandomFilterGenerator(long seed) {
        this.random = new Random(seed);
    }

    /**
     * @param maxDepth 생성할 트리의 최대 깊이 (리프 = 1)
     * @return 무작위 필터
     */
    public Filter next(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        int variants = maxDepth == 1 ? 4 : 7;
        switch (random.nextInt(variants)) {
            case 0:
                return Filter.eq(pick(ATTRS), pick(VALUES));
            case 1:
                return Filter.sub(pick(ATTRS), pick(VALUES));
            case 2:
                return Filter.pres(pick(ATTRS));
            case 3:
                return Filter.self();
            case 4:
                return new Filter.Or(children(maxDepth - 1));
            case 5:
                return new Filter.And(children(maxDepth - 1));
            default:
                return Filter.andNot(next(maxDepth - 1));
        }
    }

    /**
     * 모든 결합자의 자식 순서를 재귀적으로 섞습니다.
     *
     * @param filter 원본 필터
     * @return 자식 순서만 다른 필터
     */
    public Filter shuffle(Filter filter) {
        if (filter instanceof Filter.Or or) {
            return new Filter.Or(shuffled(or.children()));
        }
        if (filter instanceof Filter.And and) {
            return new Filter.And(shuffled(and.children()));
        }
        if (filter instanceof Filter.AndNot andNot) {
            return Filter.andNot(shuffle(andNot.child()));
        }
        return filter;
    }

    private List<Filter> children(int maxDepth) {
        int count = random.nextInt(MAX_CHILDREN + 1);
        List<Filter> children = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            children.add(next(maxDepth));
        }
        return children;
    }

    private List<Filter> shuffled(List<Filter> children) {
        List<Filter> copy = new ArrayList<>(children.size());
        for (Filter child : children) {
            copy.add(shuffle(child));
        }
        Collections.shuffle(copy, random);
        return copy;
    }

    private String pick(String[] pool) {
        return pool[random.nextInt(pool.length)];
    }
}
