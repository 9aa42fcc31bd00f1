package com.ryuqq.directory.core.contract;

import com.ryuqq.directory.core.filter.Filter;

/**
 * 휴지통 검색 요청.
 *
 * @param filter 대상 엔트리를 선택하는 필터
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record SearchRecycledRequest(Filter filter) {

    public SearchRecycledRequest {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
    }
}
