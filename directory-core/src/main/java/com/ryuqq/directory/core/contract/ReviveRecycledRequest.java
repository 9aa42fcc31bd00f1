package com.ryuqq.directory.core.contract;

import com.ryuqq.directory.core.filter.Filter;

/**
 * 휴지통 엔트리 복구 요청.
 *
 * @param filter 대상 엔트리를 선택하는 필터
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record ReviveRecycledRequest(Filter filter) {

    public ReviveRecycledRequest {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
    }
}
