package com.ryuqq.directory.core.contract;

import com.ryuqq.directory.core.filter.Filter;

/**
 * 검색 요청.
 *
 * @param filter 검색 필터
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record SearchRequest(Filter filter) {

    public SearchRequest {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
    }
}
