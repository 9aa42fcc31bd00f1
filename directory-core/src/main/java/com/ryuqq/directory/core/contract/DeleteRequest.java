package com.ryuqq.directory.core.contract;

import com.ryuqq.directory.core.filter.Filter;

/**
 * 삭제 요청. 일치하는 엔트리는 휴지통(recycle bin)으로 이동합니다.
 *
 * @param filter 대상 엔트리를 선택하는 필터
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record DeleteRequest(Filter filter) {

    public DeleteRequest {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
    }
}
