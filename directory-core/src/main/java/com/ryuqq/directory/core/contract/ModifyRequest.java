package com.ryuqq.directory.core.contract;

import com.ryuqq.directory.core.filter.Filter;
import com.ryuqq.directory.core.modify.ModifyList;

/**
 * 수정 요청.
 *
 * @param filter 대상 엔트리 선택 필터
 * @param modlist 적용할 변경 목록 (순서 유지)
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record ModifyRequest(Filter filter, ModifyList modlist) {

    public ModifyRequest {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (modlist == null) {
            throw new IllegalArgumentException("modlist cannot be null");
        }
    }
}
