package com.ryuqq.directory.core.contract;

import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.identity.UserAuthToken;

/**
 * 자기 자신 조회 응답.
 *
 * @param youare 요청 주체의 엔트리
 * @param uat 현재 토큰
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record WhoamiResponse(Entry youare, UserAuthToken uat) {

    public WhoamiResponse {
        if (youare == null) {
            throw new IllegalArgumentException("youare cannot be null");
        }
        if (uat == null) {
            throw new IllegalArgumentException("uat cannot be null");
        }
    }
}
