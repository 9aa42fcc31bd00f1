package com.ryuqq.directory.core.contract;

/**
 * 자기 자신 조회 요청.
 *
 * <p>페이로드가 없으며, 정의상 부작용이 없는 유일한 멱등 연산입니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record WhoamiRequest() {
}
