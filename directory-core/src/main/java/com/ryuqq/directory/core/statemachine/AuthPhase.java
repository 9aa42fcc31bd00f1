package com.ryuqq.directory.core.statemachine;

/**
 * 인증 세션의 생명주기 단계.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>INIT → CONTINUE (주체 확인, 자격 증명 대기)</li>
 *   <li>INIT → DENIED (알 수 없거나 잠긴 주체)</li>
 *   <li>CONTINUE → CONTINUE (남은 인증 단계 존재)</li>
 *   <li>CONTINUE → SUCCESS (토큰 발급)</li>
 *   <li>CONTINUE → DENIED (자격 증명 거부 또는 만료)</li>
 *   <li><strong>종료 상태에서 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INIT
 *    │
 *    ├─► DENIED
 *    ▼
 * CONTINUE ◄─┐
 *    │       │ (추가 단계)
 *    ├───────┘
 *    ├─► SUCCESS
 *    │
 *    └─► DENIED
 *
 * 금지된 전이:
 * - SUCCESS → * ❌
 * - DENIED → * ❌
 * - INIT → SUCCESS ❌
 * </pre>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public enum AuthPhase {

    /**
     * 주체가 아직 확인되지 않음.
     */
    INIT,

    /**
     * 자격 증명 대기 중.
     */
    CONTINUE,

    /**
     * 인증 성공 (토큰 발급됨).
     */
    SUCCESS,

    /**
     * 인증 거부 (영구).
     */
    DENIED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(SUCCESS, DENIED)의 세션은 더 이상 진행할 수 없습니다.</p>
     *
     * @return SUCCESS 또는 DENIED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == DENIED;
    }
}
