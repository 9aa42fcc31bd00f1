/**
 * 세션 만료 런너.
 *
 * <p>{@link com.ryuqq.directory.adapter.runner.SessionReaper}가 세션 저장소를 주기적으로
 * 스캔하여 미해결 협상을 DENIED로 만료시킵니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
package com.ryuqq.directory.adapter.runner;
