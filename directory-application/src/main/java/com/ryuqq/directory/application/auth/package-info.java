/**
 * 인증 협상 애플리케이션 서비스.
 *
 * <p>{@link com.ryuqq.directory.application.auth.AuthNegotiator}가 세션 저장소와
 * 자격 증명 검증기 SPI를 조합해 Init → Continue → Success/Denied 협상을 진행합니다.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
package com.ryuqq.directory.application.auth;
