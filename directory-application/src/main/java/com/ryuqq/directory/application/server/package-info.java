/**
 * 디렉터리 연산 애플리케이션 서비스.
 *
 * @author Directory Team
 * @since 1.0.0
 */
package com.ryuqq.directory.application.server;
