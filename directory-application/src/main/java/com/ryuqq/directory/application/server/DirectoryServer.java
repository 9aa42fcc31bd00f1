package com.ryuqq.directory.application.server;

import com.ryuqq.directory.core.auth.AuthRequest;
import com.ryuqq.directory.core.auth.AuthResponse;
import com.ryuqq.directory.core.auth.SessionId;
import com.ryuqq.directory.core.contract.CreateRequest;
import com.ryuqq.directory.core.contract.DeleteRequest;
import com.ryuqq.directory.core.contract.ModifyRequest;
import com.ryuqq.directory.core.contract.OperationResponse;
import com.ryuqq.directory.core.contract.ReviveRecycledRequest;
import com.ryuqq.directory.core.contract.SearchRecycledRequest;
import com.ryuqq.directory.core.contract.SearchRequest;
import com.ryuqq.directory.core.contract.SearchResponse;
import com.ryuqq.directory.core.contract.WhoamiResponse;
import com.ryuqq.directory.core.error.OperationError;
import com.ryuqq.directory.core.outcome.Result;

/**
 * 디렉터리 프로토콜 연산 표면.
 *
 * <p>모든 연산은 예외 대신 {@link Result}로 {@link OperationError}를 반환합니다.
 * {@code sessionId}는 호출자의 인증 컨텍스트이며 null이면 인증되지 않은 호출입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AuthResponse init = server.auth(AuthRequest.init("alice", null)).get();
 * AuthResponse done = server.auth(AuthRequest.creds(init.sessionId(), AuthCredential.anonymous())).get();
 *
 * Result&lt;SearchResponse, OperationError&gt; found =
 *     server.search(done.sessionId(), new SearchRequest(Filter.self()));
 * </pre>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public interface DirectoryServer {

    /**
     * 필터로 항목 검색.
     *
     * <p>필터는 정규화된 뒤 평가되며, 항상 거짓인 필터는 저장소를 거치지 않고 빈 결과를 반환합니다.</p>
     *
     * @param sessionId 호출자 세션 (null 허용)
     * @param request 검색 요청
     * @return 일치 항목 또는 FilterGeneration / FilterUUIDResolution / 저장소 오류
     */
    Result<SearchResponse, OperationError> search(SessionId sessionId, SearchRequest request);

    /**
     * 항목 생성.
     *
     * @param sessionId 호출자 세션 (null 허용)
     * @param request 생성 요청
     * @return 확인 응답 또는 EmptyRequest / SchemaViolation / ConsistencyError
     */
    Result<OperationResponse, OperationError> create(SessionId sessionId, CreateRequest request);

    /**
     * 필터와 일치하는 항목을 휴지통으로 이동.
     *
     * @param sessionId 호출자 세션 (null 허용)
     * @param request 삭제 요청
     * @return 확인 응답 또는 EmptyRequest (항상 거짓인 필터) / NoMatchingEntries
     */
    Result<OperationResponse, OperationError> delete(SessionId sessionId, DeleteRequest request);

    /**
     * 필터와 일치하는 항목에 수정 목록 적용.
     *
     * @param sessionId 호출자 세션 (null 허용)
     * @param request 수정 요청
     * @return 확인 응답 또는 EmptyRequest / NoMatchingEntries / SchemaViolation
     */
    Result<OperationResponse, OperationError> modify(SessionId sessionId, ModifyRequest request);

    /**
     * 인증 협상 단계 처리.
     *
     * @param request 인증 요청
     * @return 세션 ID와 상태 또는 InvalidAuthState / InvalidSessionState
     */
    Result<AuthResponse, OperationError> auth(AuthRequest request);

    /**
     * 호출자 자신의 항목과 현재 토큰 조회.
     *
     * <p>부수 효과가 없으며 멱등합니다.</p>
     *
     * @param sessionId 호출자 세션
     * @return 자기 항목과 토큰 또는 NotAuthenticated / NoMatchingEntries
     */
    Result<WhoamiResponse, OperationError> whoami(SessionId sessionId);

    /**
     * 휴지통 항목 검색.
     *
     * @param sessionId 호출자 세션 (null 허용)
     * @param request 검색 요청
     * @return 일치 항목
     */
    Result<SearchResponse, OperationError> searchRecycled(SessionId sessionId, SearchRecycledRequest request);

    /**
     * 휴지통 항목 복원.
     *
     * @param sessionId 호출자 세션 (null 허용)
     * @param request 복원 요청
     * @return 확인 응답 또는 NoMatchingEntries
     */
    Result<OperationResponse, OperationError> reviveRecycled(SessionId sessionId, ReviveRecycledRequest request);
}
