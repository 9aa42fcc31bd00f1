package com.ryuqq.directory.application.server;

import com.ryuqq.directory.application.auth.AuthNegotiator;
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
import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.error.OperationError;
import com.ryuqq.directory.core.error.SchemaError;
import com.ryuqq.directory.core.filter.Filter;
import com.ryuqq.directory.core.filter.FilterCanonicalizer;
import com.ryuqq.directory.core.identity.UserAuthToken;
import com.ryuqq.directory.core.outcome.Result;
import com.ryuqq.directory.core.spi.EntryStore;
import com.ryuqq.directory.core.spi.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link DirectoryServer} 기본 구현.
 *
 * <p><strong>공통 처리 흐름:</strong></p>
 * <pre>
 * 1. sessionId → AuthNegotiator.tokenFor → self UUID (없으면 null)
 * 2. FilterCanonicalizer.canonicalize(filter) (깊이 초과 → FilterGeneration)
 * 3. Self 포함 + self UUID 없음 → FilterUUIDResolution
 * 4. EntryStore 위임
 * </pre>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class DefaultDirectoryServer implements DirectoryServer {

    private static final Logger log = LoggerFactory.getLogger(DefaultDirectoryServer.class);
    private final EntryStore entryStore;
    private final SchemaValidator schemaValidator;
    private final AuthNegotiator negotiator;
    private final FilterCanonicalizer canonicalizer;

    /**
     * 생성자 (기본 최대 필터 깊이).
     */
    public DefaultDirectoryServer(EntryStore entryStore, SchemaValidator schemaValidator, AuthNegotiator negotiator) {
        this(entryStore, schemaValidator, negotiator, new FilterCanonicalizer());
    }

    /**
     * 생성자.
     *
     * @param entryStore 항목 저장소
     * @param schemaValidator 스키마 검증기
     * @param negotiator 인증 협상기
     * @param canonicalizer 필터 정규화기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultDirectoryServer(EntryStore entryStore, SchemaValidator schemaValidator,
                                  AuthNegotiator negotiator, FilterCanonicalizer canonicalizer) {
        if (entryStore == null) {
            throw new IllegalArgumentException("entryStore cannot be null");
        }
        if (schemaValidator == null) {
            throw new IllegalArgumentException("schemaValidator cannot be null");
        }
        if (negotiator == null) {
            throw new IllegalArgumentException("negotiator cannot be null");
        }
        if (canonicalizer == null) {
            throw new IllegalArgumentException("canonicalizer cannot be null");
        }
        this.entryStore = entryStore;
        this.schemaValidator = schemaValidator;
        this.negotiator = negotiator;
        this.canonicalizer = canonicalizer;
    }

    @Override
    public Result<SearchResponse, OperationError> search(SessionId sessionId, SearchRequest request) {
        requireRequest(request);
        String self = selfUuid(sessionId);
        return prepare(request.filter(), self).flatMap(filter -> {
            if (filter.isAlwaysFalse()) {
                return Result.ok(new SearchResponse(List.of()));
            }
            return entryStore.evaluate(filter, self).map(SearchResponse::new);
        });
    }

    @Override
    public Result<OperationResponse, OperationError> create(SessionId sessionId, CreateRequest request) {
        requireRequest(request);
        if (request.entries().isEmpty()) {
            return Result.err(OperationError.of(OperationError.Kind.EMPTY_REQUEST));
        }
        for (Entry entry : request.entries()) {
            Result<Void, SchemaError> validation = schemaValidator.validate(entry);
            if (validation.isErr()) {
                log.warn("Create rejected: {}", validation.getError());
                return Result.err(OperationError.schemaViolation(validation.getError()));
            }
        }
        return entryStore.create(request.entries()).map(ignored -> OperationResponse.ack());
    }

    @Override
    public Result<OperationResponse, OperationError> delete(SessionId sessionId, DeleteRequest request) {
        requireRequest(request);
        String self = selfUuid(sessionId);
        return prepare(request.filter(), self).flatMap(filter -> {
            if (filter.isAlwaysFalse()) {
                return Result.err(OperationError.of(OperationError.Kind.EMPTY_REQUEST));
            }
            return entryStore.delete(filter, self).map(ignored -> OperationResponse.ack());
        });
    }

    @Override
    public Result<OperationResponse, OperationError> modify(SessionId sessionId, ModifyRequest request) {
        requireRequest(request);
        if (request.modlist().isEmpty()) {
            return Result.err(OperationError.of(OperationError.Kind.EMPTY_REQUEST));
        }
        String self = selfUuid(sessionId);
        return prepare(request.filter(), self).flatMap(filter ->
            entryStore.modify(filter, request.modlist(), self).map(ignored -> OperationResponse.ack()));
    }

    @Override
    public Result<AuthResponse, OperationError> auth(AuthRequest request) {
        requireRequest(request);
        return negotiator.handle(request);
    }

    @Override
    public Result<WhoamiResponse, OperationError> whoami(SessionId sessionId) {
        Result<UserAuthToken, OperationError> token = negotiator.tokenFor(sessionId);
        if (token.isErr()) {
            return Result.err(token.getError());
        }

        UserAuthToken uat = token.get();
        return entryStore.evaluate(Filter.eq(Entry.UUID_ATTRIBUTE, uat.uuid()), uat.uuid()).flatMap(entries -> {
            if (entries.size() != 1) {
                log.warn("Whoami found {} entries for {}", entries.size(), uat.uuid());
                return Result.err(OperationError.of(OperationError.Kind.NO_MATCHING_ENTRIES));
            }
            return Result.ok(new WhoamiResponse(entries.get(0), uat));
        });
    }

    @Override
    public Result<SearchResponse, OperationError> searchRecycled(SessionId sessionId, SearchRecycledRequest request) {
        requireRequest(request);
        String self = selfUuid(sessionId);
        return prepare(request.filter(), self).flatMap(filter -> {
            if (filter.isAlwaysFalse()) {
                return Result.ok(new SearchResponse(List.of()));
            }
            return entryStore.evaluateRecycled(filter, self).map(SearchResponse::new);
        });
    }

    @Override
    public Result<OperationResponse, OperationError> reviveRecycled(SessionId sessionId, ReviveRecycledRequest request) {
        requireRequest(request);
        String self = selfUuid(sessionId);
        return prepare(request.filter(), self).flatMap(filter ->
            entryStore.revive(filter, self).map(ignored -> OperationResponse.ack()));
    }

    private Result<Filter, OperationError> prepare(Filter filter, String self) {
        Result<Filter, OperationError> canonical = canonicalizer.canonicalize(filter);
        if (canonical.isOk() && self == null && canonical.get().containsSelfUuid()) {
            return Result.err(OperationError.of(OperationError.Kind.FILTER_UUID_RESOLUTION));
        }
        return canonical;
    }

    private String selfUuid(SessionId sessionId) {
        if (sessionId == null) {
            return null;
        }
        Result<UserAuthToken, OperationError> token = negotiator.tokenFor(sessionId);
        return token.isOk() ? token.get().uuid() : null;
    }

    private static void requireRequest(Object request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
    }
}
