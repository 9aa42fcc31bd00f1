/**
 * Authentication negotiation protocol types.
 *
 * <p>A client sends {@link com.ryuqq.directory.core.auth.AuthStep.Init}, receives a
 * {@link com.ryuqq.directory.core.auth.SessionId} with
 * {@link com.ryuqq.directory.core.auth.AuthState.Continue} (or an immediate
 * {@link com.ryuqq.directory.core.auth.AuthState.Denied}), then submits
 * {@link com.ryuqq.directory.core.auth.AuthStep.Creds} until the session reaches
 * {@link com.ryuqq.directory.core.auth.AuthState.Success} or {@code Denied}.</p>
 *
 * <p>{@link com.ryuqq.directory.core.auth.AuthSession} is the server-side record behind a
 * session id; its phase changes are validated by
 * {@link com.ryuqq.directory.core.statemachine.AuthTransition}.</p>
 *
 * @since 1.0.0
 * @author Directory Team
 */
package com.ryuqq.directory.core.auth;
