/**
 * Authentication negotiation state machine package.
 *
 * <p>This package implements the phase transition rules for authentication sessions,
 * guaranteeing that a session, once terminal, is never advanced again.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.directory.core.statemachine.AuthPhase} - Session lifecycle phases (enum)</li>
 *   <li>{@link com.ryuqq.directory.core.statemachine.AuthTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * INIT → CONTINUE | DENIED
 * CONTINUE → CONTINUE | SUCCESS | DENIED
 *
 * Forbidden:
 * - SUCCESS → * (terminal)
 * - DENIED → * (terminal)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * AuthPhase phase = AuthPhase.INIT;
 * phase = AuthTransition.transition(phase, AuthPhase.CONTINUE);
 * phase = AuthTransition.transition(phase, AuthPhase.SUCCESS);
 *
 * // This will throw IllegalStateException
 * AuthTransition.validate(phase, AuthPhase.CONTINUE);
 * </pre>
 *
 * @since 1.0.0
 * @author Directory Team
 */
package com.ryuqq.directory.core.statemachine;
