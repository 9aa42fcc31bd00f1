package com.ryuqq.directory.core.statemachine;

/**
 * 인증 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INIT → CONTINUE, INIT → DENIED</li>
 *   <li>CONTINUE → CONTINUE, CONTINUE → SUCCESS, CONTINUE → DENIED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(SUCCESS, DENIED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>INIT으로 되돌아가는 전이 불가</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public final class AuthTransition {

    // Utility class - prevent instantiation
    private AuthTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(AuthPhase from, AuthPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case INIT -> to == AuthPhase.CONTINUE || to == AuthPhase.DENIED;
            case CONTINUE -> to == AuthPhase.CONTINUE || to == AuthPhase.SUCCESS || to == AuthPhase.DENIED;
            case SUCCESS, DENIED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static AuthPhase transition(AuthPhase current, AuthPhase next) {
        validate(current, next);
        return next;
    }

    /**
     * 전이 가능 여부 (예외 없이).
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @return 허용되는 전이이면 true
     */
    public static boolean isAllowed(AuthPhase from, AuthPhase to) {
        try {
            validate(from, to);
            return true;
        } catch (IllegalStateException e) {
            return false;
        }
    }
}
