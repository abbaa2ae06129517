package com.ryuqq.catalogsync.core.statemachine;

/**
 * 그룹 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → VALIDATING, FAILED</li>
 *   <li>VALIDATING → SKIPPED, DISPATCHING, FAILED</li>
 *   <li>DISPATCHING → SUCCEEDED, PARTIAL_FAILURE, FAILED</li>
 * </ul>
 *
 * <p>종료 상태에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SyncState from, SyncState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == SyncState.VALIDATING || to == SyncState.FAILED;
            case VALIDATING -> to == SyncState.SKIPPED || to == SyncState.DISPATCHING || to == SyncState.FAILED;
            case DISPATCHING -> to == SyncState.SUCCEEDED || to == SyncState.PARTIAL_FAILURE || to == SyncState.FAILED;
            case SKIPPED, SUCCEEDED, PARTIAL_FAILURE, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 검증 후 전이.
     *
     * @return 전이된 상태 (next)
     */
    public static SyncState transition(SyncState current, SyncState next) {
        validate(current, next);
        return next;
    }
}
