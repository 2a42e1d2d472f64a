package org.brown.greenbench.orchestrator;

/**
 * 측정 세션 상태
 *
 * IDLE → CALIBRATING → AWAITING_REPETITION → RUNNING → ACCOUNTING
 * → (RETRY_PENDING → RUNNING | REPETITION_COMPLETE → AWAITING_REPETITION) → SESSION_COMPLETE
 */
public enum OrchestratorState {
    IDLE,
    CALIBRATING,
    AWAITING_REPETITION,
    RUNNING,
    ACCOUNTING,
    RETRY_PENDING,
    REPETITION_COMPLETE,
    SESSION_COMPLETE
}
