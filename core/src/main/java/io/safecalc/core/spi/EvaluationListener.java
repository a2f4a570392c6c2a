package io.safecalc.core.spi;

/**
 * SPI for observability hooks around evaluation.
 *
 * <p>
 * Hosts provide implementations that bridge to their own logging or metrics.
 * The core has no telemetry dependencies; this is a plain Java interface.
 *
 * <p>
 * Implementations MUST be thread-safe and non-blocking. Exceptions thrown by
 * listeners are caught by the engine and logged and do NOT affect the
 * evaluation result.
 */
public interface EvaluationListener {

    /** Listener that ignores every event. */
    EvaluationListener NOOP = new EvaluationListener() {
        @Override
        public void onEvaluationCompleted(EvaluationCompletedEvent event) {}

        @Override
        public void onEvaluationFailed(EvaluationFailedEvent event) {}
    };

    /**
     * Called when an expression evaluated successfully.
     *
     * @param event contains expressionLength, value, durationNanos
     */
    void onEvaluationCompleted(EvaluationCompletedEvent event);

    /**
     * Called when an expression was rejected at any stage.
     *
     * @param event contains expressionLength, errorType, detail, durationNanos
     */
    void onEvaluationFailed(EvaluationFailedEvent event);

    // --- Event records ---

    /** Event emitted when evaluation succeeds. Lengths are in code points, as the input limit counts them. */
    record EvaluationCompletedEvent(int expressionLength, double value, long durationNanos) {}

    /** Event emitted when evaluation fails; {@code errorType} is the exception's URN. */
    record EvaluationFailedEvent(int expressionLength, String errorType, String detail, long durationNanos) {}
}
