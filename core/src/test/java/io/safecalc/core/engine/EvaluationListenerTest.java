package io.safecalc.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.safecalc.core.error.ArithmeticEvalException;
import io.safecalc.core.error.ExpressionSyntaxException;
import io.safecalc.core.spi.EvaluationListener;
import io.safecalc.core.spi.EvaluationListener.EvaluationCompletedEvent;
import io.safecalc.core.spi.EvaluationListener.EvaluationFailedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** Verifies that {@link CalculatorEngine} reports to its {@link EvaluationListener}. */
class EvaluationListenerTest {

    private EvaluationListener listener;
    private CalculatorEngine engine;

    @BeforeEach
    void setUp() {
        listener = mock(EvaluationListener.class);
        engine = new CalculatorEngine(FunctionRegistry.STANDARD, EvalPolicy.DEFAULT, NodeValidator.STANDARD, listener);
    }

    @Test
    void successIsReported() {
        engine.evaluate("2 + 2");

        ArgumentCaptor<EvaluationCompletedEvent> captor = ArgumentCaptor.forClass(EvaluationCompletedEvent.class);
        verify(listener).onEvaluationCompleted(captor.capture());
        verify(listener, never()).onEvaluationFailed(any());
        assertThat(captor.getValue().value()).isEqualTo(4.0);
        assertThat(captor.getValue().expressionLength()).isEqualTo(5);
        assertThat(captor.getValue().durationNanos()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void failureIsReportedWithTheErrorType() {
        assertThatThrownBy(() -> engine.evaluate("1/0")).isInstanceOf(ArithmeticEvalException.class);

        ArgumentCaptor<EvaluationFailedEvent> captor = ArgumentCaptor.forClass(EvaluationFailedEvent.class);
        verify(listener).onEvaluationFailed(captor.capture());
        verify(listener, never()).onEvaluationCompleted(any());
        assertThat(captor.getValue().errorType()).isEqualTo(ArithmeticEvalException.TYPE);
        assertThat(captor.getValue().detail()).isEqualTo("division by zero");
    }

    @Test
    void expressionLengthIsInCodePoints() {
        CalculatorEngine tight =
                new CalculatorEngine(FunctionRegistry.STANDARD, new EvalPolicy(1e6, 10, 200, 3), NodeValidator.STANDARD, listener);
        // U+1F600 is one code point but two chars; the input passes the length check and fails in the lexer
        String expression = "1+\uD83D\uDE00";

        assertThat(tight.tryEvaluate(expression).isError()).isTrue();

        ArgumentCaptor<EvaluationFailedEvent> captor = ArgumentCaptor.forClass(EvaluationFailedEvent.class);
        verify(listener).onEvaluationFailed(captor.capture());
        assertThat(captor.getValue().errorType()).isEqualTo(ExpressionSyntaxException.TYPE);
        assertThat(captor.getValue().expressionLength()).isEqualTo(3);
    }

    @Test
    void throwingListenerDoesNotChangeTheResult() {
        doThrow(new IllegalStateException("listener broke")).when(listener).onEvaluationCompleted(any());
        doThrow(new IllegalStateException("listener broke")).when(listener).onEvaluationFailed(any());

        assertThat(engine.evaluate("3 * 3")).isEqualTo(9.0);
        assertThatThrownBy(() -> engine.evaluate("sqrt(-1)")).isInstanceOf(ArithmeticEvalException.class);
    }

    @Test
    void parseAloneDoesNotNotify() {
        engine.parse("1 + 1");

        verify(listener, never()).onEvaluationCompleted(any());
        verify(listener, never()).onEvaluationFailed(any());
    }
}
