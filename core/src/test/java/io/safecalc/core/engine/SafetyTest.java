package io.safecalc.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.safecalc.core.error.CalcException;
import io.safecalc.core.error.ExpressionSyntaxException;
import io.safecalc.core.error.FunctionNotAllowedException;
import io.safecalc.core.error.UnknownIdentifierException;
import io.safecalc.core.model.EvaluationResult;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Inputs that try to reach beyond arithmetic. Every one must be rejected with a typed {@link
 * CalcException} and never produce a value.
 */
class SafetyTest {

    private final CalculatorEngine engine = new CalculatorEngine();

    @ParameterizedTest
    @ValueSource(
            strings = {
                "__import__('os').system('ls')",
                "x = 1",
                "pi.real",
                "[1, 2]",
                "{1: 2}",
                "'abc'",
                "\"abc\"",
                "x[0]",
                "1; 2",
                "lambda: 1",
                "a if b else c",
                "1 < 2",
                "1 == 1",
                "not 1",
                "1 and 2",
                "2 ^ 3",
                "1 & 2",
                "~1",
                "f(x=1)",
                "sqrt(*[4])",
                "`id`",
                "# comment",
                "0x10",
                "1_000",
                "3j",
                "@x"
            })
    void nonArithmeticSyntaxIsRejectedByTheParser(String expression) {
        assertThatThrownBy(() -> engine.evaluate(expression)).isInstanceOf(ExpressionSyntaxException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"os", "__builtins__", "sys", "globals", "sqrt", "True", "None", "inf", "nan"})
    void namesOutsideTheConstantTableAreUnknown(String expression) {
        assertThatThrownBy(() -> engine.evaluate(expression)).isInstanceOf(UnknownIdentifierException.class);
    }

    @ParameterizedTest
    @ValueSource(
            strings = {"exec(1)", "eval(1)", "open(1)", "getattr(pi, 1)", "print(1)", "pi(2)", "e()", "exp(1)"})
    void callsOutsideTheFunctionTableAreNotAllowed(String expression) {
        assertThatThrownBy(() -> engine.evaluate(expression)).isInstanceOf(FunctionNotAllowedException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"__import__('os')", "open('/etc/passwd')", "exec(1)", "os", "2**1000"})
    void tryEvaluateNeverYieldsAValueForHostileInput(String expression) {
        EvaluationResult result = engine.tryEvaluate(expression);

        assertThat(result.isError()).isTrue();
        assertThat(result.error()).isInstanceOf(CalcException.class);
    }
}
