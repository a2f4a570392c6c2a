package io.safecalc.core.engine;

import io.safecalc.core.error.ArithmeticEvalException;
import io.safecalc.core.error.ArithmeticEvalException.Reason;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed table of named constants and functions reachable from expressions.
 *
 * <p>The table is built once and cannot be changed afterwards; there is no registration method.
 * {@link #STANDARD} holds {@code pi}, {@code e}, {@code sqrt}, {@code sin}, {@code cos}, {@code
 * tan}, {@code log}, {@code log10}, {@code abs} and {@code round}. Immutable and thread-safe.
 */
public final class FunctionRegistry {

    /** Largest {@code ndigits} that can still change a double when rounding. */
    private static final int ROUND_MAX_DIGITS = 323;
    /** Below this {@code ndigits} every double rounds to zero. */
    private static final int ROUND_MIN_DIGITS = -308;

    /** The standard calculator table. */
    public static final FunctionRegistry STANDARD = standard();

    private final Map<String, Double> constants;
    private final Map<String, MathFunction> functions;

    private FunctionRegistry(Map<String, Double> constants, Map<String, MathFunction> functions) {
        this.constants = Map.copyOf(constants);
        this.functions = Map.copyOf(functions);
    }

    /** Looks up a constant by name. */
    public Optional<Double> constant(String name) {
        return Optional.ofNullable(constants.get(name));
    }

    /** Looks up a function by name. */
    public Optional<MathFunction> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Set<String> constantNames() {
        return constants.keySet();
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }

    private static FunctionRegistry standard() {
        Map<String, Double> constants = new LinkedHashMap<>();
        constants.put("pi", Math.PI);
        constants.put("e", Math.E);

        Map<String, MathFunction> functions = new LinkedHashMap<>();
        add(functions, new MathFunction("sqrt", 1, 1, args -> sqrt(args[0])));
        add(functions, new MathFunction("sin", 1, 1, args -> Math.sin(finite(args[0]))));
        add(functions, new MathFunction("cos", 1, 1, args -> Math.cos(finite(args[0]))));
        add(functions, new MathFunction("tan", 1, 1, args -> Math.tan(finite(args[0]))));
        add(functions, new MathFunction("log", 1, 2, FunctionRegistry::log));
        add(functions, new MathFunction("log10", 1, 1, args -> Math.log10(positive(args[0]))));
        add(functions, new MathFunction("abs", 1, 1, args -> Math.abs(args[0])));
        add(functions, new MathFunction("round", 1, 2, FunctionRegistry::round));
        return new FunctionRegistry(constants, functions);
    }

    private static void add(Map<String, MathFunction> functions, MathFunction function) {
        functions.put(function.name(), function);
    }

    // --- Function bodies ---

    private static double sqrt(double x) {
        if (x < 0) {
            throw domainError();
        }
        return Math.sqrt(x);
    }

    private static double log(double[] args) {
        double x = positive(args[0]);
        if (args.length == 1) {
            return Math.log(x);
        }
        double base = positive(args[1]);
        double denominator = Math.log(base);
        if (denominator == 0) {
            throw new ArithmeticEvalException(Reason.DIVISION_BY_ZERO, "division by zero: logarithm base 1");
        }
        return Math.log(x) / denominator;
    }

    /**
     * Round-half-even on the exact binary value of {@code x}. Without {@code ndigits} the result is
     * integral; with it the result keeps {@code ndigits} decimal places (negative values round to
     * tens, hundreds, ...).
     */
    private static double round(double[] args) {
        double x = args[0];
        if (args.length == 1) {
            if (Double.isNaN(x)) {
                throw new ArithmeticEvalException(Reason.DOMAIN_ERROR, "cannot convert float NaN to integer");
            }
            if (Double.isInfinite(x)) {
                throw new ArithmeticEvalException(Reason.DOMAIN_ERROR, "cannot convert float infinity to integer");
            }
            return Math.rint(x);
        }
        double digits = args[1];
        if (!Double.isFinite(digits) || digits != Math.rint(digits)) {
            throw new ArithmeticEvalException(
                    Reason.INVALID_ARGUMENT, "round() ndigits must be an integer, got " + digits);
        }
        if (!Double.isFinite(x) || x == 0 || digits > ROUND_MAX_DIGITS) {
            return x;
        }
        if (digits < ROUND_MIN_DIGITS) {
            return 0.0 * x;
        }
        double rounded = new BigDecimal(x).setScale((int) digits, RoundingMode.HALF_EVEN).doubleValue();
        return rounded == 0 ? Math.copySign(0.0, x) : rounded;
    }

    // --- Domain guards ---

    private static double positive(double x) {
        if (x <= 0) {
            throw domainError();
        }
        return x;
    }

    private static double finite(double x) {
        if (Double.isInfinite(x)) {
            throw domainError();
        }
        return x;
    }

    private static ArithmeticEvalException domainError() {
        return new ArithmeticEvalException(Reason.DOMAIN_ERROR, "math domain error");
    }
}
