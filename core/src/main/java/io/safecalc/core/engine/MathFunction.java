package io.safecalc.core.engine;

import io.safecalc.core.error.ArithmeticEvalException;
import java.util.List;
import java.util.Objects;

/**
 * A named, arity-checked, pure numeric function callable from expressions.
 *
 * @param name     name used in expressions
 * @param minArity minimum number of arguments
 * @param maxArity maximum number of arguments
 * @param body     the implementation; receives exactly as many arguments as were passed
 */
public record MathFunction(String name, int minArity, int maxArity, Body body) {

    /** Implementation of a {@link MathFunction}. May throw {@link ArithmeticEvalException}. */
    @FunctionalInterface
    public interface Body {
        double apply(double[] args);
    }

    public MathFunction {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        if (minArity < 0 || maxArity < minArity) {
            throw new IllegalArgumentException("invalid arity range for " + name + ": " + minArity + ".." + maxArity);
        }
    }

    /**
     * Applies the function after checking the argument count.
     *
     * @throws ArithmeticEvalException with {@code ARITY_MISMATCH} if the count is out of range, or
     *     whatever the body raises for domain errors
     */
    public double apply(List<Double> args) {
        int count = args.size();
        if (count < minArity || count > maxArity) {
            throw new ArithmeticEvalException(
                    ArithmeticEvalException.Reason.ARITY_MISMATCH,
                    name + "() takes " + describeArity() + " but " + count + " " + (count == 1 ? "was" : "were")
                            + " given");
        }
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = args.get(i);
        }
        return body.apply(values);
    }

    private String describeArity() {
        String noun = maxArity == 1 ? " argument" : " arguments";
        if (minArity == maxArity) {
            return "exactly " + minArity + noun;
        }
        return "from " + minArity + " to " + maxArity + noun;
    }
}
