package io.safecalc.core.model;

import io.safecalc.core.error.CalcException;
import java.util.Objects;

/**
 * Outcome of evaluating one expression. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: {@code value} holds the exact, un-rounded result.
 * <li>{@link Type#ERROR}: {@code error} holds the typed failure; no value is available.
 * </ul>
 */
public final class EvaluationResult {

    /** The type of evaluation outcome. */
    public enum Type {
        SUCCESS,
        ERROR
    }

    private final Type type;
    private final double value;
    private final CalcException error;

    private EvaluationResult(Type type, double value, CalcException error) {
        this.type = type;
        this.value = value;
        this.error = error;
    }

    /** Creates a SUCCESS result. */
    public static EvaluationResult success(double value) {
        return new EvaluationResult(Type.SUCCESS, value, null);
    }

    /** Creates an ERROR result. */
    public static EvaluationResult error(CalcException error) {
        Objects.requireNonNull(error, "error must not be null for ERROR");
        return new EvaluationResult(Type.ERROR, Double.NaN, error);
    }

    public Type type() {
        return type;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    /**
     * The numeric result.
     *
     * @throws IllegalStateException if this is an ERROR result
     */
    public double value() {
        if (type != Type.SUCCESS) {
            throw new IllegalStateException("No value on an ERROR result: " + error.getMessage());
        }
        return value;
    }

    /** The failure, or {@code null} for SUCCESS. */
    public CalcException error() {
        return error;
    }

    @Override
    public String toString() {
        return type == Type.SUCCESS
                ? "EvaluationResult{SUCCESS, value=" + value + "}"
                : "EvaluationResult{ERROR, type=" + error.type() + ", detail=" + error.detail() + "}";
    }
}
