package net.bitcalc.api;

/**
 * Either the value produced by a calculator operation or the exception
 * that terminated it.
 * Exactly one of getValue() and getError() is meaningful; which one is
 * indicated by isSuccess().
 */
public final class Result<T> {

    private final T value;
    private final CalculatorException error;

    private Result(T value, CalculatorException error) {
        this.value = value;
        this.error = error;
    }

    public String toString() {
        if (isSuccess()) {
            return "Result.success(" + value + ")";
        } else {
            return "Result.failure(" + error.getMessage() + ")";
        }
    }

    /**
     * Whether the operation completed normally.
     */
    public boolean isSuccess() {
        return (error == null);
    }

    /**
     * The value of a successful operation.
     * Throws an IllegalStateException for failed ones.
     */
    public T getValue() {
        if (error != null)
            throw new IllegalStateException("Result is a failure: " +
                error.getMessage(), error);
        return value;
    }

    /**
     * The exception of a failed operation, or null for successful ones.
     */
    public CalculatorException getError() {
        return error;
    }

    /**
     * Return the value of a successful operation or throw the exception of
     * a failed one.
     */
    public T orThrow() throws CalculatorException {
        if (error != null) throw error;
        return value;
    }

    public static <T> Result<T> success(T value) {
        if (value == null)
            throw new NullPointerException(
                "Result value may not be null");
        return new Result<T>(value, null);
    }

    public static <T> Result<T> failure(CalculatorException error) {
        if (error == null)
            throw new NullPointerException(
                "Result error may not be null");
        return new Result<T>(null, error);
    }

}
