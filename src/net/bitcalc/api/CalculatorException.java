package net.bitcalc.api;

/**
 * Generic superclass for checked calculator exceptions.
 * Every instance remembers the expression text it was raised for (which
 * may be null if the failing component never saw the whole text).
 */
public class CalculatorException extends Exception {

    private final String expression;

    public CalculatorException(String expression) {
        super();
        this.expression = expression;
    }
    public CalculatorException(String expression, String message) {
        super(message);
        this.expression = expression;
    }
    public CalculatorException(String expression, Throwable cause) {
        super(cause);
        this.expression = expression;
    }
    public CalculatorException(String expression, String message,
                               Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }

    /**
     * The expression text whose processing failed.
     */
    public String getExpression() {
        return expression;
    }

    /**
     * A short verb describing the failed activity, as used by
     * formatDiagnostic().
     */
    protected String getActivity() {
        return "parsing";
    }

    /**
     * A one-line human-readable description of the failure.
     * Has the form "Error parsing expression '...': ...".
     */
    public String formatDiagnostic() {
        String expr = getExpression();
        String prefix = "Error " + getActivity() + " expression";
        if (expr != null) prefix += " '" + expr + "'";
        return prefix + ": " + getMessage();
    }

}
