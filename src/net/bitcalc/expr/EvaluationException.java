package net.bitcalc.expr;

import net.bitcalc.api.CalculatorException;

public class EvaluationException extends CalculatorException {

    public EvaluationException(String message) {
        super(null, message);
    }
    public EvaluationException(String expression, String message) {
        super(expression, message);
    }
    public EvaluationException(String expression, String message,
                               Throwable cause) {
        super(expression, message, cause);
    }

    protected String getActivity() {
        return "evaluating";
    }

    public EvaluationException withExpression(String expression) {
        if (getExpression() != null) return this;
        return new EvaluationException(expression, getMessage(), this);
    }

}
