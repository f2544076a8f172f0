package net.bitcalc.expr;

import java.math.BigInteger;
import net.bitcalc.api.Utilities;
import org.json.JSONObject;

public class BinaryExpression extends Expression {

    private final Expression left;
    private final BinaryOperator operator;
    private final Expression right;

    protected BinaryExpression(Expression left, BinaryOperator operator,
                               Expression right, BigInteger value) {
        super(value);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        appendDerivation(sb, left);
        appendDerivation(sb, right);
        BinaryFormatter fmt = new BinaryFormatter(left.getValue(),
            right.getValue(), getValue());
        int digits = fmt.getDigits();
        // Shift counts are amounts, not bit patterns.
        String rightText = (operator.isShift()) ?
            right.getValue().toString() : fmt.format(right.getValue());
        sb.append(toString()).append('\n');
        sb.append(rightJustify(fmt.format(left.getValue()),
                               digits + GUTTER)).append('\n');
        sb.append(center(operator.getSymbol(), GUTTER))
          .append(rightJustify(rightText, digits)).append('\n');
        sb.append(repeat('-', digits + GUTTER)).append('\n');
        sb.append(rightJustify(fmt.format(getValue()), digits + GUTTER));
        return sb.toString();
    }

    public JSONObject toJSON() {
        return Utilities.createJSONObject("type", "binary",
                                          "operator", operator.getSymbol(),
                                          "left", left.toJSON(),
                                          "right", right.toJSON(),
                                          "value", getValue());
    }

    public static BinaryExpression create(Expression left,
            BinaryOperator operator, Expression right)
            throws EvaluationException {
        BigInteger value = operator.apply(left.getValue(), right.getValue());
        return new BinaryExpression(left, operator, right, value);
    }

}
