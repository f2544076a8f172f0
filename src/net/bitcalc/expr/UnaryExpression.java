package net.bitcalc.expr;

import net.bitcalc.api.Utilities;
import org.json.JSONObject;

public class UnaryExpression extends Expression {

    private final UnaryOperator operator;
    private final Expression operand;

    public UnaryExpression(UnaryOperator operator, Expression operand) {
        super(operator.apply(operand.getValue()));
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    public String toString() {
        return operator.getSymbol() + operand;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        appendDerivation(sb, operand);
        BinaryFormatter fmt = new BinaryFormatter(operand.getValue(),
                                                  getValue());
        int digits = fmt.getDigits();
        sb.append(toString()).append('\n');
        sb.append(center(operator.getSymbol(), GUTTER))
          .append(fmt.format(operand.getValue())).append('\n');
        sb.append(repeat('-', digits + GUTTER)).append('\n');
        sb.append(rightJustify(fmt.format(getValue()), digits + GUTTER));
        return sb.toString();
    }

    public JSONObject toJSON() {
        return Utilities.createJSONObject("type", "unary",
                                          "operator", operator.getSymbol(),
                                          "operand", operand.toJSON(),
                                          "value", getValue());
    }

}
