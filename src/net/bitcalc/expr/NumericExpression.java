package net.bitcalc.expr;

import java.math.BigInteger;
import net.bitcalc.api.Utilities;
import org.json.JSONObject;

public class NumericExpression extends Expression {

    public NumericExpression(BigInteger value) {
        super(value);
    }

    public boolean isCompound() {
        return false;
    }

    public String toString() {
        return getValue().toString();
    }

    public String render() {
        return BinaryFormatter.singleFormat(getValue());
    }

    public JSONObject toJSON() {
        return Utilities.createJSONObject("type", "numeric",
                                          "value", getValue());
    }

}
