package net.bitcalc;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.bitcalc.api.Utilities;
import net.bitcalc.expr.Expression;
import org.json.JSONArray;
import org.json.JSONObject;

public class Calculation {

    private final String expression;
    private final Expression tree;
    private final List<String> postfix;

    public Calculation(String expression, Expression tree,
                       List<String> postfix) {
        if (expression == null)
            throw new NullPointerException(
                "Calculation expression may not be null");
        if (tree == null)
            throw new NullPointerException(
                "Calculation tree may not be null");
        this.expression = expression;
        this.tree = tree;
        this.postfix = (postfix == null) ? null :
            Collections.unmodifiableList(new ArrayList<String>(postfix));
    }
    public Calculation(String expression, Expression tree) {
        this(expression, tree, null);
    }

    public String toString() {
        return String.format("%s@%h[expression=%s,value=%s]",
            getClass().getName(), this, getExpression(), getValue());
    }

    public String getExpression() {
        return expression;
    }

    public Expression getTree() {
        return tree;
    }

    public BigInteger getValue() {
        return tree.getValue();
    }

    public List<String> getPostfix() {
        return postfix;
    }

    public String formatPostfix() {
        if (postfix == null) return null;
        StringBuilder sb = new StringBuilder();
        for (String item : postfix) {
            if (sb.length() != 0) sb.append(' ');
            sb.append(item);
        }
        return sb.toString();
    }

    public String render() {
        return tree.render();
    }

    public JSONObject toJSON() {
        return Utilities.createJSONObject("expression", expression,
            "value", getValue(),
            "tree", tree.toJSON(),
            "postfix", (postfix == null) ? null : new JSONArray(postfix));
    }

}
