package net.bitcalc.expr;

import java.math.BigInteger;
import org.json.JSONObject;

public abstract class Expression {

    /* Width of the column holding operator symbols in diagrams. */
    public static final int GUTTER = 4;

    private final BigInteger value;

    protected Expression(BigInteger value) {
        if (value == null)
            throw new NullPointerException(
                "Expression value may not be null");
        this.value = value;
    }

    public BigInteger getValue() {
        return value;
    }

    public boolean isCompound() {
        return true;
    }

    public abstract String toString();

    public abstract String render();

    public abstract JSONObject toJSON();

    protected static void appendDerivation(StringBuilder sb,
                                           Expression child) {
        if (! child.isCompound()) return;
        sb.append(child.render()).append("\n\n");
    }

    protected static String rightJustify(String text, int width) {
        if (text.length() >= width) return text;
        return repeat(' ', width - text.length()) + text;
    }

    protected static String center(String text, int width) {
        if (text.length() >= width) return text;
        int margin = width - text.length();
        int left = margin / 2 + (margin & width & 1);
        return repeat(' ', left) + text + repeat(' ', margin - left);
    }

    protected static String repeat(char ch, int count) {
        StringBuilder sb = new StringBuilder(Math.max(count, 0));
        for (int i = 0; i < count; i++) sb.append(ch);
        return sb.toString();
    }

}
