package net.bitcalc.expr;

import java.math.BigInteger;
import net.bitcalc.parser.TokenKind;

public enum UnaryOperator {
    PLUS(TokenKind.PLUS),
    MINUS(TokenKind.MINUS),
    NOT(TokenKind.NOT);

    private static final BigInteger MINUS_ONE = BigInteger.valueOf(-1);

    private final TokenKind kind;

    private UnaryOperator(TokenKind kind) {
        this.kind = kind;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getSymbol() {
        return kind.getSymbol();
    }

    public BigInteger apply(BigInteger operand) {
        switch (this) {
            case PLUS:
                return operand;
            case MINUS:
                return MINUS_ONE.multiply(operand);
            case NOT:
                return operand.not();
            default:
                throw new AssertionError("Unhandled operator " + this);
        }
    }

    public static UnaryOperator forKind(TokenKind kind) {
        for (UnaryOperator op : values()) {
            if (op.getKind() == kind) return op;
        }
        return null;
    }

}
