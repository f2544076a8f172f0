package net.bitcalc.expr;

import java.math.BigInteger;
import net.bitcalc.parser.TokenKind;

public enum BinaryOperator {
    AND(TokenKind.AND),
    OR(TokenKind.OR),
    XOR(TokenKind.XOR),
    PLUS(TokenKind.PLUS),
    MINUS(TokenKind.MINUS),
    TIMES(TokenKind.TIMES),
    DIVIDE(TokenKind.DIVIDE),
    MODULO(TokenKind.MODULO),
    LSHIFT(TokenKind.LSHIFT),
    RSHIFT(TokenKind.RSHIFT);

    /* Largest accepted left shift of a nonzero value. */
    public static final int MAX_SHIFT = 4096;

    private final TokenKind kind;

    private BinaryOperator(TokenKind kind) {
        this.kind = kind;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getSymbol() {
        return kind.getSymbol();
    }

    public boolean isShift() {
        return (this == LSHIFT || this == RSHIFT);
    }

    public BigInteger apply(BigInteger left, BigInteger right)
            throws EvaluationException {
        switch (this) {
            case AND:
                return left.and(right);
            case OR:
                return left.or(right);
            case XOR:
                return left.xor(right);
            case PLUS:
                return left.add(right);
            case MINUS:
                return left.subtract(right);
            case TIMES:
                return left.multiply(right);
            case DIVIDE:
                return divide(left, right);
            case MODULO:
                return modulo(left, right);
            case LSHIFT:
                return shiftLeft(left, right);
            case RSHIFT:
                return shiftRight(left, right);
            default:
                throw new AssertionError("Unhandled operator " + this);
        }
    }

    public static BinaryOperator forKind(TokenKind kind) {
        for (BinaryOperator op : values()) {
            if (op.getKind() == kind) return op;
        }
        return null;
    }

    private static BigInteger divide(BigInteger left, BigInteger right)
            throws EvaluationException {
        if (right.signum() == 0)
            throw new EvaluationException("Division by zero");
        BigInteger[] qr = left.divideAndRemainder(right);
        if (qr[1].signum() != 0)
            throw new EvaluationException("Quotient of " + left + " / " +
                right + " is not an integer");
        return qr[0];
    }

    private static BigInteger modulo(BigInteger left, BigInteger right)
            throws EvaluationException {
        if (right.signum() == 0)
            throw new EvaluationException("Modulo by zero");
        BigInteger ret = left.remainder(right);
        // The remainder takes the sign of the divisor.
        if (ret.signum() != 0 && ret.signum() != right.signum())
            ret = ret.add(right);
        return ret;
    }

    private static BigInteger shiftLeft(BigInteger left, BigInteger right)
            throws EvaluationException {
        checkShiftCount(right);
        if (left.signum() == 0) return left;
        if (right.compareTo(BigInteger.valueOf(MAX_SHIFT)) > 0)
            throw new EvaluationException("Shift count " + right +
                " exceeds the maximum of " + MAX_SHIFT);
        return left.shiftLeft(right.intValue());
    }

    private static BigInteger shiftRight(BigInteger left, BigInteger right)
            throws EvaluationException {
        checkShiftCount(right);
        if (right.bitLength() >= 31)
            return (left.signum() < 0) ? BigInteger.ONE.negate() :
                BigInteger.ZERO;
        return left.shiftRight(right.intValue());
    }

    private static void checkShiftCount(BigInteger count)
            throws EvaluationException {
        if (count.signum() < 0)
            throw new EvaluationException("Negative shift count " + count);
    }

}
