package net.bitcalc.expr;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collection;

public class BinaryFormatter {

    public static final int GROUP_SIZE = 8;

    private final int width;
    private final boolean negative;

    public BinaryFormatter(Collection<BigInteger> values) {
        if (values.isEmpty())
            throw new IllegalArgumentException(
                "Cannot compute a width for an empty set of values");
        int w = 0;
        boolean neg = false;
        for (BigInteger v : values) {
            w = Math.max(w, binaryDigits(v));
            if (v.signum() < 0) neg = true;
        }
        this.width = w;
        this.negative = neg;
    }
    public BinaryFormatter(BigInteger... values) {
        this(Arrays.asList(values));
    }

    public String toString() {
        return String.format("%s@%h[width=%s,negative=%s]",
            getClass().getName(), this, getWidth(), isNegative());
    }

    public int getWidth() {
        return width;
    }

    public boolean isNegative() {
        return negative;
    }

    public int getDigits() {
        return (negative) ? width + 1 : width;
    }

    public String format(BigInteger num) {
        if (! negative) {
            return toBinary(num, width);
        } else if (num.signum() > 0) {
            return " " + toBinary(num, width);
        } else {
            return toBinary(num, width + 1);
        }
    }

    public static String singleFormat(BigInteger num) {
        int digits = binaryDigits(num);
        if (num.signum() < 0) digits++;
        return toBinary(num, digits);
    }

    public static int binaryDigits(BigInteger num) {
        int ndigits;
        if (num.signum() == 0) {
            // log2(0) is taken to be 1, an exact power, hence 1 + 1.
            ndigits = 2;
        } else {
            // ceil(log2(|num|)), plus one if |num| is a power of two;
            // both cases amount to the bit length of |num|.
            ndigits = num.abs().bitLength();
        }
        if (ndigits % GROUP_SIZE != 0)
            ndigits = (ndigits / GROUP_SIZE + 1) * GROUP_SIZE;
        return ndigits;
    }

    /* Zero-padded binary for nonnegative numbers and two's complement
     * for negative ones; never shorter than needed to show the value. */
    protected static String toBinary(BigInteger num, int digits) {
        String bits;
        if (num.signum() >= 0) {
            bits = num.toString(2);
        } else {
            int size = Math.max(digits, num.bitLength() + 1);
            bits = BigInteger.ONE.shiftLeft(size).add(num).toString(2);
        }
        if (bits.length() >= digits) return bits;
        StringBuilder sb = new StringBuilder(digits);
        for (int i = bits.length(); i < digits; i++) sb.append('0');
        return sb.append(bits).toString();
    }

}
