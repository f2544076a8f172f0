package net.bitcalc.parser;

import net.bitcalc.api.CalculatorException;
import net.bitcalc.api.TextLocation;

public class LexerException extends CalculatorException {

    private final TextLocation position;

    public LexerException(String expression, TextLocation pos,
                          String message) {
        super(expression, message);
        position = pos;
    }
    public LexerException(String expression, TextLocation pos,
                          String message, Throwable cause) {
        super(expression, message, cause);
        position = pos;
    }

    public TextLocation getPosition() {
        return position;
    }

}
