package net.bitcalc.parser;

import net.bitcalc.api.CalculatorException;

public class ParsingException extends CalculatorException {

    public ParsingException(String expression, String message) {
        super(expression, message);
    }
    public ParsingException(String expression, String message,
                            Throwable cause) {
        super(expression, message, cause);
    }

}
