package net.bitcalc.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.bitcalc.api.TextLocation;
import net.bitcalc.util.LocationTracker;

public class Lexer {

    private static final Logger LOGGER = Logger.getLogger("Lexer");

    private static final Map<Character, TokenKind> OPERATORS;

    static {
        Map<Character, TokenKind> ops = new HashMap<Character, TokenKind>();
        for (TokenKind k : TokenKind.values()) {
            String sym = k.getSymbol();
            if (sym != null && sym.length() == 1) ops.put(sym.charAt(0), k);
        }
        OPERATORS = Collections.unmodifiableMap(ops);
    }

    private final String input;
    private LocationTracker position;
    private int index;

    public Lexer(String input) {
        if (input == null)
            throw new NullPointerException("Lexer input may not be null");
        this.input = input;
        this.position = new LocationTracker();
        this.index = 0;
    }

    public String getInput() {
        return input;
    }

    public TextLocation getCurrentPosition() {
        return position.snapshot();
    }

    protected int getIndex() {
        return index;
    }

    protected boolean isAtEnd() {
        return index >= input.length();
    }

    protected char current() {
        return input.charAt(index);
    }

    protected int peekNext() {
        return (index + 1 < input.length()) ? input.charAt(index + 1) : -1;
    }

    protected void advance(int count) {
        position.advance(input, index, count);
        index += count;
    }

    public List<Token> lex() throws LexerException {
        position = new LocationTracker();
        index = 0;
        List<Token> ret = new ArrayList<Token>();
        while (! isAtEnd()) {
            Token tok = next();
            if (tok != null) ret.add(tok);
        }
        if (LOGGER.isLoggable(Level.FINE))
            LOGGER.fine("Lexed '" + input + "' into " + ret);
        return ret;
    }

    protected Token next() throws LexerException {
        char ch = current();
        switch (ch) {
            case ' ':
            case '\t':
                advance(1);
                return null;
            case '<':
            case '>':
                return lexShift();
            case '-':
                return lexInteger();
            default:
                if (isDigit(ch)) return lexInteger();
                return lexOperator();
        }
    }

    protected Token lexInteger() throws LexerException {
        TextLocation start = getCurrentPosition();
        int begin = index;
        if (current() == '-') {
            // A minus sign directly followed by a digit is part of the
            // literal; anything else makes it an operator.
            if (! isDigit(peekNext())) return lexOperator();
            advance(1);
        }
        while (! isAtEnd() && isDigit(current())) advance(1);
        return new Token(input.substring(begin, index), TokenKind.INTEGER,
                         start);
    }

    protected Token lexShift() throws LexerException {
        char ch = current();
        if (peekNext() != ch)
            throw new LexerException(input, getCurrentPosition(),
                "Expected '" + ch + "' at " + index);
        TextLocation start = getCurrentPosition();
        String content = input.substring(index, index + 2);
        advance(2);
        return new Token(content, TokenKind.forSymbol(content), start);
    }

    protected Token lexOperator() throws LexerException {
        TokenKind kind = OPERATORS.get(current());
        if (kind == null) throw unexpectedInput();
        TextLocation start = getCurrentPosition();
        String content = String.valueOf(current());
        advance(1);
        return new Token(content, kind, start);
    }

    protected LexerException unexpectedInput() {
        return new LexerException(input, getCurrentPosition(),
            "Encountered invalid token '" + current() + "' at " + index);
    }

    private static boolean isDigit(int ch) {
        return (ch >= '0' && ch <= '9');
    }

}
