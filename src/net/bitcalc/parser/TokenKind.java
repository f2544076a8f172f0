package net.bitcalc.parser;

public enum TokenKind {
    INTEGER(null),
    AND("&"),
    OR("|"),
    XOR("^"),
    NOT("~"),
    LSHIFT("<<"),
    RSHIFT(">>"),
    LPAREN("("),
    RPAREN(")"),
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIVIDE("/"),
    MODULO("%");

    private final String symbol;

    private TokenKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isOperator() {
        return (this != INTEGER && this != LPAREN && this != RPAREN);
    }

    public static TokenKind forSymbol(String symbol) {
        for (TokenKind k : values()) {
            if (symbol.equals(k.getSymbol())) return k;
        }
        return null;
    }

}
