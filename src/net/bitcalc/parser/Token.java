package net.bitcalc.parser;

import java.math.BigInteger;
import net.bitcalc.api.TextLocation;

public class Token {

    private final String content;
    private final TokenKind kind;
    private final TextLocation position;

    public Token(String content, TokenKind kind, TextLocation position) {
        if (content == null)
            throw new NullPointerException(
                "Token content may not be null");
        if (kind == null)
            throw new NullPointerException(
                "Token kind may not be null");
        if (position == null)
            throw new NullPointerException(
                "Token coordinates may not be null");
        this.content = content;
        this.kind = kind;
        this.position = position;
    }

    public String toString() {
        return String.format("'%s' (%s) at %s", getContent(), getKind(),
                             getPosition());
    }

    public boolean equals(Object other) {
        if (! (other instanceof Token)) return false;
        Token to = (Token) other;
        return (getContent().equals(to.getContent()) &&
                getKind() == to.getKind() &&
                getPosition().equals(to.getPosition()));
    }

    public int hashCode() {
        return getContent().hashCode() ^ getKind().hashCode() ^
            getPosition().hashCode();
    }

    public String getContent() {
        return content;
    }

    public TokenKind getKind() {
        return kind;
    }

    public TextLocation getPosition() {
        return position;
    }

    public BigInteger toInteger() {
        if (kind != TokenKind.INTEGER)
            throw new IllegalStateException(
                "operator token is not a numeric value: " + this);
        return new BigInteger(content);
    }

}
