package net.bitcalc.parser;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public final class PrecedenceTable {

    public enum Associativity { LEFT, RIGHT }

    public static class Entry {

        private final TokenKind kind;
        private final int level;
        private final Associativity associativity;

        public Entry(TokenKind kind, int level,
                     Associativity associativity) {
            this.kind = kind;
            this.level = level;
            this.associativity = associativity;
        }

        public String toString() {
            return String.format("%s@%h[kind=%s,level=%s,assoc=%s]",
                getClass().getName(), this, getKind(), getLevel(),
                getAssociativity());
        }

        public TokenKind getKind() {
            return kind;
        }

        /* Lower levels bind tighter. */
        public int getLevel() {
            return level;
        }

        public Associativity getAssociativity() {
            return associativity;
        }

    }

    private static final Map<TokenKind, Entry> ENTRIES;

    static {
        Map<TokenKind, Entry> m = new EnumMap<TokenKind, Entry>(
            TokenKind.class);
        int level = 0;
        put(m, level++, Associativity.RIGHT, TokenKind.NOT);
        put(m, level++, Associativity.LEFT, TokenKind.TIMES,
            TokenKind.DIVIDE, TokenKind.MODULO);
        put(m, level++, Associativity.LEFT, TokenKind.LSHIFT,
            TokenKind.RSHIFT);
        put(m, level++, Associativity.LEFT, TokenKind.PLUS,
            TokenKind.MINUS);
        put(m, level++, Associativity.LEFT, TokenKind.AND);
        put(m, level++, Associativity.LEFT, TokenKind.XOR);
        put(m, level++, Associativity.LEFT, TokenKind.OR);
        ENTRIES = Collections.unmodifiableMap(m);
    }

    // Prevent construction.
    private PrecedenceTable() {}

    public static Entry lookup(TokenKind kind) {
        if (! kind.isOperator()) return null;
        return ENTRIES.get(kind);
    }

    public static boolean shouldPopBefore(Entry top, Entry incoming) {
        switch (top.getAssociativity()) {
            case LEFT:
                return incoming.getLevel() >= top.getLevel();
            case RIGHT:
                return incoming.getLevel() > top.getLevel();
            default:
                throw new AssertionError("Unhandled associativity " +
                    top.getAssociativity());
        }
    }

    private static void put(Map<TokenKind, Entry> m, int level,
                            Associativity assoc, TokenKind... kinds) {
        for (TokenKind k : kinds) m.put(k, new Entry(k, level, assoc));
    }

}
