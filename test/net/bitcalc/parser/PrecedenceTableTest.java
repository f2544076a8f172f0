package net.bitcalc.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class PrecedenceTableTest {

    private static PrecedenceTable.Entry get(TokenKind k) {
        return PrecedenceTable.lookup(k);
    }

    @Test
    public void levelsRunFromComplementToOr() {
        assertEquals(0, get(TokenKind.NOT).getLevel());
        assertEquals(1, get(TokenKind.TIMES).getLevel());
        assertEquals(1, get(TokenKind.DIVIDE).getLevel());
        assertEquals(1, get(TokenKind.MODULO).getLevel());
        assertEquals(2, get(TokenKind.LSHIFT).getLevel());
        assertEquals(2, get(TokenKind.RSHIFT).getLevel());
        assertEquals(3, get(TokenKind.PLUS).getLevel());
        assertEquals(3, get(TokenKind.MINUS).getLevel());
        assertEquals(4, get(TokenKind.AND).getLevel());
        assertEquals(5, get(TokenKind.XOR).getLevel());
        assertEquals(6, get(TokenKind.OR).getLevel());
        assertEquals(PrecedenceTable.Associativity.RIGHT,
                     get(TokenKind.NOT).getAssociativity());
        assertEquals(PrecedenceTable.Associativity.LEFT,
                     get(TokenKind.PLUS).getAssociativity());
    }

    @Test
    public void nonOperatorsHaveNoEntry() {
        assertNull(get(TokenKind.INTEGER));
        assertNull(get(TokenKind.LPAREN));
        assertNull(get(TokenKind.RPAREN));
    }

    @Test
    public void popBeforePush() {
        assertTrue(PrecedenceTable.shouldPopBefore(get(TokenKind.TIMES),
                                                   get(TokenKind.PLUS)));
        assertTrue(PrecedenceTable.shouldPopBefore(get(TokenKind.PLUS),
                                                   get(TokenKind.MINUS)));
        assertFalse(PrecedenceTable.shouldPopBefore(get(TokenKind.PLUS),
                                                    get(TokenKind.TIMES)));
        assertFalse(PrecedenceTable.shouldPopBefore(get(TokenKind.NOT),
                                                    get(TokenKind.NOT)));
        assertTrue(PrecedenceTable.shouldPopBefore(get(TokenKind.NOT),
                                                   get(TokenKind.OR)));
    }

}
