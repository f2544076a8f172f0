package net.bitcalc.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class LexerTest {

    private static List<Token> lex(String input) throws LexerException {
        return new Lexer(input).lex();
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        List<TokenKind> ret = new ArrayList<TokenKind>();
        for (Token t : tokens) ret.add(t.getKind());
        return ret;
    }

    private static List<String> contents(List<Token> tokens) {
        List<String> ret = new ArrayList<String>();
        for (Token t : tokens) ret.add(t.getContent());
        return ret;
    }

    @Test
    public void lexesOperatorsAndIntegers() throws LexerException {
        List<Token> tokens = lex("(12 & 3) | ~4 ^ 5 + 6 * 7 / 8 % 9");
        assertEquals(Arrays.asList(TokenKind.LPAREN, TokenKind.INTEGER,
            TokenKind.AND, TokenKind.INTEGER, TokenKind.RPAREN,
            TokenKind.OR, TokenKind.NOT, TokenKind.INTEGER, TokenKind.XOR,
            TokenKind.INTEGER, TokenKind.PLUS, TokenKind.INTEGER,
            TokenKind.TIMES, TokenKind.INTEGER, TokenKind.DIVIDE,
            TokenKind.INTEGER, TokenKind.MODULO, TokenKind.INTEGER),
            kinds(tokens));
        assertEquals("12", tokens.get(1).getContent());
    }

    @Test
    public void lexesShifts() throws LexerException {
        List<Token> tokens = lex("8>>2<<1");
        assertEquals(Arrays.asList(TokenKind.INTEGER, TokenKind.RSHIFT,
            TokenKind.INTEGER, TokenKind.LSHIFT, TokenKind.INTEGER),
            kinds(tokens));
        assertEquals(Arrays.asList("8", ">>", "2", "<<", "1"),
                     contents(tokens));
    }

    @Test
    public void minusBeforeDigitIsPartOfLiteral() throws LexerException {
        List<Token> tokens = lex("-5");
        assertEquals(1, tokens.size());
        assertEquals(TokenKind.INTEGER, tokens.get(0).getKind());
        assertEquals(BigInteger.valueOf(-5), tokens.get(0).toInteger());
    }

    @Test
    public void adjacentMinusIsAbsorbedIntoFollowingLiteral()
            throws LexerException {
        List<Token> tokens = lex("1-2");
        assertEquals(Arrays.asList(TokenKind.INTEGER, TokenKind.INTEGER),
                     kinds(tokens));
        assertEquals(Arrays.asList("1", "-2"), contents(tokens));
    }

    @Test
    public void minusBeforeNonDigitIsOperator() throws LexerException {
        assertEquals(Arrays.asList(TokenKind.INTEGER, TokenKind.MINUS,
            TokenKind.INTEGER), kinds(lex("1 - 2")));
        assertEquals(Arrays.asList(TokenKind.MINUS, TokenKind.LPAREN,
            TokenKind.INTEGER, TokenKind.RPAREN), kinds(lex("-(3)")));
        assertEquals(Arrays.asList(TokenKind.INTEGER, TokenKind.MINUS),
                     kinds(lex("5-")));
    }

    @Test
    public void doubleMinusYieldsOperatorThenLiteral()
            throws LexerException {
        List<Token> tokens = lex("--5");
        assertEquals(Arrays.asList(TokenKind.MINUS, TokenKind.INTEGER),
                     kinds(tokens));
        assertEquals("-5", tokens.get(1).getContent());
    }

    @Test
    public void lexemesReproduceInputWithoutWhitespace()
            throws LexerException {
        String[] inputs = { "3+4*2", " ( 3 + 4 ) * 2 ", "~5 & -17",
                            "1\t<< 4 >>\t2", "1-2", "--5 % 3 ^ 9 | 0" };
        for (String input : inputs) {
            StringBuilder sb = new StringBuilder();
            for (Token t : lex(input)) sb.append(t.getContent());
            assertEquals(input.replace(" ", "").replace("\t", ""),
                         sb.toString());
        }
    }

    @Test
    public void rejectsUnknownCharacter() {
        try {
            lex("3 $ 4");
            fail("Expected LexerException");
        } catch (LexerException exc) {
            assertEquals("Encountered invalid token '$' at 2",
                         exc.getMessage());
            assertEquals(2, exc.getPosition().getCharacterIndex());
            assertEquals(3, exc.getPosition().getColumn());
            assertEquals("3 $ 4", exc.getExpression());
        }
    }

    @Test
    public void rejectsSingleAngleBracket() {
        try {
            lex("5 < 3");
            fail("Expected LexerException");
        } catch (LexerException exc) {
            assertEquals("Expected '<' at 2", exc.getMessage());
        }
        try {
            lex("5 ><3");
            fail("Expected LexerException");
        } catch (LexerException exc) {
            assertEquals("Expected '>' at 2", exc.getMessage());
        }
    }

    @Test
    public void rejectsNewline() {
        try {
            lex("1\n2");
            fail("Expected LexerException");
        } catch (LexerException exc) {
            assertTrue(exc.getMessage().startsWith(
                "Encountered invalid token"));
        }
    }

    @Test
    public void tracksColumnsAcrossTabs() throws LexerException {
        List<Token> tokens = lex("\t5 +\t6");
        assertEquals(9, tokens.get(0).getPosition().getColumn());
        assertEquals(1, tokens.get(0).getPosition().getCharacterIndex());
        assertEquals(11, tokens.get(1).getPosition().getColumn());
        assertEquals(17, tokens.get(2).getPosition().getColumn());
        assertEquals(5, tokens.get(2).getPosition().getCharacterIndex());
    }

    @Test(expected = IllegalStateException.class)
    public void operatorTokenHasNoIntegerValue() throws LexerException {
        lex("+").get(0).toInteger();
    }

}
