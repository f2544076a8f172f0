package net.bitcalc.api;

/**
 * A location inside an expression text.
 * The location consists of line and column numbers as well as a character
 * index; see the method descriptions for more details.
 */
public interface TextLocation {

    /**
     * The 1-based line index.
     * Expressions are single lines, so this is normally 1.
     */
    long getLine();

    /**
     * The 1-based column index.
     * Tab characters advance the column to the next tab stop.
     */
    long getColumn();

    /**
     * The 0-based character index. Characters are Java characters, i.e.
     * UTF-16 code units.
     */
    long getCharacterIndex();

}
