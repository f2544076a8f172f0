package net.bitcalc.cli;

public interface Terminal {

    /* Returns null at end of input. */
    String readLine(String prompt);

    void write(String text);

}
