package net.bitcalc.cli;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;

public class StreamPairTerminal implements Terminal {

    private final BufferedReader input;
    private final PrintWriter output;
    private final PrintWriter promptOutput;

    /* promptOutput may be null to suppress prompts, or output itself. */
    public StreamPairTerminal(Reader input, Writer output,
                              Writer promptOutput) {
        this.input = new BufferedReader(input);
        this.output = asPrintWriter(output);
        if (promptOutput == null) {
            this.promptOutput = null;
        } else if (promptOutput == output) {
            this.promptOutput = this.output;
        } else {
            this.promptOutput = asPrintWriter(promptOutput);
        }
    }

    public boolean isPrompting() {
        return (promptOutput != null);
    }

    public String readLine(String prompt) {
        if (promptOutput != null) emit(promptOutput, prompt);
        try {
            return input.readLine();
        } catch (IOException exc) {
            throw new UncheckedIOException("Cannot read expression", exc);
        }
    }

    public void write(String text) {
        emit(output, text);
    }

    private static void emit(PrintWriter w, String text) {
        w.print(text);
        w.flush();
        if (w.checkError())
            throw new UncheckedIOException(new IOException(
                "Cannot write to terminal"));
    }

    private static PrintWriter asPrintWriter(Writer w) {
        return (w instanceof PrintWriter) ? (PrintWriter) w :
            new PrintWriter(w);
    }

    /* Prompts are only shown when attached to an interactive console. */
    public static StreamPairTerminal forStandardStreams() {
        Console con = System.console();
        if (con != null)
            return new StreamPairTerminal(con.reader(), con.writer(),
                                          con.writer());
        Charset cs = Charset.defaultCharset();
        return new StreamPairTerminal(new InputStreamReader(System.in, cs),
            new OutputStreamWriter(System.out, cs), null);
    }

}
