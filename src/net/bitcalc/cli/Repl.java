package net.bitcalc.cli;

import java.util.logging.Logger;
import net.bitcalc.Calculation;
import net.bitcalc.Calculator;
import net.bitcalc.api.Result;
import net.bitcalc.api.Utilities;

public class Repl implements Runnable {

    public enum OutputFormat {
        TEXT, JSON;

        public static OutputFormat parse(String name) {
            for (OutputFormat f : values()) {
                if (f.name().equalsIgnoreCase(name)) return f;
            }
            throw new IllegalArgumentException("Unknown output format " +
                name);
        }

    }

    public static final String DEFAULT_PROMPT = ">>> ";

    private static final Logger LOGGER = Logger.getLogger("Repl");

    private final Calculator calculator;
    private final Terminal term;
    private String prompt;
    private String banner;
    private OutputFormat format;

    public Repl(Calculator calculator, Terminal term) {
        this.calculator = calculator;
        this.term = term;
        this.prompt = DEFAULT_PROMPT;
        this.banner = null;
        this.format = OutputFormat.TEXT;
    }

    public Calculator getCalculator() {
        return calculator;
    }

    public Terminal getTerminal() {
        return term;
    }

    public String getPrompt() {
        return prompt;
    }
    public void setPrompt(String p) {
        prompt = p;
    }

    public String getBanner() {
        return banner;
    }
    public void setBanner(String b) {
        banner = b;
    }

    public OutputFormat getFormat() {
        return format;
    }
    public void setFormat(OutputFormat f) {
        format = f;
    }

    public void run() {
        if (banner != null) term.write(banner);
        for (;;) {
            String line = term.readLine(prompt);
            if (line == null) {
                term.write("\n");
                break;
            }
            if (line.trim().isEmpty()) continue;
            evaluate(line);
        }
        LOGGER.fine("End of input reached");
    }

    public boolean evaluate(String line) {
        Result<Calculation> res = calculator.parse(line);
        term.write(format(line, res));
        return res.isSuccess();
    }

    public String format(String line, Result<Calculation> res) {
        if (format == OutputFormat.JSON) {
            if (res.isSuccess())
                return res.getValue().toJSON().toString() + "\n";
            return Utilities.createJSONObject("expression", line,
                "error", res.getError().formatDiagnostic()).toString() +
                "\n";
        }
        if (! res.isSuccess())
            return res.getError().formatDiagnostic() + "\n";
        Calculation calc = res.getValue();
        StringBuilder sb = new StringBuilder("\n");
        sb.append(calc.render()).append('\n');
        sb.append(calc.getValue()).append('\n');
        if (calc.getPostfix() != null)
            sb.append("postfix: ").append(calc.formatPostfix()).append('\n');
        return sb.append('\n').toString();
    }

}
