package net.bitcalc;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.logging.Logger;
import net.bitcalc.cli.Repl;
import net.bitcalc.cli.StreamPairTerminal;
import net.bitcalc.cli.Terminal;
import net.bitcalc.util.ArgParser;
import net.bitcalc.util.Logging;

public class Main implements Runnable {

    public static final String APPNAME = "BitCalc";
    public static final String VERSION = "0.1";
    public static final String DESCRIPTION = "a visual calculator for " +
        "bitwise expressions";
    public static final String BANNER = APPNAME + " v" + VERSION + " - " +
        DESCRIPTION + "\nUse Ctrl+C to quit.\n\n";

    private static final Logger LOGGER;

    static {
        Logging.initFormat();
        LOGGER = Logger.getLogger("Main");
    }

    private final String[] args;
    private final Settings settings;
    private Terminal terminal;
    private String expression;
    private int exitCode;

    public Main(String[] args, Terminal terminal) {
        this.args = args;
        this.settings = Settings.makeDefault();
        this.terminal = terminal;
    }
    public Main(String[] args) {
        this(args, null);
    }

    public Settings getSettings() {
        return settings;
    }

    public Terminal getTerminal() {
        return terminal;
    }
    public void setTerminal(Terminal t) {
        terminal = t;
    }

    public String getExpression() {
        return expression;
    }

    public int getExitCode() {
        return exitCode;
    }

    protected ArgParser createArgParser() {
        ArgParser p = new ArgParser("bitcalc");
        p.flag("help", '?', "Display help.");
        p.flag("version", 'V', "Display version.");
        p.flag("json", 'j', "Print results as JSON objects.");
        p.flag("postfix", 'p',
               "Also print the postfix form of each expression.");
        p.flag("quiet", 'q', "Do not print the banner.");
        p.option("prompt", null, "<TEXT>", "Interactive prompt.");
        p.option("config", 'C', "<FILE>", "Configuration file.");
        p.option("log-level", 'L', "<LEVEL>", "Logging level.");
        p.argument("expression",
            "Expression to evaluate instead of reading standard input.");
        return p;
    }

    /* Command-line values override every configuration source. */
    protected void applyArguments(Map<String, String> r) throws IOException {
        String configPath = r.get("config");
        if (configPath != null) settings.loadFile(new File(configPath));
        if (r.containsKey("json")) settings.set(Settings.Key.OUTPUT, "json");
        if (r.containsKey("postfix"))
            settings.set(Settings.Key.POSTFIX, "true");
        if (r.containsKey("quiet"))
            settings.set(Settings.Key.BANNER, "false");
        settings.set(Settings.Key.PROMPT, r.get("prompt"));
        settings.set(Settings.Key.LOG_LEVEL, r.get("log-level"));
        expression = r.get("expression");
    }

    protected Repl createRepl(Calculator calc, Terminal term) {
        Repl ret = new Repl(calc, term);
        ret.setPrompt(settings.getPrompt());
        ret.setFormat(settings.getOutputFormat());
        if (settings.isBannerEnabled()) ret.setBanner(BANNER);
        return ret;
    }

    protected Terminal openTerminal() {
        if (terminal == null)
            terminal = StreamPairTerminal.forStandardStreams();
        return terminal;
    }

    public void run() {
        ArgParser p = createArgParser();
        try {
            Map<String, String> r = p.parse(args);
            if (r.containsKey("help")) {
                openTerminal().write(p.formatUsage() + "\n" +
                                     p.formatHelp());
                return;
            } else if (r.containsKey("version")) {
                openTerminal().write(APPNAME + " " + VERSION + "\n");
                return;
            }
            applyArguments(r);
        } catch (ArgParser.UsageException exc) {
            System.err.println("ERROR: " + exc.getMessage());
            System.err.println(p.formatUsage());
            exitCode = 1;
            return;
        } catch (IOException exc) {
            System.err.println("ERROR: Cannot read configuration: " +
                exc.getMessage());
            exitCode = 1;
            return;
        }
        Repl repl;
        try {
            Logging.install(System.err, settings.getLogLevel());
            Calculator calc = new Calculator(settings.isPostfixEnabled());
            repl = createRepl(calc, openTerminal());
        } catch (IllegalArgumentException exc) {
            System.err.println("ERROR: Invalid configuration: " +
                exc.getMessage());
            exitCode = 1;
            return;
        }
        if (expression != null) {
            LOGGER.config("Evaluating single expression");
            repl.setBanner(null);
            exitCode = (repl.evaluate(expression)) ? 0 : 1;
        } else {
            LOGGER.info(APPNAME + " " + VERSION);
            repl.run();
            exitCode = 0;
        }
    }

    public static void main(String[] args) {
        Main m = new Main(args);
        m.run();
        System.exit(m.getExitCode());
    }

}
