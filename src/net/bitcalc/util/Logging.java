package net.bitcalc.util;

import java.io.OutputStream;
import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

public final class Logging {

    public static final String FORMAT_PROPERTY =
        "java.util.logging.SimpleFormatter.format";

    /* Time, level, logger, message, exception. */
    public static final String FORMAT =
        "[%1$tF %1$tT.%1$tL %4$s %3$s] %5$s%6$s%n";

    private Logging() {}

    /* A format given on the command line takes precedence. */
    public static void initFormat() {
        if (System.getProperty(FORMAT_PROPERTY) == null)
            System.setProperty(FORMAT_PROPERTY, FORMAT);
    }

    public static Level parseLevel(String name) {
        try {
            return Level.parse(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exc) {
            throw new IllegalArgumentException("Invalid log level " + name,
                                               exc);
        }
    }

    /* Replaces the root logger's handlers with a single one writing to os
     * and flushing after every record. */
    public static Handler install(OutputStream os, Level level) {
        Logger root = Logger.getLogger("");
        for (Handler hnd : root.getHandlers()) root.removeHandler(hnd);
        Handler ret = new StreamHandler(os, new SimpleFormatter()) {
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        ret.setLevel(Level.ALL);
        root.addHandler(ret);
        root.setLevel(level);
        return ret;
    }

}
