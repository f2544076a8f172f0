package net.bitcalc;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import net.bitcalc.api.Utilities;
import net.bitcalc.cli.Repl;
import net.bitcalc.util.Logging;

public class Settings {

    public enum Key {
        PROMPT("bitcalc.prompt", Repl.DEFAULT_PROMPT),
        OUTPUT("bitcalc.output", "text"),
        POSTFIX("bitcalc.postfix", "false"),
        BANNER("bitcalc.banner", "true"),
        LOG_LEVEL("bitcalc.log.level", "WARNING");

        private final String name;
        private final String defaultValue;

        private Key(String name, String defaultValue) {
            this.name = name;
            this.defaultValue = defaultValue;
        }

        public String getName() {
            return name;
        }

        public String getDefault() {
            return defaultValue;
        }

        /* bitcalc.log.level is looked up as BITCALC_LOG_LEVEL. */
        public String getEnvName() {
            return name.toUpperCase(Locale.ROOT).replace('.', '_');
        }

    }

    public interface Source {

        /* Returns null if the source does not define the key. */
        String lookup(Key key);

    }

    public static final Source SYSTEM_PROPERTIES = new Source() {
        public String lookup(Key key) {
            return System.getProperty(key.getName());
        }
        public String toString() {
            return "<system properties>";
        }
    };

    public static final Source ENVIRONMENT = new Source() {
        public String lookup(Key key) {
            return System.getenv(key.getEnvName());
        }
        public String toString() {
            return "<environment>";
        }
    };

    private final Map<Key, String> explicit;
    private final List<Source> sources;

    public Settings() {
        explicit = new EnumMap<Key, String>(Key.class);
        sources = new ArrayList<Source>();
    }

    public String toString() {
        return String.format("%s@%h[explicit=%s,sources=%s]",
            getClass().getName(), this, explicit, sources);
    }

    /* Explicit values win over the sources, which are consulted in the
     * order they were added; the key's default applies last. */
    public String get(Key key) {
        String ret = explicit.get(key);
        if (ret != null) return ret;
        for (Source src : sources) {
            ret = src.lookup(key);
            if (ret != null) return ret;
        }
        return key.getDefault();
    }

    public void set(Key key, String value) {
        if (value == null) {
            explicit.remove(key);
        } else {
            explicit.put(key, value);
        }
    }

    public void addSource(Source src) {
        sources.add(src);
    }

    public void loadFile(File path) throws IOException {
        final Properties props = new Properties();
        Reader in = new InputStreamReader(new FileInputStream(path),
                                          StandardCharsets.UTF_8);
        try {
            props.load(in);
        } finally {
            in.close();
        }
        final String origin = path.getPath();
        addSource(new Source() {
            public String lookup(Key key) {
                return props.getProperty(key.getName());
            }
            public String toString() {
                return origin;
            }
        });
    }

    public String getPrompt() {
        return get(Key.PROMPT);
    }

    public Repl.OutputFormat getOutputFormat() {
        return Repl.OutputFormat.parse(get(Key.OUTPUT));
    }

    public boolean isPostfixEnabled() {
        return Utilities.isTrue(get(Key.POSTFIX));
    }

    public boolean isBannerEnabled() {
        return Utilities.isTrue(get(Key.BANNER));
    }

    public Level getLogLevel() {
        return Logging.parseLevel(get(Key.LOG_LEVEL));
    }

    public static Settings makeDefault() {
        Settings ret = new Settings();
        ret.addSource(SYSTEM_PROPERTIES);
        ret.addSource(ENVIRONMENT);
        return ret;
    }

}
