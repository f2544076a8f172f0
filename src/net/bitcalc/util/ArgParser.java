package net.bitcalc.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ArgParser {

    public static class UsageException extends Exception {

        public UsageException(String message) {
            super(message);
        }

    }

    public static final class Option {

        private final String name;
        private final Character letter;
        private final String placeholder;
        private final String description;

        public Option(String name, Character letter, String placeholder,
                      String description) {
            this.name = name;
            this.letter = letter;
            this.placeholder = placeholder;
            this.description = description;
        }

        public String toString() {
            return getLabel();
        }

        public String getName() {
            return name;
        }

        public Character getLetter() {
            return letter;
        }

        /* Null for flags. */
        public String getPlaceholder() {
            return placeholder;
        }

        public String getDescription() {
            return description;
        }

        public boolean takesValue() {
            return (placeholder != null);
        }

        public String getLabel() {
            StringBuilder sb = new StringBuilder("--").append(name);
            if (letter != null) sb.append("|-").append(letter);
            if (placeholder != null) sb.append(' ').append(placeholder);
            return sb.toString();
        }

    }

    private final String programName;
    private final List<Option> options;
    private String argumentName;
    private String argumentDescription;

    public ArgParser(String programName) {
        this.programName = programName;
        this.options = new ArrayList<Option>();
    }

    public String getProgramName() {
        return programName;
    }

    public Option flag(String name, Character letter, String description) {
        return add(new Option(name, letter, null, description));
    }

    public Option option(String name, Character letter, String placeholder,
                         String description) {
        return add(new Option(name, letter, placeholder, description));
    }

    /* Declares the single optional positional argument. */
    public void argument(String name, String description) {
        argumentName = name;
        argumentDescription = description;
    }

    public String formatUsage() {
        StringBuilder sb = new StringBuilder("USAGE: ").append(programName);
        for (Option opt : options) {
            sb.append(" [").append(opt.getLabel()).append(']');
        }
        if (argumentName != null)
            sb.append(" [<").append(argumentName).append(">]");
        return sb.toString();
    }

    public String formatHelp() {
        int width = 0;
        for (Option opt : options) {
            width = Math.max(width, opt.getLabel().length());
        }
        if (argumentName != null)
            width = Math.max(width, argumentName.length() + 2);
        String line = "  %-" + width + "s  %s%n";
        StringBuilder sb = new StringBuilder();
        for (Option opt : options) {
            sb.append(String.format(line, opt.getLabel(),
                                    opt.getDescription()));
        }
        if (argumentName != null)
            sb.append(String.format(line, "<" + argumentName + ">",
                                    argumentDescription));
        return sb.toString();
    }

    /* Flags map to null; the positional argument maps under its name. */
    public Map<String, String> parse(String... args) throws UsageException {
        Map<String, String> ret = new LinkedHashMap<String, String>();
        boolean optionsDone = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (! optionsDone && arg.equals("--")) {
                optionsDone = true;
            } else if (! optionsDone && arg.startsWith("-") &&
                       arg.length() > 1) {
                Option opt = find(arg);
                if (opt == null)
                    throw new UsageException("Unrecognized option " + arg);
                String value = null;
                if (opt.takesValue()) {
                    if (++i == args.length)
                        throw new UsageException("Missing required value " +
                            "for option --" + opt.getName());
                    value = args[i];
                }
                ret.put(opt.getName(), value);
            } else if (argumentName != null &&
                       ! ret.containsKey(argumentName)) {
                ret.put(argumentName, arg);
            } else {
                throw new UsageException("Superfluous argument " + arg);
            }
        }
        return ret;
    }

    private Option add(Option opt) {
        options.add(opt);
        return opt;
    }

    private Option find(String arg) {
        for (Option opt : options) {
            if (arg.startsWith("--")) {
                if (arg.substring(2).equals(opt.getName())) return opt;
            } else if (arg.length() == 2 && opt.getLetter() != null &&
                       arg.charAt(1) == opt.getLetter()) {
                return opt;
            }
        }
        return null;
    }

}
