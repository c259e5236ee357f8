package net.atndebug.util;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ArgParser {

    public static class ParsingException extends Exception {

        public ParsingException() {
            super();
        }

        public ParsingException(String message) {
            super(message);
        }

        public ParsingException(Throwable cause) {
            super(cause);
        }

        public ParsingException(String message, Throwable cause) {
            super(message, cause);
        }

    }

    public abstract static class BaseOption {

        private final String name;
        private final String valueDesc;
        private final String description;

        public BaseOption(String name, String valueDesc, String description) {
            this.name = name;
            this.valueDesc = valueDesc;
            this.description = description;
        }

        public String getName() {
            return name;
        }

        public String getValueDesc() {
            return valueDesc;
        }

        public String getDescription() {
            return description;
        }

        public abstract String getFullName();
        public abstract String getFullLabel();

    }

    public static class Option extends BaseOption {

        private final Character letter;

        public Option(String name, Character letter, String valueDesc,
                      String description) {
            super(name, valueDesc, description);
            this.letter = letter;
        }

        public Character getLetter() {
            return letter;
        }

        public boolean isFlag() {
            return (getValueDesc() == null);
        }

        public String getFullName() {
            return "option --" + getName();
        }

        public String getFullLabel() {
            StringBuilder sb = new StringBuilder("--");
            sb.append(getName());
            if (getLetter() != null) sb.append("|-").append(getLetter());
            return sb.toString();
        }

        public String parse(Iterator<String> values) throws ParsingException {
            if (isFlag()) return "true";
            if (! values.hasNext())
                throw new ParsingException("Missing required value for " +
                    getFullName());
            return values.next();
        }

    }

    public static class Argument extends BaseOption {

        private final boolean optional;

        public Argument(String name, boolean optional, String description) {
            super(name, name, description);
            this.optional = optional;
        }

        public Argument(String name, String description) {
            this(name, false, description);
        }

        public boolean isOptional() {
            return optional;
        }

        public String getFullName() {
            return "argument <" + getName() + ">";
        }

        public String getFullLabel() {
            return "<" + getName() + ">";
        }

    }

    public static final String HELP = "help";

    private final String programName;
    private final Map<String, Option> options;
    private final Map<Character, Option> letterOptions;
    private final List<Argument> arguments;

    public ArgParser(String programName) {
        this.programName = programName;
        this.options = new LinkedHashMap<String, Option>();
        this.letterOptions = new HashMap<Character, Option>();
        this.arguments = new ArrayList<Argument>();
        add(new Option(HELP, '?', null, "Show this help."));
    }

    public String getProgramName() {
        return programName;
    }

    public Map<String, Option> getOptions() {
        return Collections.unmodifiableMap(options);
    }

    public List<Argument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public void add(Option opt) {
        if (options.containsKey(opt.getName()))
            throw new IllegalArgumentException("Duplicate option " +
                opt.getFullName());
        options.put(opt.getName(), opt);
        if (opt.getLetter() != null) letterOptions.put(opt.getLetter(), opt);
    }

    public void add(Argument arg) {
        if (! arguments.isEmpty() &&
                arguments.get(arguments.size() - 1).isOptional() &&
                ! arg.isOptional())
            throw new IllegalArgumentException("Required " +
                arg.getFullName() + " may not follow an optional one");
        arguments.add(arg);
    }

    public void writeUsage(PrintWriter drain) {
        drain.append("USAGE: ").append(programName);
        for (Option opt : options.values()) {
            drain.append(" [");
            drain.append(opt.getFullLabel());
            if (! opt.isFlag())
                drain.append(" ").append(opt.getValueDesc());
            drain.append("]");
        }
        for (Argument arg : arguments) {
            drain.append(" ");
            if (arg.isOptional()) drain.append("[");
            drain.append(arg.getFullLabel());
            if (arg.isOptional()) drain.append("]");
        }
        drain.println();
    }

    public void writeHelp(PrintWriter drain) {
        List<String[]> entries = new ArrayList<String[]>();
        for (Option opt : options.values()) {
            entries.add(new String[] { opt.getFullLabel(),
                (opt.isFlag()) ? "" : opt.getValueDesc(),
                opt.getDescription() });
        }
        for (Argument arg : arguments) {
            entries.add(new String[] { arg.getFullLabel(), "",
                                       arg.getDescription() });
        }
        int labelWidth = 0, vdescWidth = 0;
        for (String[] ent : entries) {
            labelWidth = Math.max(labelWidth, ent[0].length());
            vdescWidth = Math.max(vdescWidth, ent[1].length());
        }
        String lineFormat = makeFormat(labelWidth) + " " +
            makeFormat(vdescWidth) + ": %s%n";
        for (String[] ent : entries) {
            drain.printf(lineFormat, (Object[]) ent);
        }
        drain.flush();
    }

    /**
     * Parse the given command line.
     * The result maps option and argument names to their values; flags are
     * mapped to the string "true". Options that were not given and
     * optional arguments that were omitted are absent from the result.
     */
    public Map<String, String> parse(Iterable<String> values)
            throws ParsingException {
        Map<String, String> ret = new LinkedHashMap<String, String>();
        boolean onlyArguments = false;
        Iterator<String> it = values.iterator();
        Iterator<Argument> argsIt = arguments.iterator();
        while (it.hasNext()) {
            String value = it.next();
            if (! onlyArguments && value.startsWith("-") &&
                    value.length() > 1) {
                Option opt;
                if (value.equals("--")) {
                    onlyArguments = true;
                    continue;
                } else if (value.startsWith("--")) {
                    opt = options.get(value.substring(2));
                } else if (value.length() != 2) {
                    opt = null;
                } else {
                    opt = letterOptions.get(value.charAt(1));
                }
                if (opt == null)
                    throw new ParsingException("Unrecognized option " +
                                               value);
                ret.put(opt.getName(), opt.parse(it));
                // Help short-circuits validation of the remainder.
                if (opt.getName().equals(HELP)) return ret;
                continue;
            }
            if (! argsIt.hasNext())
                throw new ParsingException("Superfluous argument " + value);
            ret.put(argsIt.next().getName(), value);
        }
        while (argsIt.hasNext()) {
            Argument arg = argsIt.next();
            if (! arg.isOptional())
                throw new ParsingException("Missing value for required " +
                    arg.getFullName());
        }
        return ret;
    }

    public Map<String, String> parse(String... values)
            throws ParsingException {
        return parse(Arrays.asList(values));
    }

    private static String makeFormat(int width) {
        return (width == 0) ? "%s" : "%-" + width + "s";
    }

}
