package net.atndebug;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.atndebug.atn.DeserializationOptions;
import net.atndebug.data.ATNCache;
import net.atndebug.data.InterpreterData;
import net.atndebug.data.InterpreterDataReader;
import net.atndebug.debug.Debugger;
import net.atndebug.debug.DebuggerEvent;
import net.atndebug.debug.EventQueue;
import net.atndebug.debug.ParseTreeNode;
import net.atndebug.util.ArgParser;
import net.atndebug.util.Formats;
import net.atndebug.util.Logging;
import net.atndebug.util.config.DynamicConfiguration;
import net.atndebug.util.config.PropertiesConfiguration;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.ATNState;
import org.json.JSONArray;
import org.json.JSONObject;

public class Main implements Runnable {

    public static final String APPNAME = "atndebug";
    public static final String VERSION = "1.0.0";

    private static final Logger LOGGER;

    static {
        Logging.initFormat();
        LOGGER = Logger.getLogger("Main");
    }

    private final String[] args;
    private final PrintStream out;
    private final ATNCache cache;
    private int exitCode;

    public Main(String[] args, PrintStream out) {
        this.args = args;
        this.out = out;
        this.cache = new ATNCache();
    }

    public Main(String[] args) {
        this(args, System.out);
    }

    public int getExitCode() {
        return exitCode;
    }

    protected ArgParser createParser() {
        ArgParser p = new ArgParser(APPNAME);
        p.add(new ArgParser.Option("rule", 'r', "<NAME>",
            "Rule to start parsing at (default: the first rule)."));
        p.add(new ArgParser.Option("input", 'i', "<FILE>",
            "File to parse; without this, only ATN statistics are " +
            "printed."));
        p.add(new ArgParser.Option("json", 'j', null,
            "Print events and the parse tree as JSON."));
        p.add(new ArgParser.Option("no-optimize", null, null,
            "Do not optimize the loaded ATNs."));
        p.add(new ArgParser.Option("bypass", null, null,
            "Generate rule bypass transitions."));
        p.add(new ArgParser.Option("no-verify", null, null,
            "Do not verify the loaded ATNs."));
        p.add(new ArgParser.Option("config", 'C', "<FILE>",
            "Properties file with further configuration."));
        p.add(new ArgParser.Argument("lexer", "Lexer interpreter data."));
        p.add(new ArgParser.Argument("parser", true,
                                     "Parser interpreter data."));
        return p;
    }

    public void run() {
        ArgParser parser = createParser();
        Map<String, String> opts;
        try {
            opts = parser.parse(Arrays.asList(args));
        } catch (ArgParser.ParsingException exc) {
            System.err.println("ERROR: " + exc.getMessage());
            PrintWriter pw = new PrintWriter(System.err);
            parser.writeUsage(pw);
            pw.flush();
            exitCode = 1;
            return;
        }
        if (opts.containsKey(ArgParser.HELP)) {
            PrintWriter pw = new PrintWriter(out);
            parser.writeUsage(pw);
            parser.writeHelp(pw);
            pw.flush();
            return;
        }
        DynamicConfiguration config = DynamicConfiguration.makeDefault();
        if (opts.containsKey("no-optimize"))
            config.put(DeserializationOptions.OPTIMIZE_KEY, "false");
        if (opts.containsKey("bypass"))
            config.put(DeserializationOptions.BYPASS_KEY, "true");
        if (opts.containsKey("no-verify"))
            config.put(DeserializationOptions.VERIFY_KEY, "false");
        try {
            if (opts.containsKey("config"))
                config.addSource(PropertiesConfiguration.fromFile(
                    new File(opts.get("config"))));
            Logging.applyLevel(config);
            DeserializationOptions options =
                DeserializationOptions.fromConfiguration(config);
            LOGGER.config("Deserialization options: " + options);
            exitCode = execute(opts, options);
        } catch (IOException exc) {
            LOGGER.log(Level.SEVERE, "Could not load grammar data", exc);
            System.err.println("ERROR: " + exc.getMessage());
            exitCode = 2;
        }
    }

    protected int execute(Map<String, String> opts,
                          DeserializationOptions options)
            throws IOException {
        final InterpreterDataReader reader =
            new InterpreterDataReader(options);
        ATNCache.Loader loader = new ATNCache.Loader() {
            public InterpreterData load(String key) throws IOException {
                return reader.read(new File(key));
            }
        };
        InterpreterData lexerData = cache.get(opts.get("lexer"), loader);
        InterpreterData parserData = null;
        if (opts.containsKey("parser"))
            parserData = cache.get(opts.get("parser"), loader);
        boolean json = opts.containsKey("json");

        if (! opts.containsKey("input")) {
            printStatistics("lexer", lexerData, json);
            if (parserData != null)
                printStatistics("parser", parserData, json);
            return 0;
        }

        String input = new String(Files.readAllBytes(
            new File(opts.get("input")).toPath()), StandardCharsets.UTF_8);
        String grammarName = new File(opts.get("lexer")).getName();
        EventQueue events = new EventQueue();
        Debugger dbg = new Debugger(null, null, grammarName, lexerData,
                                    parserData, events);
        int ruleIndex = 0;
        if (opts.containsKey("rule")) {
            ruleIndex = dbg.ruleIndexFromName(opts.get("rule"));
            if (ruleIndex == -1) {
                System.err.println("ERROR: Unknown rule " + opts.get("rule"));
                return 1;
            }
        }
        dbg.start(ruleIndex, input);
        boolean hadErrors = false;
        JSONArray eventList = new JSONArray();
        for (DebuggerEvent e : events.drainEvents()) {
            if (e.isError()) hadErrors = true;
            if (json) {
                eventList.put(e.toJSON());
            } else if (e.getType() == DebuggerEvent.Type.OUTPUT) {
                out.println(e.getMessage());
            } else {
                out.println("[" + e.getType().getWireName() + "]");
            }
        }
        ParseTreeNode tree = dbg.getCurrentParseTree();
        if (json) {
            JSONObject result = new JSONObject();
            result.put("events", eventList);
            result.put("tree", (tree == null) ? JSONObject.NULL :
                                                tree.toJSON());
            out.println(result.toString(2));
        } else if (tree != null) {
            StringBuilder sb = new StringBuilder();
            formatTree(sb, tree, 0);
            out.print(sb);
        }
        return (hadErrors) ? 3 : 0;
    }

    private void printStatistics(String label, InterpreterData data,
                                 boolean json) {
        ATN atn = data.getATN();
        if (json) {
            JSONObject obj = new JSONObject();
            obj.put("kind", label);
            obj.put("grammarType", atn.grammarType.toString());
            obj.put("rules", atn.ruleToStartState.length);
            obj.put("states", atn.states.size());
            obj.put("decisions", atn.getNumberOfDecisions());
            obj.put("transitions", countTransitions(atn));
            out.println(obj.toString());
        } else {
            out.printf("%s: %s rules, %s states, %s decisions, " +
                       "%s transitions%n", label, atn.ruleToStartState.length,
                       atn.states.size(), atn.getNumberOfDecisions(),
                       countTransitions(atn));
        }
    }

    private static int countTransitions(ATN atn) {
        int ret = 0;
        for (ATNState s : atn.states) {
            if (s == null) continue;
            ret += s.getNumberOfOptimizedTransitions();
        }
        return ret;
    }

    private static void formatTree(StringBuilder sb, ParseTreeNode node,
                                   int depth) {
        for (int i = 0; i < depth; i++) sb.append("  ");
        switch (node.getType()) {
            case RULE:
                sb.append(node.getName());
                break;
            case TERMINAL:
                sb.append(node.getName()).append(' ').append(
                    Formats.formatString(node.getSymbol().getText()));
                break;
            case ERROR:
                sb.append("<error> ").append(
                    Formats.formatString(node.getSymbol().getText()));
                break;
        }
        sb.append('\n');
        for (ParseTreeNode child : node.getChildren())
            formatTree(sb, child, depth + 1);
    }

    public static void main(String[] args) {
        Logging.redirectToStream(System.err);
        Main m = new Main(args);
        m.run();
        if (m.getExitCode() != 0) System.exit(m.getExitCode());
    }

}
